package com.poc.eurverifier.service;

import com.poc.eurverifier.dto.*;
import com.poc.eurverifier.engine.ColumnSelection;
import com.poc.eurverifier.engine.Grid;
import com.poc.eurverifier.engine.VerificationEngine;
import com.poc.eurverifier.entity.VerificationRun;
import com.poc.eurverifier.exception.RunNotFoundException;
import com.poc.eurverifier.repository.VerificationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationService {

    private static final String REPORT_FOLDER = "Mismatch_Reports/";
    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile("(_\\d{14})$");

    private final ExcelService excelService;
    private final VerificationEngine verificationEngine;
    private final FileStorageService fileStorageService;
    private final VerificationRunRepository runRepository;

    @Value("${verifier.runs.page-size:50}")
    private int runsPageSize = 50;

    @Transactional(rollbackFor = Exception.class)
    public VerificationResponse verify(VerificationRequest request) throws IOException {
        UploadedWorkbook source = request.getSource();
        UploadedWorkbook target = request.getTarget();
        log.info("Verifying '{}' against '{}'", source.getFileName(), target.getFileName());

        Grid sourceGrid = excelService.readGrid(new ByteArrayInputStream(source.getContent()), request.getSourceSheet());
        Grid targetGrid = excelService.readGrid(new ByteArrayInputStream(target.getContent()), request.getTargetSheet());

        VerificationReport report = verificationEngine.verify(sourceGrid, targetGrid, toSelection(request.getColumns()));

        VerificationRun run = new VerificationRun();
        run.setSourceFileName(source.getFileName());
        run.setTargetFileName(target.getFileName());
        run.setSourceSha256(DigestUtils.sha256Hex(source.getContent()));
        run.setTargetSha256(DigestUtils.sha256Hex(target.getContent()));
        run.setSourceSheet(request.getSourceSheet());
        run.setTargetSheet(request.getTargetSheet());
        run.setCheckedColumns(abbreviate(String.join(", ", report.getColumns()), VerificationRun.CHECKED_COLUMNS_LENGTH));
        run.setPassed(report.isPassed());
        run.setCheckedCount(report.getCheckedCount());
        run.setSkippedCount(report.getSkippedCount());
        run.setDiscrepancyCount(report.getDiscrepancyCount());

        // Saved first so the report file name can carry the run id
        VerificationRun saved = runRepository.save(run);

        if (!report.isPassed()) {
            log.warn("Verification failed: found {} discrepancies in '{}'", report.getDiscrepancyCount(), target.getFileName());
            String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMddHHmmss"));
            String reportFileName = REPORT_FOLDER
                    + generateCleanFileName(target.getFileName(), "MISMATCH_" + saved.getId() + "_", timestamp);
            fileStorageService.saveFile(excelService.generateMismatchReport(report), reportFileName);
            saved.setReportFileName(reportFileName);
            saved = runRepository.save(saved);
        }

        String reportUrl = saved.getReportFileName() == null ? null : "/api/verification/runs/" + saved.getId() + "/report";
        return new VerificationResponse(saved.getId(), report, reportUrl);
    }

    public HeadersResponse readHeaders(VerificationRequest request) throws IOException {
        List<String> sourceHeaders = excelService.readHeaders(
                new ByteArrayInputStream(request.getSource().getContent()), request.getSourceSheet());
        List<String> targetHeaders = excelService.readHeaders(
                new ByteArrayInputStream(request.getTarget().getContent()), request.getTargetSheet());

        Set<String> targetSet = new HashSet<>(targetHeaders);
        List<String> common = sourceHeaders.stream()
                .filter(targetSet::contains)
                .collect(Collectors.toList());
        return new HeadersResponse(sourceHeaders, targetHeaders, common);
    }

    public List<RunSummary> listRuns() {
        return runRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, runsPageSize)).stream()
                .map(RunSummary::from)
                .collect(Collectors.toList());
    }

    public RunSummary getRun(Long runId) {
        return RunSummary.from(findRun(runId));
    }

    public ReportFile loadMismatchReport(Long runId) throws IOException {
        VerificationRun run = findRun(runId);
        if (run.getReportFileName() == null) {
            throw new RunNotFoundException("Run " + runId + " passed; no mismatch report was generated");
        }
        byte[] content = fileStorageService.loadFile(run.getReportFileName());
        String fileName = run.getReportFileName().substring(REPORT_FOLDER.length());
        return new ReportFile(fileName, content);
    }

    private VerificationRun findRun(Long runId) {
        return runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private ColumnSelection toSelection(List<String> columns) {
        List<String> cleaned = columns == null ? List.of() : columns.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());
        return cleaned.isEmpty() ? ColumnSelection.allNumeric() : ColumnSelection.explicit(cleaned);
    }

    private static String abbreviate(String text, int maxLength) {
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength - 3) + "...";
    }

    private String generateCleanFileName(String originalFilename, String prefix, String newTimestamp) {
        if (originalFilename == null) originalFilename = "Unknown_File.xlsx";

        int dotIndex = originalFilename.lastIndexOf('.');
        String baseName = (dotIndex == -1) ? originalFilename : originalFilename.substring(0, dotIndex);
        baseName = baseName.replaceAll("[^a-zA-Z0-9_\\- ]", "_");

        Matcher matcher = TIMESTAMP_PATTERN.matcher(baseName);
        if (matcher.find()) {
            baseName = baseName.substring(0, matcher.start());
        }

        return prefix + baseName + "_" + newTimestamp + ".xlsx";
    }
}
