package com.poc.eurverifier.controller;

import com.poc.eurverifier.dto.*;
import com.poc.eurverifier.service.VerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/verification")
@RequiredArgsConstructor
public class VerificationController {

    static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final VerificationService verificationService;

    /**
     * Verifies the EUR target workbook against the BGN source workbook.
     * Without {@code columns} every column holding numbers in the source is checked.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<VerificationResponse>> verify(
            @RequestParam("source") MultipartFile source,
            @RequestParam("target") MultipartFile target,
            @RequestParam(value = "columns", required = false) List<String> columns,
            @RequestParam(value = "sourceSheet", required = false) String sourceSheet,
            @RequestParam(value = "targetSheet", required = false) String targetSheet
    ) throws IOException {
        VerificationRequest request = VerificationRequest.builder()
                .source(toWorkbook(source))
                .target(toWorkbook(target))
                .columns(columns == null ? List.of() : columns)
                .sourceSheet(sourceSheet)
                .targetSheet(targetSheet)
                .build();

        VerificationResponse response = verificationService.verify(request);
        VerificationReport report = response.getReport();
        String message = report.isPassed()
                ? String.format("Verification complete. No mismatches found in %d rows across %d columns.",
                        report.getSourceRowCount(), report.getColumns().size())
                : String.format("Found %d mismatches.", report.getDiscrepancyCount());
        return ResponseEntity.ok(ApiResponse.success(message, response));
    }

    @PostMapping(value = "/headers", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<HeadersResponse>> headers(
            @RequestParam("source") MultipartFile source,
            @RequestParam("target") MultipartFile target,
            @RequestParam(value = "sourceSheet", required = false) String sourceSheet,
            @RequestParam(value = "targetSheet", required = false) String targetSheet
    ) throws IOException {
        VerificationRequest request = VerificationRequest.builder()
                .source(toWorkbook(source))
                .target(toWorkbook(target))
                .sourceSheet(sourceSheet)
                .targetSheet(targetSheet)
                .build();
        return ResponseEntity.ok(ApiResponse.success("Headers extracted", verificationService.readHeaders(request)));
    }

    @GetMapping("/runs")
    public ResponseEntity<ApiResponse<List<RunSummary>>> listRuns() {
        return ResponseEntity.ok(ApiResponse.success("Recent verification runs", verificationService.listRuns()));
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<ApiResponse<RunSummary>> getRun(@PathVariable("id") Long id) {
        return ResponseEntity.ok(ApiResponse.success("Verification run", verificationService.getRun(id)));
    }

    @GetMapping("/runs/{id}/report")
    public ResponseEntity<byte[]> downloadReport(@PathVariable("id") Long id) throws IOException {
        ReportFile file = verificationService.loadMismatchReport(id);
        return ResponseEntity.ok()
                .contentType(XLSX)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(file.getFileName()).build().toString())
                .body(file.getContent());
    }

    private UploadedWorkbook toWorkbook(MultipartFile file) throws IOException {
        return new UploadedWorkbook(file.getOriginalFilename(), file.getBytes());
    }
}
