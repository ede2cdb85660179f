package com.poc.eurverifier.dto;

import com.poc.eurverifier.entity.VerificationRun;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class RunSummary {
    private Long id;
    private String sourceFileName;
    private String targetFileName;
    private String sourceSha256;
    private String targetSha256;
    private String checkedColumns;
    private boolean passed;
    private int checkedCount;
    private int skippedCount;
    private int discrepancyCount;
    private boolean reportAvailable;
    private LocalDateTime createdAt;

    public static RunSummary from(VerificationRun run) {
        return RunSummary.builder()
                .id(run.getId())
                .sourceFileName(run.getSourceFileName())
                .targetFileName(run.getTargetFileName())
                .sourceSha256(run.getSourceSha256())
                .targetSha256(run.getTargetSha256())
                .checkedColumns(run.getCheckedColumns())
                .passed(run.isPassed())
                .checkedCount(run.getCheckedCount())
                .skippedCount(run.getSkippedCount())
                .discrepancyCount(run.getDiscrepancyCount())
                .reportAvailable(run.getReportFileName() != null)
                .createdAt(run.getCreatedAt())
                .build();
    }
}
