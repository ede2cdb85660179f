package com.poc.eurverifier.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResponse {
    private Long runId;
    private VerificationReport report;

    /**
     * Download path of the mismatch report, null when the run passed.
     */
    private String reportUrl;
}
