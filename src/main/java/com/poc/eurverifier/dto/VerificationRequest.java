package com.poc.eurverifier.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationRequest {
    private UploadedWorkbook source;
    private UploadedWorkbook target;

    /**
     * Header names to check. Empty means every column with numeric data in the source.
     */
    @Builder.Default
    private List<String> columns = new ArrayList<>();

    private String sourceSheet; // null = first sheet
    private String targetSheet;
}
