package com.poc.eurverifier.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeadersResponse {
    private List<String> sourceHeaders;
    private List<String> targetHeaders;

    /**
     * Headers present in both files, in source order. Offered as the default selection.
     */
    private List<String> commonHeaders;
}
