package com.poc.eurverifier.dto;

import lombok.Value;

/**
 * An uploaded .xlsx file held in memory together with its client-supplied name.
 */
@Value
public class UploadedWorkbook {
    String fileName;
    byte[] content;
}
