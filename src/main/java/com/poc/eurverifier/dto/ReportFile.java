package com.poc.eurverifier.dto;

import lombok.Value;

@Value
public class ReportFile {
    String fileName;
    byte[] content;
}
