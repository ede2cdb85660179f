package com.poc.eurverifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "verifier.storage.path=target/test-output/")
@DisplayName("End-to-end verification")
class EurVerifierApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }

    @Test
    @DisplayName("Should verify uploads, record the run and serve its mismatch report")
    void verifyAndDownloadReport() throws Exception {
        List<String> headers = List.of("Item", "Price");
        byte[] bgn = WorkbookFixtures.workbook(headers, List.of(
                row("Apples", new BigDecimal("100.00")),
                row("Pears", new BigDecimal("195.583")),
                row("Total", "=SUM(B2:B3)")));
        byte[] eur = WorkbookFixtures.workbook(headers, List.of(
                row("Apples", "=ROUND(100/1.95583,2)"),
                row("Pears", new BigDecimal("99.99")),
                row("Total", new BigDecimal("151.13"))));

        String body = mockMvc.perform(multipart("/api/verification")
                        .file(new MockMultipartFile("source", "prices_bgn.xlsx", null, bgn))
                        .file(new MockMultipartFile("target", "prices_eur.xlsx", null, eur))
                        .param("columns", "Price"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.report.passed").value(false))
                .andExpect(jsonPath("$.data.report.checkedCount").value(3))
                .andExpect(jsonPath("$.data.report.discrepancies.length()").value(1))
                .andExpect(jsonPath("$.data.report.discrepancies[0].rowNumber").value(3))
                .andExpect(jsonPath("$.data.report.discrepancies[0].expectedValue").value(100.0))
                .andReturn().getResponse().getContentAsString();

        JsonNode data = objectMapper.readTree(body).get("data");
        long runId = data.get("runId").asLong();

        mockMvc.perform(get("/api/verification/runs/" + runId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.passed").value(false))
                .andExpect(jsonPath("$.data.reportAvailable").value(true));

        byte[] report = mockMvc.perform(get(data.get("reportUrl").asText()))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsByteArray();
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(report))) {
            assertThat(workbook.getSheet("Discrepancies").getRow(1).getCell(1).getStringCellValue()).isEqualTo("Price");
        }
    }

    @Test
    @DisplayName("Should reject a column that the target does not have")
    void unknownColumn() throws Exception {
        byte[] bgn = WorkbookFixtures.workbook(List.of("Price", "Vat"), List.of(row(100, 20)));
        byte[] eur = WorkbookFixtures.workbook(List.of("Price"), List.of(row(51.13)));

        mockMvc.perform(multipart("/api/verification")
                        .file(new MockMultipartFile("source", "a.xlsx", null, bgn))
                        .file(new MockMultipartFile("target", "b.xlsx", null, eur))
                        .param("columns", "Price", "Vat"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_COLUMNS"));
    }
}
