package com.poc.typeaudit.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.typeaudit.service.TestWorkbooks;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static com.poc.typeaudit.service.TestWorkbooks.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "excel.storage.path=target/test-reports/")
@AutoConfigureMockMvc
class TypeAuditControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Upload returns the report name and the report can be downloaded")
    void shouldProcessUploadAndServeReport() throws Exception {
        byte[] input = TestWorkbooks.xlsx("Data",
                row("Name", "Data Type"), row("x", "int"), row("x", "int"), row("x", "str"));

        MvcResult upload = mockMvc.perform(post("/api/excel/upload")
                        .param("filename", "types.xlsx")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(input))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.flaggedRows").value(1))
                .andReturn();

        JsonNode body = objectMapper.readTree(upload.getResponse().getContentAsByteArray());
        String filename = body.at("/data/outputFilename").asText();
        assertTrue(filename.startsWith("result_types_"), filename);

        MvcResult download = mockMvc.perform(get("/api/excel/download/" + filename))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"))
                .andReturn();

        try (Workbook report = TestWorkbooks.open(download.getResponse().getContentAsByteArray())) {
            assertEquals(2, report.getNumberOfSheets());
        }
    }

    @Test
    void shouldReturnBadRequestForMissingColumns() throws Exception {
        byte[] input = TestWorkbooks.xlsx("Data", row("Name", "Type"), row("x", "int"));

        mockMvc.perform(post("/api/excel/upload")
                        .param("filename", "types.xlsx")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(input))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("MISSING_COLUMNS"));
    }

    @Test
    void shouldReturnBadRequestForUnsupportedFormat() throws Exception {
        mockMvc.perform(post("/api/excel/upload")
                        .param("filename", "types.csv")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content("Name,Data Type".getBytes()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("UNSUPPORTED_FORMAT"));
    }

    @Test
    void shouldReturnNotFoundForUnknownReport() throws Exception {
        mockMvc.perform(get("/api/excel/download/result_nothing.xlsx"))
                .andExpect(status().isNotFound());
    }
}
