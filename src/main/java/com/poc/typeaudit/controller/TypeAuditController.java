package com.poc.typeaudit.controller;

import com.poc.typeaudit.dto.ApiResponse;
import com.poc.typeaudit.dto.ReportResult;
import com.poc.typeaudit.exception.TypeAuditException;
import com.poc.typeaudit.service.FileStorageService;
import com.poc.typeaudit.service.SpreadsheetFormat;
import com.poc.typeaudit.service.TypeAuditService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;

@Slf4j
@RestController
@RequestMapping("/api/excel")
@RequiredArgsConstructor
public class TypeAuditController {

    private final TypeAuditService typeAuditService;
    private final FileStorageService fileStorageService;

    /**
     * Accepts the workbook as the raw request body.
     * Usage: POST /api/excel/upload?filename=types.xlsx with Body -> Binary.
     */
    @PostMapping(value = "/upload", consumes = "*/*")
    public ResponseEntity<ApiResponse<ReportResult>> analyzeUpload(
            HttpServletRequest request,
            @RequestParam("filename") String filename
    ) {
        String contentType = request.getContentType();
        if (contentType != null && contentType.toLowerCase().contains("multipart/form-data")) {
            return ResponseEntity.badRequest().body(ApiResponse.error(
                    "Incorrect upload method. Send the file as a binary body, not as form-data.", "INVALID_REQ"));
        }

        try {
            ReportResult result = typeAuditService.analyzeAndReport(request.getInputStream(), null, filename);
            return ResponseEntity.ok(ApiResponse.success("File processed successfully", result));
        } catch (TypeAuditException e) {
            HttpStatus status = e.getKind().isUserError() ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
            return ResponseEntity.status(status).body(ApiResponse.error(e.getMessage(), e.getKind().getCode()));
        } catch (IOException e) {
            log.error("Could not read upload body for '{}'", filename, e);
            return ResponseEntity.badRequest().body(ApiResponse.error("Could not read the uploaded file.", "UPLOAD_FAIL"));
        }
    }

    @GetMapping("/download/{filename:.+}")
    public ResponseEntity<byte[]> download(@PathVariable("filename") String filename) {
        if (!fileStorageService.exists(filename)) {
            log.warn("Requested report does not exist or is invalid: {}", filename);
            return ResponseEntity.notFound().build();
        }
        try {
            byte[] bytes = fileStorageService.loadFile(filename);
            log.info("Serving report download: {}", filename);
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(SpreadsheetFormat.contentTypeOf(filename)))
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                    .body(bytes);
        } catch (IOException e) {
            log.error("Failed to read report {}", filename, e);
            return ResponseEntity.internalServerError().build();
        }
    }
}
