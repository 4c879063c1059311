package com.DentalCare.chart_backend.controller;

import com.DentalCare.chart_backend.dto.response.ApiResponse;
import com.DentalCare.chart_backend.dto.response.ImportResult;
import com.DentalCare.chart_backend.exception.ApiException;
import com.DentalCare.chart_backend.exception.ValidationException;
import com.DentalCare.chart_backend.service.DataTransferService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/transfer")
@RequiredArgsConstructor
@Slf4j
public class DataTransferController {

    private static final MediaType CSV = MediaType.parseMediaType("text/csv");
    private static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final DataTransferService dataTransferService;

    @GetMapping("/patients/{patientId}/export")
    public ResponseEntity<byte[]> exportPatient(
            @PathVariable Long patientId,
            @RequestParam(defaultValue = "csv") String format) {

        boolean xlsx = isXlsx(format);
        byte[] content = xlsx
                ? dataTransferService.exportPatientXlsx(patientId)
                : dataTransferService.exportPatientCsv(patientId);
        return download(content, "patient-" + patientId, xlsx);
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> exportAll(@RequestParam(defaultValue = "csv") String format) {
        boolean xlsx = isXlsx(format);
        byte[] content = xlsx ? dataTransferService.exportAllXlsx() : dataTransferService.exportAllCsv();
        return download(content, "dental-records", xlsx);
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ImportResult>> importCsv(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            throw ValidationException.forField("file", "file", "The uploaded file is empty");
        }

        log.info("Importing {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        try (InputStream in = file.getInputStream()) {
            ImportResult result = dataTransferService.importCsv(in);
            String message = String.format("Import finished: %d created, %d updated, %d errors",
                    result.getCreated(), result.getUpdated(), result.getErrors().size());
            return ResponseEntity.ok(ApiResponse.success(result, message));
        } catch (IOException e) {
            log.error("Failed to read uploaded file: {}", e.getMessage(), e);
            throw new ApiException("Failed to read uploaded file", HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", e);
        }
    }

    private static boolean isXlsx(String format) {
        if ("xlsx".equalsIgnoreCase(format)) {
            return true;
        }
        if ("csv".equalsIgnoreCase(format)) {
            return false;
        }
        throw ValidationException.forField("export", "format", "Format must be csv or xlsx");
    }

    private static ResponseEntity<byte[]> download(byte[] content, String baseName, boolean xlsx) {
        String filename = baseName + "-" + LocalDate.now() + (xlsx ? ".xlsx" : ".csv");
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(xlsx ? XLSX : CSV)
                .body(content);
    }
}
