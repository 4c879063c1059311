package com.DentalCare.chart_backend.controller;

import com.DentalCare.chart_backend.dto.request.ExaminationRequest;
import com.DentalCare.chart_backend.dto.response.ApiResponse;
import com.DentalCare.chart_backend.dto.response.ExaminationResponse;
import com.DentalCare.chart_backend.dto.response.ExaminationStatistics;
import com.DentalCare.chart_backend.exception.ResourceNotFoundException;
import com.DentalCare.chart_backend.model.Examination;
import com.DentalCare.chart_backend.service.ExaminationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/patients/{patientId}/examinations")
@RequiredArgsConstructor
public class ExaminationController {

    private final ExaminationService examinationService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<ExaminationResponse>>> listForPatient(@PathVariable Long patientId) {
        List<Examination> examinations = examinationService.listForPatient(patientId);
        return ResponseEntity.ok(ApiResponse.success(examinationService.mapToExaminationResponses(examinations)));
    }

    @GetMapping("/current")
    public ResponseEntity<ApiResponse<ExaminationResponse>> getCurrent(@PathVariable Long patientId) {
        Examination examination = examinationService.getCurrent(patientId)
                .orElseThrow(() -> new ResourceNotFoundException("Examination", "patientId", patientId));
        return ResponseEntity.ok(ApiResponse.success(examinationService.mapToExaminationResponse(examination)));
    }

    @GetMapping("/statistics")
    public ResponseEntity<ApiResponse<ExaminationStatistics>> statistics(@PathVariable Long patientId) {
        return ResponseEntity.ok(ApiResponse.success(examinationService.statistics(patientId)));
    }

    @GetMapping("/{examinationId}")
    public ResponseEntity<ApiResponse<ExaminationResponse>> getById(
            @PathVariable Long patientId,
            @PathVariable Long examinationId) {

        Examination examination = examinationService.getById(patientId, examinationId);
        return ResponseEntity.ok(ApiResponse.success(examinationService.mapToExaminationResponse(examination)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ExaminationResponse>> create(
            @PathVariable Long patientId,
            @Valid @RequestBody ExaminationRequest request) {

        Examination examination = examinationService.create(patientId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(examinationService.mapToExaminationResponse(examination),
                        "Examination created successfully"));
    }

    @PutMapping("/{examinationId}")
    public ResponseEntity<ApiResponse<ExaminationResponse>> update(
            @PathVariable Long patientId,
            @PathVariable Long examinationId,
            @Valid @RequestBody ExaminationRequest request) {

        Examination examination = examinationService.update(patientId, examinationId, request);
        return ResponseEntity.ok(ApiResponse.success(examinationService.mapToExaminationResponse(examination),
                "Examination updated successfully"));
    }

    @DeleteMapping("/{examinationId}")
    public ResponseEntity<ApiResponse<Void>> delete(
            @PathVariable Long patientId,
            @PathVariable Long examinationId) {

        examinationService.delete(patientId, examinationId);
        return ResponseEntity.ok(ApiResponse.success(null, "Examination deleted successfully"));
    }
}
