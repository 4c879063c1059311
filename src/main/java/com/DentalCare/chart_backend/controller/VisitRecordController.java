package com.DentalCare.chart_backend.controller;

import com.DentalCare.chart_backend.dto.request.VisitRecordRequest;
import com.DentalCare.chart_backend.dto.response.ApiResponse;
import com.DentalCare.chart_backend.dto.response.VisitRecordResponse;
import com.DentalCare.chart_backend.dto.response.VisitTotalResponse;
import com.DentalCare.chart_backend.model.LedgerScope;
import com.DentalCare.chart_backend.service.ExaminationService;
import com.DentalCare.chart_backend.service.VisitRecordService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/patients/{patientId}/examinations/{examinationId}/visits")
@RequiredArgsConstructor
public class VisitRecordController {

    private final VisitRecordService visitRecordService;
    private final ExaminationService examinationService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<VisitRecordResponse>>> listForExamination(
            @PathVariable Long patientId,
            @PathVariable Long examinationId) {

        LedgerScope scope = examinationService.resolveScope(patientId, examinationId);
        return ResponseEntity.ok(ApiResponse.success(
                visitRecordService.mapToVisitRecordResponses(visitRecordService.listForExamination(scope))));
    }

    @GetMapping("/{visitId}")
    public ResponseEntity<ApiResponse<VisitRecordResponse>> getById(
            @PathVariable Long patientId,
            @PathVariable Long examinationId,
            @PathVariable Long visitId) {

        LedgerScope scope = examinationService.resolveScope(patientId, examinationId);
        return ResponseEntity.ok(ApiResponse.success(
                visitRecordService.mapToVisitRecordResponse(visitRecordService.getById(scope, visitId))));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<VisitRecordResponse>> add(
            @PathVariable Long patientId,
            @PathVariable Long examinationId,
            @Valid @RequestBody VisitRecordRequest request) {

        LedgerScope scope = examinationService.resolveScope(patientId, examinationId);
        VisitRecordResponse visit = visitRecordService.add(scope, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(visit, "Visit recorded successfully"));
    }

    @GetMapping("/total")
    public ResponseEntity<ApiResponse<VisitTotalResponse>> total(
            @PathVariable Long patientId,
            @PathVariable Long examinationId) {

        LedgerScope scope = examinationService.resolveScope(patientId, examinationId);
        return ResponseEntity.ok(ApiResponse.success(visitRecordService.totalResponse(scope)));
    }
}
