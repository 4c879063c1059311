package com.DentalCare.chart_backend.controller;

import com.DentalCare.chart_backend.dto.request.ToothHistoryRequest;
import com.DentalCare.chart_backend.dto.response.ApiResponse;
import com.DentalCare.chart_backend.dto.response.CurrentToothStatus;
import com.DentalCare.chart_backend.dto.response.ToothHistoryEntryResponse;
import com.DentalCare.chart_backend.dto.response.ToothHistoryStatistics;
import com.DentalCare.chart_backend.dto.response.ToothSummaryResponse;
import com.DentalCare.chart_backend.enums.RecordType;
import com.DentalCare.chart_backend.model.LedgerScope;
import com.DentalCare.chart_backend.model.ToothHistoryEntry;
import com.DentalCare.chart_backend.service.ExaminationService;
import com.DentalCare.chart_backend.service.PatientService;
import com.DentalCare.chart_backend.service.ToothHistoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/patients/{patientId}")
@RequiredArgsConstructor
@Slf4j
public class ToothHistoryController {

    private final ToothHistoryService toothHistoryService;
    private final ExaminationService examinationService;
    private final PatientService patientService;

    @PostMapping("/examinations/{examinationId}/teeth/{toothNumber}/history")
    public ResponseEntity<ApiResponse<ToothHistoryEntryResponse>> record(
            @PathVariable Long patientId,
            @PathVariable Long examinationId,
            @PathVariable Integer toothNumber,
            @Valid @RequestBody ToothHistoryRequest request) {

        LedgerScope scope = examinationService.resolveScope(patientId, examinationId);
        ToothHistoryEntry entry = toothHistoryService.record(scope, toothNumber, request.getRecordType(),
                request.getStatuses(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(toothHistoryService.mapToResponse(entry), "Tooth history recorded"));
    }

    @GetMapping("/examinations/{examinationId}/teeth/{toothNumber}/history")
    public ResponseEntity<ApiResponse<List<ToothHistoryEntryResponse>>> history(
            @PathVariable Long patientId,
            @PathVariable Long examinationId,
            @PathVariable Integer toothNumber,
            @RequestParam RecordType recordType) {

        LedgerScope scope = examinationService.resolveScope(patientId, examinationId);
        List<ToothHistoryEntry> entries = toothHistoryService.history(scope, toothNumber, recordType);
        return ResponseEntity.ok(ApiResponse.success(toothHistoryService.mapToResponses(entries)));
    }

    @GetMapping("/examinations/{examinationId}/teeth/{toothNumber}/current")
    public ResponseEntity<ApiResponse<CurrentToothStatus>> currentStatus(
            @PathVariable Long patientId,
            @PathVariable Long examinationId,
            @PathVariable Integer toothNumber,
            @RequestParam RecordType recordType) {

        LedgerScope scope = examinationService.resolveScope(patientId, examinationId);
        return ResponseEntity.ok(ApiResponse.success(
                toothHistoryService.currentStatus(scope, toothNumber, recordType)));
    }

    @GetMapping("/examinations/{examinationId}/teeth/summary")
    public ResponseEntity<ApiResponse<ToothSummaryResponse>> toothSummary(
            @PathVariable Long patientId,
            @PathVariable Long examinationId) {

        LedgerScope scope = examinationService.resolveScope(patientId, examinationId);
        return ResponseEntity.ok(ApiResponse.success(toothHistoryService.toothSummary(scope)));
    }

    @GetMapping("/teeth/statistics")
    public ResponseEntity<ApiResponse<ToothHistoryStatistics>> statistics(@PathVariable Long patientId) {
        patientService.getPatient(patientId);
        return ResponseEntity.ok(ApiResponse.success(toothHistoryService.statistics(patientId)));
    }
}
