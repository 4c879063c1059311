package com.DentalCare.chart_backend.controller;

import com.DentalCare.chart_backend.dto.request.PatientRequest;
import com.DentalCare.chart_backend.dto.response.ApiResponse;
import com.DentalCare.chart_backend.dto.response.PatientResponse;
import com.DentalCare.chart_backend.dto.response.VisitRangeResponse;
import com.DentalCare.chart_backend.model.VisitRecord;
import com.DentalCare.chart_backend.service.PatientService;
import com.DentalCare.chart_backend.service.VisitRecordService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/patients")
@RequiredArgsConstructor
public class PatientController {

    private final PatientService patientService;
    private final VisitRecordService visitRecordService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<PatientResponse>>> getAllPatients() {
        return ResponseEntity.ok(ApiResponse.success(patientService.getAllPatients()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<PatientResponse>> getPatientById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(patientService.getPatientById(id)));
    }

    @GetMapping("/{id}/visits")
    public ResponseEntity<ApiResponse<VisitRangeResponse>> getPatientVisits(@PathVariable Long id) {
        patientService.getPatient(id);
        List<VisitRecord> visits = visitRecordService.listForPatient(id);
        return ResponseEntity.ok(ApiResponse.success(
                visitRecordService.mapToRangeResponse(visits, visitRecordService.totalForPatient(id))));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<PatientResponse>> createPatient(@Valid @RequestBody PatientRequest request) {
        PatientResponse patient = patientService.createPatient(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(patient, "Patient created successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<PatientResponse>> updatePatient(
            @PathVariable Long id,
            @Valid @RequestBody PatientRequest request) {

        PatientResponse patient = patientService.updatePatient(id, request);
        return ResponseEntity.ok(ApiResponse.success(patient, "Patient updated successfully"));
    }
}
