package com.DentalCare.chart_backend.controller;

import com.DentalCare.chart_backend.dto.request.CustomStatusRequest;
import com.DentalCare.chart_backend.dto.request.CustomStatusUpdateRequest;
import com.DentalCare.chart_backend.dto.response.ApiResponse;
import com.DentalCare.chart_backend.dto.response.StatusDescriptor;
import com.DentalCare.chart_backend.dto.response.StatusGroup;
import com.DentalCare.chart_backend.service.StatusRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/statuses")
@RequiredArgsConstructor
public class StatusController {

    private final StatusRegistryService statusRegistryService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<StatusGroup>>> listActive() {
        return ResponseEntity.ok(ApiResponse.success(statusRegistryService.listActive()));
    }

    @GetMapping("/custom")
    public ResponseEntity<ApiResponse<List<StatusDescriptor>>> listCustom() {
        return ResponseEntity.ok(ApiResponse.success(statusRegistryService.listCustom()));
    }

    @GetMapping("/{code}")
    public ResponseEntity<ApiResponse<StatusDescriptor>> describe(@PathVariable String code) {
        return ResponseEntity.ok(ApiResponse.success(statusRegistryService.describe(code)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<StatusDescriptor>> registerCustom(
            @Valid @RequestBody CustomStatusRequest request) {

        StatusDescriptor status = statusRegistryService.registerCustom(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(status, "Custom status registered successfully"));
    }

    @PutMapping("/{code}")
    public ResponseEntity<ApiResponse<StatusDescriptor>> update(
            @PathVariable String code,
            @Valid @RequestBody CustomStatusUpdateRequest request) {

        StatusDescriptor status = statusRegistryService.update(code, request);
        return ResponseEntity.ok(ApiResponse.success(status, "Custom status updated successfully"));
    }

    @PostMapping("/{code}/deactivate")
    public ResponseEntity<ApiResponse<StatusDescriptor>> deactivate(@PathVariable String code) {
        return ResponseEntity.ok(ApiResponse.success(statusRegistryService.deactivate(code),
                "Custom status deactivated"));
    }

    @PostMapping("/{code}/activate")
    public ResponseEntity<ApiResponse<StatusDescriptor>> activate(@PathVariable String code) {
        return ResponseEntity.ok(ApiResponse.success(statusRegistryService.activate(code),
                "Custom status activated"));
    }
}
