package com.DentalCare.chart_backend.controller;

import com.DentalCare.chart_backend.dto.response.ApiResponse;
import com.DentalCare.chart_backend.dto.response.ExaminationStatistics;
import com.DentalCare.chart_backend.dto.response.VisitRangeResponse;
import com.DentalCare.chart_backend.dto.response.VisitStatistics;
import com.DentalCare.chart_backend.model.VisitRecord;
import com.DentalCare.chart_backend.service.ExaminationService;
import com.DentalCare.chart_backend.service.VisitRecordService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    private final VisitRecordService visitRecordService;
    private final ExaminationService examinationService;

    @GetMapping("/visits")
    public ResponseEntity<ApiResponse<VisitRangeResponse>> getVisitsByDateRange(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        List<VisitRecord> visits = visitRecordService.listByDateRange(startDate, endDate);
        VisitStatistics statistics = visitRecordService.statistics(startDate, endDate);
        log.debug("Found {} visits between {} and {}", visits.size(), startDate, endDate);
        return ResponseEntity.ok(ApiResponse.success(
                visitRecordService.mapToRangeResponse(visits, statistics.getTotalRevenue())));
    }

    @GetMapping("/visits/statistics")
    public ResponseEntity<ApiResponse<VisitStatistics>> getVisitStatistics(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        VisitStatistics statistics = visitRecordService.statistics(startDate, endDate);
        return ResponseEntity.ok(ApiResponse.success(statistics, "Visit statistics fetched successfully"));
    }

    @GetMapping("/examinations/statistics")
    public ResponseEntity<ApiResponse<ExaminationStatistics>> getExaminationStatistics() {
        return ResponseEntity.ok(ApiResponse.success(examinationService.statistics(null)));
    }
}
