package com.DentalCare.chart_backend.config;

import com.DentalCare.chart_backend.dto.request.CustomStatusRequest;
import com.DentalCare.chart_backend.enums.BuiltInStatus;
import com.DentalCare.chart_backend.exception.ApiException;
import com.DentalCare.chart_backend.service.StatusRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataInitializer {

    private final StatusRegistryService statusRegistryService;
    private final LedgerProperties ledgerProperties;

    @Bean
    CommandLineRunner initStatusRegistry() {
        return args -> {
            seedClinicStatuses();
            log.info("Status registry ready: {} built-in, {} active total",
                    BuiltInStatus.values().length, statusRegistryService.countActive());
        };
    }

    private void seedClinicStatuses() {
        for (LedgerProperties.SeedStatus seed : ledgerProperties.getStatuses().getSeed()) {
            if (seed.getCode() == null || seed.getCode().isBlank()) {
                log.warn("Skipping seeded status without a code");
                continue;
            }
            if (statusRegistryService.isKnown(seed.getCode())) {
                log.debug("Seeded status {} already registered", seed.getCode());
                continue;
            }
            try {
                statusRegistryService.registerCustom(CustomStatusRequest.builder()
                        .code(seed.getCode())
                        .displayName(seed.getDisplayName() != null ? seed.getDisplayName() : seed.getCode())
                        .color(seed.getColor())
                        .category(seed.getCategory())
                        .build());
                log.info("Seeded clinic status: {}", seed.getCode());
            } catch (ApiException e) {
                log.warn("Could not seed status {}: {}", seed.getCode(), e.getMessage());
            }
        }
    }
}
