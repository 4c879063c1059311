package com.DentalCare.chart_backend.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.util.TimeZone;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class TimezoneConfig {

    private final LedgerProperties ledgerProperties;

    @PostConstruct
    public void init() {
        String zone = ledgerProperties.getClinic().getTimezone();
        if (zone != null && !zone.isBlank()) {
            // Dates recorded on entries and visits follow the clinic's local day
            TimeZone.setDefault(TimeZone.getTimeZone(zone));
        }
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }
}
