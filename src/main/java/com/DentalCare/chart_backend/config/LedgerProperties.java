package com.DentalCare.chart_backend.config;

import com.DentalCare.chart_backend.enums.StatusCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "dental")
@Data
public class LedgerProperties {

    private Visits visits = new Visits();
    private Statuses statuses = new Statuses();
    private Clinic clinic = new Clinic();

    @Data
    public static class Visits {
        /**
         * Append one doctor_finding entry per affected tooth when a visit is added.
         */
        private boolean deriveDoctorFindings = true;
        private String defaultFindingStatus = "treated";
    }

    @Data
    public static class Statuses {
        /**
         * Clinic-defined statuses registered at start-up when missing.
         */
        private List<SeedStatus> seed = new ArrayList<>();
    }

    @Data
    public static class SeedStatus {
        private String code;
        private String displayName;
        private String color = "#808080";
        private StatusCategory category = StatusCategory.OTHER;
    }

    @Data
    public static class Clinic {
        private String timezone;
    }
}
