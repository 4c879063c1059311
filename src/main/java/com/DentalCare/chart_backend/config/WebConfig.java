package com.DentalCare.chart_backend.config;

import com.DentalCare.chart_backend.enums.RecordType;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        // ?recordType=patient_problem as well as the enum name
        registry.addConverter(new Converter<String, RecordType>() {
            @Override
            public RecordType convert(String source) {
                RecordType recordType = RecordType.fromString(source);
                if (recordType == null) {
                    throw new IllegalArgumentException(
                            "Record type must be patient_problem or doctor_finding, got '" + source + "'");
                }
                return recordType;
            }
        });
    }
}
