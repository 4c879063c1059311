package com.DentalCare.chart_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChartBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChartBackendApplication.class, args);
    }
}
