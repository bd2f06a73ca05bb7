package com.company.obscalc;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableAsync
@OpenAPIDefinition(
        info = @Info(
                title = "Observation Calculation Cache API",
                version = "1.0.0",
                description = "Invalidation-driven cache of per-observation calculation results"
        )
)
public class ObscalcServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ObscalcServiceApplication.class, args);
    }
}
