package com.company.cropstress;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@OpenAPIDefinition(
        info = @Info(
                title = "Crop Stress Service API",
                version = "1.0.0",
                description = "Field-level crop stress analysis from multi-date satellite imagery"
        )
)
public class CropStressServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CropStressServiceApplication.class, args);
    }
}
