package com.rodoc.ocr;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@OpenAPIDefinition(
        info = @Info(
                title = "Romanian Document Reader API",
                version = "1.0",
                description = "Classifies Romanian identity cards and medical documents and extracts confidence-scored fields.",
                contact = @Contact(name = "Romanian Document Reader")))
@SpringBootApplication
@ConfigurationPropertiesScan
public class RodocOcrApplication {

    public static void main(String[] args) {
        SpringApplication.run(RodocOcrApplication.class, args);
    }
}
