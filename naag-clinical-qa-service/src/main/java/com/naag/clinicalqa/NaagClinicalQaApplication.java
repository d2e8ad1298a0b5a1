package com.naag.clinicalqa;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@OpenAPIDefinition(
    info = @Info(
        title = "NAAG Clinical Q&A API",
        version = "1.0.0",
        description = "Keyword retrieval, facet filtering and related-concept lookup " +
                     "over a static clinical question/answer dataset."
    )
)
public class NaagClinicalQaApplication {
    public static void main(String[] args) {
        SpringApplication.run(NaagClinicalQaApplication.class, args);
    }
}
