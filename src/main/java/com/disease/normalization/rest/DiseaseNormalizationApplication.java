package com.disease.normalization.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Disease Normalizer API",
                version = "0.5.0",
                description = "Normalizes free-text disease terms and concept ids against NCIt, Mondo, " +
                        "OMIM, OncoTree and the Disease Ontology, merging equivalent concepts " +
                        "through their cross-references.",
                license = @License(
                        name = "MIT",
                        url = "https://opensource.org/licenses/MIT"
                )
        )
)
public class DiseaseNormalizationApplication extends Application {
}
