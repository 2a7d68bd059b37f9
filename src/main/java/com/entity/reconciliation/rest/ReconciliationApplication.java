package com.entity.reconciliation.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Entity Reconciliation API",
                version = "1.0.0",
                description = "Triggers reconciliation runs that crosswalk, merge, audit and historize " +
                        "entities delivered by two source systems, and exposes run status, conflicts " +
                        "and dimension history."
        )
)
public class ReconciliationApplication extends Application {
}
