package com.entity.reconciliation.rest;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.pipeline.ReconciliationPipeline;
import com.entity.reconciliation.rest.dto.DimensionVersionResponse;
import com.entity.reconciliation.rest.dto.ErrorResponse;
import com.entity.reconciliation.scd.DimensionVersion;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * REST resource for SCD type-2 dimension history.
 */
@Path("/api/v1/dimensions")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Dimensions", description = "Read historized dimension versions")
public class DimensionResource {

    private final ReconciliationPipeline pipeline;

    @Inject
    public DimensionResource(ReconciliationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * GET /api/v1/dimensions/{entityType}/{masterId}?asOf=...
     */
    @GET
    @Path("/{entityType}/{masterId}")
    @Operation(summary = "Version history of a dimension entity",
            description = "Returns all versions oldest first, or only the version in effect at asOf.")
    @APIResponse(responseCode = "200", description = "Versions found")
    @APIResponse(responseCode = "404", description = "No history for the master id")
    public Response getHistory(@PathParam("entityType") String entityType,
                               @PathParam("masterId") String masterId,
                               @Parameter(description = "ISO-8601 instant") @QueryParam("asOf") String asOf) {
        String path = "/api/v1/dimensions/" + entityType + "/" + masterId;
        try {
            EntityType type = EntityType.fromName(entityType);
            List<DimensionVersion> versions;
            if (asOf != null && !asOf.isBlank()) {
                Optional<DimensionVersion> version = pipeline.getDimensionRepository()
                        .findAsOf(type, masterId, Instant.parse(asOf));
                versions = version.map(List::of).orElse(List.of());
            } else {
                versions = pipeline.getDimensionRepository().findHistory(type, masterId);
            }
            if (versions.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound("No dimension history for " + masterId, path))
                        .build();
            }
            return Response.ok(versions.stream().map(DimensionVersionResponse::from).toList()).build();
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        }
    }
}
