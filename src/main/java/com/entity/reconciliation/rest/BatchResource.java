package com.entity.reconciliation.rest;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.error.InvalidInputException;
import com.entity.reconciliation.pipeline.BatchResult;
import com.entity.reconciliation.pipeline.BatchRun;
import com.entity.reconciliation.pipeline.ReconciliationPipeline;
import com.entity.reconciliation.rest.dto.BatchResponse;
import com.entity.reconciliation.rest.dto.BatchRunResponse;
import com.entity.reconciliation.rest.dto.ConflictResponse;
import com.entity.reconciliation.rest.dto.ErrorResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * REST resource for triggering and inspecting reconciliation runs.
 */
@Path("/api/v1/batches")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Batches", description = "Run the reconciliation pipeline and inspect run results")
public class BatchResource {
    private static final Logger log = LoggerFactory.getLogger(BatchResource.class);

    private final ReconciliationPipeline pipeline;

    @Inject
    public BatchResource(ReconciliationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * POST /api/v1/batches/{entityType}/{batchId}
     */
    @POST
    @Path("/{entityType}/{batchId}")
    @Operation(summary = "Process a batch",
            description = "Runs crosswalk, merge, conflict logging and historization for one entity type and batch.")
    @APIResponse(responseCode = "200", description = "Run succeeded")
    @APIResponse(responseCode = "400", description = "Unknown entity type or invalid batch id")
    @APIResponse(responseCode = "409", description = "Run failed; the body carries the cause")
    public Response processBatch(@PathParam("entityType") String entityType, @PathParam("batchId") String batchId) {
        String path = "/api/v1/batches/" + entityType + "/" + batchId;
        try {
            BatchResult result = pipeline.processBatch(EntityType.fromName(entityType), batchId);
            Response.Status status = result.isSuccess() ? Response.Status.OK : Response.Status.CONFLICT;
            return Response.status(status).entity(BatchResponse.from(result)).build();
        } catch (InvalidInputException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e, path))
                    .build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("batch.request.failed entityType={} batchId={} error={}", entityType, batchId, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * POST /api/v1/batches/{batchId}
     */
    @POST
    @Path("/{batchId}")
    @Operation(summary = "Process a batch for every entity type",
            description = "Runs all configured entity types for the batch, referenced types first.")
    @APIResponse(responseCode = "200", description = "Per-type results, successful or not")
    @APIResponse(responseCode = "400", description = "Invalid batch id")
    public Response processAll(@PathParam("batchId") String batchId) {
        try {
            List<BatchResponse> results = pipeline.processAll(batchId).stream()
                    .map(BatchResponse::from)
                    .toList();
            return Response.ok(results).build();
        } catch (InvalidInputException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e, "/api/v1/batches/" + batchId))
                    .build();
        }
    }

    /**
     * GET /api/v1/batches/{entityType}/{batchId}
     */
    @GET
    @Path("/{entityType}/{batchId}")
    @Operation(summary = "Latest run for an entity type and batch")
    @APIResponse(responseCode = "200", description = "Run found")
    @APIResponse(responseCode = "404", description = "Batch never processed")
    public Response getRun(@PathParam("entityType") String entityType, @PathParam("batchId") String batchId) {
        String path = "/api/v1/batches/" + entityType + "/" + batchId;
        try {
            Optional<BatchRun> run = pipeline.getBatchRunLog().findLatest(EntityType.fromName(entityType), batchId);
            if (run.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound("No run for " + entityType + " batch " + batchId, path))
                        .build();
            }
            return Response.ok(BatchRunResponse.from(run.get())).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        }
    }

    /**
     * GET /api/v1/batches/{entityType}/{batchId}/conflicts
     */
    @GET
    @Path("/{entityType}/{batchId}/conflicts")
    @Operation(summary = "Conflicts logged for an entity type and batch")
    @APIResponse(responseCode = "200", description = "Conflict entries, possibly empty")
    public Response getConflicts(@PathParam("entityType") String entityType, @PathParam("batchId") String batchId) {
        try {
            List<ConflictResponse> conflicts = pipeline.getConflictLogger()
                    .getBatchConflicts(EntityType.fromName(entityType), batchId).stream()
                    .map(ConflictResponse::from)
                    .toList();
            return Response.ok(conflicts).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(),
                            "/api/v1/batches/" + entityType + "/" + batchId + "/conflicts"))
                    .build();
        }
    }
}
