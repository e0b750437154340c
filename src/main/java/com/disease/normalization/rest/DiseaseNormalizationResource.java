package com.disease.normalization.rest;

import com.disease.normalization.api.DiseaseNormalizer;
import com.disease.normalization.api.InvalidParameterException;
import com.disease.normalization.api.NormalizationResult;
import com.disease.normalization.api.SearchResult;
import com.disease.normalization.health.HealthStatus;
import com.disease.normalization.merge.RebuildResult;
import com.disease.normalization.rest.dto.ErrorResponse;
import com.disease.normalization.rest.dto.HealthResponse;
import com.disease.normalization.rest.dto.NormalizeResponse;
import com.disease.normalization.rest.dto.RebuildResponse;
import com.disease.normalization.rest.dto.SearchResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST resource for disease search and normalization.
 *
 * <p>Provides endpoints for:</p>
 * <ul>
 *   <li>Searching individual sources</li>
 *   <li>Normalizing a term to a merged concept</li>
 *   <li>Rebuilding merge groups</li>
 *   <li>Health reporting</li>
 * </ul>
 */
@Path("/api/v1/disease")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Disease Normalization", description = "Search sources and normalize disease terms")
public class DiseaseNormalizationResource {
    private static final Logger log = LoggerFactory.getLogger(DiseaseNormalizationResource.class);
    private static final String INTERNAL_ERROR = "An internal error occurred. Check server logs for details.";

    private final DiseaseNormalizer normalizer;

    @Inject
    public DiseaseNormalizationResource(DiseaseNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Searches every selected source for the best-tier matches.
     *
     * GET /api/v1/disease/search?q=...&amp;incl=...&amp;excl=...
     */
    @GET
    @Path("/search")
    @Operation(summary = "Search sources",
            description = "Returns, for each selected source, every record matching the query at the " +
                    "best tier reached in that source.")
    @APIResponse(responseCode = "200", description = "Search completed")
    @APIResponse(responseCode = "400", description = "Both incl and excl given, or unknown source name")
    public Response search(
            @Parameter(description = "Disease term or concept id", required = true)
            @QueryParam("q") String query,
            @Parameter(description = "Comma-separated source names to search")
            @QueryParam("incl") String incl,
            @Parameter(description = "Comma-separated source names to leave out")
            @QueryParam("excl") String excl) {
        String path = "/api/v1/disease/search";
        try {
            SearchResult result = normalizer.search(query, incl, excl);
            return Response.ok(SearchResponse.from(result)).build();
        } catch (InvalidParameterException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("search.failed query='{}' error={}", query, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        }
    }

    /**
     * Normalizes a term to a single merged concept.
     *
     * GET /api/v1/disease/normalize?q=...
     */
    @GET
    @Path("/normalize")
    @Operation(summary = "Normalize a disease term",
            description = "Returns the merged concept for the highest-precedence match, with concept " +
                    "mappings for its cross-references.")
    @APIResponse(responseCode = "200", description = "Normalization completed, possibly with NO_MATCH")
    public Response normalize(
            @Parameter(description = "Disease term or concept id", required = true)
            @QueryParam("q") String query) {
        try {
            NormalizationResult result = normalizer.normalize(query);
            return Response.ok(NormalizeResponse.from(query, result)).build();
        } catch (Exception e) {
            log.error("normalize.failed query='{}' error={}", query, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, "/api/v1/disease/normalize"))
                    .build();
        }
    }

    /**
     * Recomputes all merge groups.
     *
     * POST /api/v1/disease/admin/rebuild
     */
    @POST
    @Path("/admin/rebuild")
    @Operation(summary = "Rebuild merge groups",
            description = "Regroups all source records by cross-reference and replaces the merged set.")
    @APIResponse(responseCode = "200", description = "Rebuild committed")
    @APIResponse(responseCode = "409", description = "Another rebuild is in progress")
    @APIResponse(responseCode = "500", description = "Rebuild failed; the previous merged set is kept")
    public Response rebuild() {
        String path = "/api/v1/disease/admin/rebuild";
        RebuildResult result = normalizer.rebuildMerges();
        if (result.success()) {
            return Response.ok(RebuildResponse.from(result)).build();
        }
        if (DiseaseNormalizer.REBUILD_IN_PROGRESS.equals(result.errorMessage())) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(ErrorResponse.conflict(result.errorMessage(), path))
                    .build();
        }
        log.error("rebuild.endpoint.failed error={}", result.errorMessage());
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(RebuildResponse.from(result))
                .build();
    }

    /**
     * GET /api/v1/disease/health
     */
    @GET
    @Path("/health")
    @Operation(summary = "Health check", description = "Aggregated health of storage and data.")
    @APIResponse(responseCode = "200", description = "UP or DEGRADED")
    @APIResponse(responseCode = "503", description = "DOWN")
    public Response health() {
        HealthStatus status = normalizer.health();
        Response.Status httpStatus = status.isDown()
                ? Response.Status.SERVICE_UNAVAILABLE : Response.Status.OK;
        return Response.status(httpStatus).entity(HealthResponse.from(status)).build();
    }
}
