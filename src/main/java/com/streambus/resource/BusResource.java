package com.streambus.resource;

import com.streambus.bus.BusHealth;
import com.streambus.bus.MessageBus;
import com.streambus.domain.MessagePayload;
import com.streambus.metrics.MetricsSnapshot;
import com.streambus.publish.PublishException;
import com.streambus.resource.dto.ErrorResponse;
import com.streambus.resource.dto.HealthResponse;
import com.streambus.resource.dto.PublishResponse;
import com.streambus.resource.dto.TrimResponse;
import com.streambus.store.LogStoreException;
import com.streambus.store.NoSuchGroupException;
import com.streambus.store.PendingEntry;
import com.streambus.store.StreamInfo;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Management API for the message bus.
 *
 * <p>Used by operators and producers without an in-process bus for:
 * <ul>
 *   <li>Publishing messages</li>
 *   <li>Inspecting streams and pending entries</li>
 *   <li>Trimming streams</li>
 *   <li>Metrics and health</li>
 * </ul>
 *
 * <p>Subscriptions are in-process only and have no endpoint.
 */
@Path("/v1/bus")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Message Bus", description = "Publishing and stream management endpoints")
public class BusResource {

    private static final Logger LOG = Logger.getLogger(BusResource.class);

    @Inject
    MessageBus messageBus;

    @POST
    @Path("/streams/{stream}/messages")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Publish a message", description = "Appends a message envelope to the stream")
    @APIResponses({
            @APIResponse(responseCode = "201", description = "Message appended"),
            @APIResponse(responseCode = "400", description = "Invalid message"),
            @APIResponse(responseCode = "503", description = "Store rejected the append")
    })
    public Response publish(@PathParam("stream") String stream, @NotNull @Valid MessagePayload message) {
        try {
            String entryId = messageBus.publish(stream, message);
            return Response.status(Response.Status.CREATED)
                    .entity(new PublishResponse(stream, entryId))
                    .build();
        } catch (PublishException e) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("PUBLISH_FAILED", e.getMessage(), stream))
                    .build();
        }
    }

    @GET
    @Path("/streams")
    @Operation(summary = "List streams", description = "Scans every store key; not for hot paths")
    @APIResponse(responseCode = "200", description = "Stream names")
    public Response listStreams() {
        try {
            List<String> streams = messageBus.listStreams();
            return Response.ok(streams).build();
        } catch (LogStoreException e) {
            return storeUnavailable(null, e);
        }
    }

    @GET
    @Path("/streams/{stream}")
    @Operation(summary = "Get stream info", description = "Length, groups and first/last entry ids")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Stream info"),
            @APIResponse(responseCode = "404", description = "Stream does not exist")
    })
    public Response getStreamInfo(@PathParam("stream") String stream) {
        try {
            Optional<StreamInfo> info = messageBus.getStreamInfo(stream);
            if (info.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(new ErrorResponse("STREAM_NOT_FOUND", "Stream not found: " + stream, stream))
                        .build();
            }
            return Response.ok(info.get()).build();
        } catch (LogStoreException e) {
            return storeUnavailable(stream, e);
        }
    }

    @POST
    @Path("/streams/{stream}/trim")
    @Operation(summary = "Trim a stream", description = "Approximately trims the stream to maxLen entries")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Stream trimmed"),
            @APIResponse(responseCode = "400", description = "Invalid maxLen")
    })
    public Response trimStream(@PathParam("stream") String stream, @QueryParam("maxLen") Long maxLen) {
        if (maxLen == null || maxLen < 0) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse("INVALID_MAX_LEN", "maxLen must be a non-negative number", stream))
                    .build();
        }
        try {
            long trimmed = messageBus.trimStream(stream, maxLen);
            return Response.ok(new TrimResponse(stream, maxLen, trimmed)).build();
        } catch (LogStoreException e) {
            return storeUnavailable(stream, e);
        }
    }

    @GET
    @Path("/streams/{stream}/groups/{group}/pending")
    @Operation(summary = "Pending entries", description = "Entries delivered to the group but not yet acknowledged")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Pending entries, oldest first"),
            @APIResponse(responseCode = "404", description = "Stream or consumer group does not exist")
    })
    public Response getPendingMessages(@PathParam("stream") String stream, @PathParam("group") String group) {
        try {
            List<PendingEntry> pending = messageBus.getPendingMessages(stream, group);
            return Response.ok(pending).build();
        } catch (NoSuchGroupException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("GROUP_NOT_FOUND",
                            "No consumer group " + group + " on stream " + stream, stream))
                    .build();
        } catch (LogStoreException e) {
            return storeUnavailable(stream, e);
        }
    }

    @GET
    @Path("/metrics")
    @Operation(summary = "Get bus metrics", description = "Message and consumer counters")
    @APIResponse(responseCode = "200", description = "Metrics retrieved")
    public Response getMetrics() {
        MetricsSnapshot metrics = messageBus.getMetrics();
        return Response.ok(metrics).build();
    }

    @GET
    @Path("/health")
    @Operation(summary = "Health check", description = "Store reachability and bus counters")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Bus is healthy"),
            @APIResponse(responseCode = "503", description = "Bus is unhealthy")
    })
    public Response health() {
        BusHealth health = messageBus.healthCheck();
        HealthResponse body = new HealthResponse(health.isHealthy() ? "UP" : "DOWN",
                health.isHealthy(), health.getDetails());
        Response.Status status = health.isHealthy() ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE;
        return Response.status(status).entity(body).build();
    }

    private Response storeUnavailable(String stream, LogStoreException e) {
        LOG.warnf("Store request failed for stream %s: %s", stream, e.getMessage());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(new ErrorResponse("STORE_UNAVAILABLE", "Log store request failed", stream))
                .build();
    }
}
