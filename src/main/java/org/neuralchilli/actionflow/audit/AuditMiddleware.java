package org.neuralchilli.actionflow.audit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.actionflow.config.ConfigurationException;
import org.neuralchilli.actionflow.config.OrchestratorConfig;
import org.neuralchilli.actionflow.domain.EventIds;
import org.neuralchilli.actionflow.events.EventBus;
import org.neuralchilli.actionflow.events.EventNames;
import org.neuralchilli.actionflow.monitoring.ExecutionMetrics;
import org.neuralchilli.actionflow.service.BoundaryRequest;
import org.neuralchilli.actionflow.service.BoundaryResponse;
import org.neuralchilli.actionflow.state.StateKeys;
import org.neuralchilli.actionflow.state.StateStore;
import org.neuralchilli.actionflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Wraps every boundary call with an audit trail and keeps oversized responses off the wire.
 *
 * A response body whose serialized size exceeds the configured threshold is written to the
 * {@link BlobStore} and replaced by a small envelope pointing at it. If that write fails the
 * original response goes out unchanged and a warning is audited.
 */
@ApplicationScoped
public class AuditMiddleware {

    private static final Logger log = LoggerFactory.getLogger(AuditMiddleware.class);
    private static final String SOURCE = "audit_middleware";
    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    public static final String OFFLOADED_HEADER = "X-Large-Response-Saved";

    private final StateStore stateStore;
    private final EventBus eventBus;
    private final BlobStore blobStore;
    private final ParameterRedactor redactor;
    private final ExecutionMetrics metrics;
    private final boolean enabled;
    private final boolean offloadEnabled;
    private final long offloadThresholdBytes;
    private final Duration retention;

    @Inject
    public AuditMiddleware(
            StateStore stateStore,
            EventBus eventBus,
            BlobStore blobStore,
            ParameterRedactor redactor,
            ExecutionMetrics metrics,
            OrchestratorConfig config
    ) {
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.blobStore = blobStore;
        this.redactor = redactor;
        this.metrics = metrics;
        this.enabled = config.audit().enabled();
        this.retention = config.audit().recordRetention();

        long threshold = config.audit().offloadThresholdBytes();
        boolean offload = config.audit().offloadEnabled();
        try {
            validateThreshold(threshold);
        } catch (ConfigurationException e) {
            log.error("Response offloading disabled: {}", e.getMessage());
            offload = false;
        }
        this.offloadEnabled = offload;
        this.offloadThresholdBytes = threshold;
    }

    static void validateThreshold(long thresholdBytes) {
        if (thresholdBytes < 0) {
            throw new ConfigurationException(
                    "orchestrator.audit.offload-threshold-bytes must not be negative, got " + thresholdBytes);
        }
    }

    /**
     * Run a boundary call under audit. Exceptions from the call are audited and rethrown.
     */
    public BoundaryResponse around(BoundaryRequest request, Supplier<BoundaryResponse> call) {
        if (!enabled) {
            return call.get();
        }

        Instant start = Instant.now();
        long startNanos = System.nanoTime();
        Map<String, Object> params = redactor.redact(request.params());

        BoundaryResponse response;
        try {
            response = call.get();
        } catch (RuntimeException e) {
            long elapsed = elapsedMillis(startNanos);
            record(request, new AuditRecord(null, AuditType.ACTION_ERROR, start, request.label(), params,
                    request.caller().userId(), request.mode().name(), 500, null, elapsed, null,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
            emitActionFailed(request, params, 500, e.getMessage());
            throw e;
        }
        long elapsed = elapsedMillis(startNanos);

        if (!response.isSuccess()) {
            Object message = response.body().get("message");
            record(request, new AuditRecord(null, AuditType.ACTION_ERROR, start, request.label(), params,
                    request.caller().userId(), request.mode().name(), response.httpStatus(), null, elapsed, null,
                    message != null ? message.toString() : null));
            emitActionFailed(request, params, response.httpStatus(), message != null ? message.toString() : null);
            return response;
        }

        byte[] serialized = Jsons.writeBytes(response.body());
        if (offloadEnabled && serialized.length > offloadThresholdBytes) {
            return offload(request, response, serialized, params, start, elapsed);
        }

        record(request, new AuditRecord(null, AuditType.ACTION_SUCCESS, start, request.label(), params,
                request.caller().userId(), request.mode().name(), response.httpStatus(),
                (long) serialized.length, elapsed, null, null));
        emitActionCompleted(request, params, response.httpStatus(), serialized.length, elapsed);
        return response;
    }

    public boolean isOffloadEnabled() {
        return offloadEnabled;
    }

    private BoundaryResponse offload(
            BoundaryRequest request,
            BoundaryResponse response,
            byte[] serialized,
            Map<String, Object> params,
            Instant start,
            long elapsed
    ) {
        String fileName = blobName(request.label(), start);

        String reference;
        try {
            reference = blobStore.store(fileName, serialized);
        } catch (RuntimeException e) {
            log.warn("Failed to offload {} byte response of '{}': {}", serialized.length, request.label(), e.getMessage());
            record(request, new AuditRecord(null, AuditType.ACTION_WARNING, start, request.label(), params,
                    request.caller().userId(), request.mode().name(), response.httpStatus(),
                    (long) serialized.length, elapsed, null, "Failed to save large response: " + e.getMessage()));
            emitActionCompleted(request, params, response.httpStatus(), serialized.length, elapsed);
            return response;
        }

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("status", "offloaded");
        envelope.put("note", "Response too large (" + serialized.length + " bytes), saved to file");
        envelope.put("reference", reference);
        envelope.put("file_name", fileName);
        envelope.put("original_size_bytes", serialized.length);
        envelope.put("action", request.label());
        envelope.put("timestamp", start.toString());

        metrics.recordResponseOffloaded();
        record(request, new AuditRecord(null, AuditType.LARGE_RESPONSE_SAVED, start, request.label(), params,
                request.caller().userId(), request.mode().name(), response.httpStatus(),
                (long) serialized.length, elapsed, reference, null));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", request.label());
        payload.put("reference", reference);
        payload.put("file_name", fileName);
        payload.put("original_size_bytes", serialized.length);
        eventBus.emit(EventNames.RESPONSE_OFFLOADED, SOURCE, payload, ids(request));
        emitActionCompleted(request, params, 200, serialized.length, elapsed);

        return new BoundaryResponse(200, envelope, Map.of(OFFLOADED_HEADER, "true"));
    }

    /**
     * Blob names carry a random suffix so two offloads of the same action within one second never share a key.
     */
    static String blobName(String label, Instant start) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return label + "_result_" + FILE_TIMESTAMP.format(start) + "_" + suffix + ".json";
    }

    private void record(BoundaryRequest request, AuditRecord record) {
        stateStore.set(StateKeys.audit(record.id()), record, retention);

        switch (record.type()) {
            case ACTION_ERROR -> log.error("AUDIT {}: {} params={} status={} - {}",
                    record.type().wireName(), record.action(), record.params(), record.httpStatus(), record.message());
            case ACTION_WARNING -> log.warn("AUDIT {}: {} params={} - {}",
                    record.type().wireName(), record.action(), record.params(), record.message());
            default -> log.info("AUDIT {}: {} params={} status={} size={} {}ms",
                    record.type().wireName(), record.action(), record.params(), record.httpStatus(),
                    record.responseSizeBytes(), record.processingMillis());
        }

        eventBus.emit(EventNames.AUDIT_RECORDED, SOURCE, Jsons.toMap(record), ids(request));
    }

    private void emitActionCompleted(
            BoundaryRequest request,
            Map<String, Object> params,
            int httpStatus,
            long sizeBytes,
            long elapsed
    ) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", request.label());
        payload.put("params", params);
        payload.put("http_status", httpStatus);
        payload.put("response_size_bytes", sizeBytes);
        payload.put("processing_ms", elapsed);
        eventBus.emit(EventNames.ACTION_COMPLETED, SOURCE, payload, ids(request));
    }

    private void emitActionFailed(BoundaryRequest request, Map<String, Object> params, int httpStatus, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", request.label());
        payload.put("params", params);
        payload.put("http_status", httpStatus);
        payload.put("error", error);
        eventBus.emit(EventNames.ACTION_FAILED, SOURCE, payload, ids(request));
    }

    private static EventIds ids(BoundaryRequest request) {
        return new EventIds(null, request.caller().userId(), request.caller().sessionId());
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
