package org.neuralchilli.actionflow.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One audited boundary call. Parameters are stored already redacted.
 */
public record AuditRecord(
        String id,
        AuditType type,
        Instant timestamp,
        String action,
        Map<String, Object> params,
        String userId,
        String mode,
        Integer httpStatus,
        Long responseSizeBytes,
        long processingMillis,
        String reference,
        String message
) {
    public AuditRecord {
        if (type == null) {
            throw new IllegalArgumentException("Audit type cannot be null");
        }
        if (id == null) {
            id = "audit_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        params = params == null ? Map.of() : params;
    }
}
