package com.eainde.research.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A discrete market event awaiting research, e.g. an insider buy or a merger
 * announcement. Only the pipeline engine flips {@code processed},
 * {@code resultedInInsight} and {@code insightId}.
 */
public record Signal(
        Long id,
        Instant discoveredAt,
        String signalType,
        String subject,
        Map<String, Object> payload,
        boolean processed,
        boolean resultedInInsight,
        Long insightId
) {
    public static final double DEFAULT_PRIORITY = 5.0;

    public Signal {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    /**
     * Creates an unprocessed signal as delivered by a collector.
     */
    public static Signal pending(String signalType, String subject, Map<String, Object> payload) {
        return new Signal(null, Instant.now(), signalType, subject, payload, false, false, null);
    }

    public String companyName() {
        Object company = payload.get("company");
        return company != null ? company.toString() : subject;
    }

    public double priority() {
        Object priority = payload.get("priority");
        if (priority instanceof Number number) {
            return number.doubleValue();
        }
        return DEFAULT_PRIORITY;
    }

    /**
     * JSON-native view of the signal stored inside the research state.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("id", id);
        snapshot.put("signal_type", signalType);
        snapshot.put("subject", subject);
        snapshot.put("company", companyName());
        snapshot.put("priority", priority());
        snapshot.put("discovered_at", discoveredAt != null ? discoveredAt.toString() : null);
        snapshot.put("data", payload);
        return snapshot;
    }
}
