package org.calista.formal.lang.universe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.calista.formal.lang.eval.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One applied transition. Immutable; carries by-value snapshots of both endpoint states as
 * they were when the transition was applied, so the fingerprint can be recomputed on replay.
 */
public final class HistoryEntry {
    public final String transition;
    public final String from;
    public final String to;
    public final String fingerprint;
    public final long timestampEpochMs;
    public final Map<String, Value> fromSnapshot;
    public final Map<String, Value> toSnapshot;

    HistoryEntry(String transition, String from, String to, String fingerprint, long timestampEpochMs,
                 Map<String, Value> fromSnapshot, Map<String, Value> toSnapshot) {
        this.transition = Objects.requireNonNull(transition, "transition");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.timestampEpochMs = timestampEpochMs;
        this.fromSnapshot = snapshot(fromSnapshot);
        this.toSnapshot = snapshot(toSnapshot);
    }

    static Map<String, Value> snapshot(Map<String, Value> props) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(props));
    }

    /** Canonical leaf content for the Merkle root. */
    public JsonNode toJson() {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("transition", transition);
        o.put("from", from);
        o.put("to", to);
        o.put("proof", fingerprint);
        o.put("timestamp", timestampEpochMs);
        return o;
    }

    @Override
    public String toString() {
        return "HistoryEntry{" + transition + ": " + from + " -> " + to + ", fingerprint=" + fingerprint
                + ", ts=" + timestampEpochMs + '}';
    }
}
