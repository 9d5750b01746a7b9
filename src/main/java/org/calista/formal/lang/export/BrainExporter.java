package org.calista.formal.lang.export;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formal.lang.commit.Fingerprinter;
import org.calista.formal.lang.eval.Builtins;
import org.calista.formal.lang.eval.Value;
import org.calista.formal.lang.universe.Transition;
import org.calista.formal.lang.universe.Universe;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Projects a Universe into a {@link Brain}. Side-effect free; the universe is only read.
 *
 * <p>Mapping: states become nodes {@code N1..Nn} and weighted entries, transitions become edges
 * (only when both endpoints are declared), fields become supgrams, constraints become
 * capabilities.</p>
 */
public final class BrainExporter {

    private static final Logger log = LogManager.getLogger(BrainExporter.class);

    public static final double EDGE_WEIGHT = 0.9;
    public static final double DEFAULT_WEIGHT = 0.5;

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Fingerprinter fingerprinter;
    private final Clock clock;

    public BrainExporter(Fingerprinter fingerprinter, Clock clock) {
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws IllegalArgumentException when {@code domain} is null or blank
     */
    public Brain toBrain(Universe universe, String domain) {
        Objects.requireNonNull(universe, "universe");
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank");
        }

        Brain out = new Brain();

        // ---- states -> nodes + entries ----
        Map<String, String> nodeByState = new HashMap<>();
        int nodeId = 1;
        for (Map.Entry<String, Map<String, Value>> s : universe.states().entrySet()) {
            String nid = "N" + nodeId++;
            out.graph.nodes.put(nid, new Brain.GraphNode(s.getKey()));
            nodeByState.put(s.getKey(), nid);

            for (Map.Entry<String, Value> p : s.getValue().entrySet()) {
                out.entries.put(s.getKey() + "_" + p.getKey(), entryWeight(p.getValue()));
            }
        }

        // ---- transitions -> edges ----
        for (Transition t : universe.transitions().values()) {
            String from = nodeByState.get(t.from);
            String to = nodeByState.get(t.to);
            if (from != null && to != null) {
                out.graph.edges.add(new Brain.GraphEdge(from, to, t.name, EDGE_WEIGHT));
            }
        }

        // ---- fields -> supgrams ----
        for (Map.Entry<String, Value> f : universe.fields().entrySet()) {
            Brain.Supgram sg = new Brain.Supgram();
            sg.members.add(f.getKey());
            sg.weight = supgramWeight(f.getValue());
            sg.field = f.getValue().toJson();
            out.supgrams.put("S_FIELD_" + f.getKey().toUpperCase(Locale.ROOT), sg);
        }

        // ---- capabilities ----
        out.capabilities.add("formal_language");
        out.capabilities.add("state_transition");
        out.capabilities.add("constraint_checking");
        out.capabilities.add("proof_generation");
        out.capabilities.add("domain_" + domain);
        for (String c : universe.constraints().keySet()) {
            out.capabilities.add("constraint_" + c);
        }

        // ---- lanes ----
        out.scxq2.lanes.put("0", new Brain.Lane("syntax", 0.3));
        out.scxq2.lanes.put("1", new Brain.Lane("semantic", 0.7));
        out.scxq2.lanes.put("2", new Brain.Lane("assertion", 0.9));

        // ---- stats ----
        out.universe.states = universe.states().size();
        out.universe.transitions = universe.transitions().size();
        out.universe.constraints = universe.constraints().size();
        out.universe.fields = universe.fields().size();
        out.universe.proofs = universe.proofs().size();
        out.universe.historyLength = universe.historyLength();
        out.universe.merkleRoot = universe.merkleRoot();

        // ---- metadata ----
        out.brain.id = "brain." + domain + ".formal";
        out.brain.domain = domain;
        out.brain.hash = "sha256:" + contentHash(out);
        out.brain.createdAt = ISO_MILLIS.format(clock.instant());

        log.debug("Exported brain {}: nodes={} edges={} entries={} supgrams={}",
                out.brain.id, out.graph.nodes.size(), out.graph.edges.size(), out.entries.size(), out.supgrams.size());
        return out;
    }

    /** Fingerprint of {entries, nodes, edges}; metadata and timestamps are excluded. */
    String contentHash(Brain b) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode content = f.objectNode();

        ObjectNode entries = content.putObject("entries");
        for (Map.Entry<String, Double> e : b.entries.entrySet()) {
            entries.set(e.getKey(), Value.num(e.getValue()).toJson());
        }

        ObjectNode nodes = content.putObject("nodes");
        for (Map.Entry<String, Brain.GraphNode> n : b.graph.nodes.entrySet()) {
            nodes.putObject(n.getKey()).put("state", n.getValue().state);
        }

        ArrayNode edges = content.putArray("edges");
        for (Brain.GraphEdge e : b.graph.edges) {
            ObjectNode o = edges.addObject();
            o.put("from", e.from);
            o.put("to", e.to);
            o.put("label", e.label);
            o.set("weight", Value.num(e.weight).toJson());
        }
        return fingerprinter.fingerprint(content);
    }

    static double entryWeight(Value v) {
        if (v instanceof Value.Num n) return Math.min(Math.abs(n.value), 1.0);
        return DEFAULT_WEIGHT;
    }

    static double supgramWeight(Value v) {
        if (v instanceof Value.Vec vec && vec.isNumeric()) {
            return Math.min(Builtins.magnitude(vec.numbers()), 1.0);
        }
        return DEFAULT_WEIGHT;
    }
}
