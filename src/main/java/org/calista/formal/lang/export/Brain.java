package org.calista.formal.lang.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brain: exported graph artifact of a Universe.
 *
 * <p>Plain Jackson POJO (public fields, no-arg constructors) so it can be written by
 * {@link BrainStore} and read back by downstream tools with the same mapper.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"brain", "entries", "supgrams", "graph", "capabilities", "scxq2", "universe"})
public final class Brain {

    public static final String VERSION = "1.0.0";
    public static final String SOURCE = "math-corpora";
    public static final String LAW = "DERIVED_FROM_FORMAL_LANGUAGE_SEALED_ON_EXPORT";

    public Meta brain = new Meta();
    /** {@code <State>_<property>} to weight in [0, 1]. */
    public Map<String, Double> entries = new LinkedHashMap<>();
    public Map<String, Supgram> supgrams = new LinkedHashMap<>();
    public Graph graph = new Graph();
    public List<String> capabilities = new ArrayList<>();
    public Scxq2 scxq2 = new Scxq2();
    public UniverseStats universe = new UniverseStats();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"id", "version", "hash", "domain", "created_at", "source", "law"})
    public static final class Meta {
        public String id;
        public String version = VERSION;
        /** {@code sha256:<fingerprint>} over entries, nodes and edges. */
        public String hash;
        public String domain;
        @JsonProperty("created_at")
        public String createdAt;
        public String source = SOURCE;
        public String law = LAW;
    }

    /** Field projection: one member, weight, and the raw field value. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"members", "weight", "field"})
    public static final class Supgram {
        public List<String> members = new ArrayList<>();
        public double weight;
        public JsonNode field;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Graph {
        /** {@code N1..Nn} in state declaration order. */
        public Map<String, GraphNode> nodes = new LinkedHashMap<>();
        public List<GraphEdge> edges = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class GraphNode {
        public String state;

        public GraphNode() {
        }

        public GraphNode(String state) {
            this.state = state;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"from", "to", "label", "weight"})
    public static final class GraphEdge {
        public String from;
        public String to;
        public String label;
        public double weight;

        public GraphEdge() {
        }

        public GraphEdge(String from, String to, String label, double weight) {
            this.from = from;
            this.to = to;
            this.label = label;
            this.weight = weight;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Scxq2 {
        public Map<String, Lane> lanes = new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Lane {
        public String name;
        @JsonProperty("min_weight")
        public double minWeight;

        public Lane() {
        }

        public Lane(String name, double minWeight) {
            this.name = name;
            this.minWeight = minWeight;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"states", "transitions", "constraints", "fields", "proofs", "history_length", "merkle_root"})
    public static final class UniverseStats {
        public int states;
        public int transitions;
        public int constraints;
        public int fields;
        public int proofs;
        @JsonProperty("history_length")
        public int historyLength;
        @JsonProperty("merkle_root")
        public String merkleRoot;
    }
}
