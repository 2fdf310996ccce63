package dumb.sid;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.sid.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

/**
 * Immutable graph of operator nodes joined by argument edges. Rewrites produce a new
 * instance; nothing observes a half-built diagram.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Diagram {
    public static final String ARG = "arg";
    public static final String META_TARGET_COMPARTMENT = "target_compartment";
    public static final String META_ATOM_ARGS = "atom_args";
    public static final String META_ATOM_ONLY = "atom_only";

    private final String id;
    private final @Nullable String compartmentId;
    private final List<Node> nodes;
    private final List<Edge> edges;
    private final Map<String, Node> nodeIndex;

    @JsonCreator
    public Diagram(@JsonProperty("id") String id,
                   @JsonProperty("compartment_id") @Nullable String compartmentId,
                   @JsonProperty("nodes") @Nullable List<Node> nodes,
                   @JsonProperty("edges") @Nullable List<Edge> edges) {
        this.id = id;
        this.compartmentId = compartmentId;
        this.nodes = List.copyOf(requireNonNullElse(nodes, List.of()));
        this.edges = List.copyOf(requireNonNullElse(edges, List.of()));
        var index = new LinkedHashMap<String, Node>();
        for (var n : this.nodes) if (n.id() != null) index.putIfAbsent(n.id(), n);
        this.nodeIndex = Collections.unmodifiableMap(index);
    }

    @JsonProperty("id")
    public String id() {
        return id;
    }

    @JsonProperty("compartment_id")
    public @Nullable String compartmentId() {
        return compartmentId;
    }

    @JsonProperty("nodes")
    public List<Node> nodes() {
        return nodes;
    }

    @JsonProperty("edges")
    public List<Edge> edges() {
        return edges;
    }

    public Optional<Node> node(String nodeId) {
        return Optional.ofNullable(nodeIndex.get(nodeId));
    }

    /** First node per id, in document order. */
    @JsonIgnore
    public Map<String, Node> nodeIndex() {
        return nodeIndex;
    }

    /** Node ids followed by edge ids, in document order. */
    @JsonIgnore
    public List<String> elementIds() {
        return Stream.concat(nodes.stream().map(Node::id), edges.stream().map(Edge::id)).filter(Objects::nonNull).toList();
    }

    public Stream<Node> nodes(Op op) {
        return nodes.stream().filter(n -> n.op() == op);
    }

    public Diagram with(List<Node> nodes, List<Edge> edges) {
        return new Diagram(id, compartmentId, nodes, edges);
    }

    /**
     * Verifies every edge endpoint and node input names an existing node.
     *
     * @throws StructureException on the first dangling reference
     */
    public Diagram checkStructure() {
        for (var e : edges) {
            if (!nodeIndex.containsKey(e.from()))
                throw new StructureException("Edge " + e.id() + " references non-existent 'from' node: " + e.from());
            if (!nodeIndex.containsKey(e.to()))
                throw new StructureException("Edge " + e.id() + " references non-existent 'to' node: " + e.to());
        }
        for (var n : nodes)
            for (var in : n.inputs())
                if (!nodeIndex.containsKey(in))
                    throw new StructureException("Node " + n.id() + " references non-existent input node: " + in);
        return this;
    }

    public JsonNode toJson() {
        return Json.node(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Diagram d && Objects.equals(id, d.id) && Objects.equals(compartmentId, d.compartmentId)
                && nodes.equals(d.nodes) && edges.equals(d.edges));
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, compartmentId, nodes, edges);
    }

    @Override
    public String toString() {
        return "Diagram[" + id + ", nodes=" + nodes.size() + ", edges=" + edges.size() + ']';
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Node(@JsonProperty("id") String id,
                       @JsonProperty("op") Op op,
                       @JsonProperty("dof_refs") List<String> dofRefs,
                       @JsonProperty("inputs") List<String> inputs,
                       @JsonProperty("irreversible") @Nullable Boolean irreversible,
                       @JsonProperty("meta") Map<String, Object> meta) {
        public Node {
            requireNonNull(op, "op");
            dofRefs = List.copyOf(requireNonNullElse(dofRefs, List.of()));
            inputs = List.copyOf(requireNonNullElse(inputs, List.of()));
            meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        }

        public Node(String id, Op op) {
            this(id, op, List.of(), List.of(), null, Map.of());
        }

        public boolean markedIrreversible() {
            return Boolean.TRUE.equals(irreversible);
        }

        public Optional<Object> meta(String key) {
            return Optional.ofNullable(meta.get(key));
        }

        public Node withInputs(List<String> newInputs) {
            return new Node(id, op, dofRefs, newInputs, irreversible, meta);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Edge(@JsonProperty("id") String id,
                       @JsonProperty("from") String from,
                       @JsonProperty("to") String to,
                       @JsonProperty("label") String label) {
        public Edge {
            label = requireNonNullElse(label, ARG);
        }

        public Edge withTo(String newTo) {
            return new Edge(id, from, newTo, label);
        }

        public Edge withFrom(String newFrom) {
            return new Edge(id, newFrom, to, label);
        }
    }

    /** A diagram that cannot be built or used because its references do not resolve. */
    public static class StructureException extends RuntimeException {
        public StructureException(String message) {
            super(message);
        }
    }
}
