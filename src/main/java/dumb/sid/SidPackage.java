package dumb.sid;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.sid.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNullElse;

/**
 * The document exchanged with callers: DOFs, compartments, CSIs, diagrams, states,
 * constraints and rewrite rules. Lookups return the first entry with a given id; duplicates
 * are left for {@link Validator} to report.
 */
public record SidPackage(@JsonProperty("dofs") List<Dof> dofs,
                         @JsonProperty("compartments") List<Compartment> compartments,
                         @JsonProperty("csis") List<Csi> csis,
                         @JsonProperty("diagrams") List<Diagram> diagrams,
                         @JsonProperty("states") List<State> states,
                         @JsonProperty("constraints") List<Constraint> constraints,
                         @JsonProperty("rewrite_rules") List<RewriteRule> rewriteRules) {

    public SidPackage {
        dofs = List.copyOf(requireNonNullElse(dofs, List.of()));
        compartments = List.copyOf(requireNonNullElse(compartments, List.of()));
        csis = List.copyOf(requireNonNullElse(csis, List.of()));
        diagrams = List.copyOf(requireNonNullElse(diagrams, List.of()));
        states = List.copyOf(requireNonNullElse(states, List.of()));
        constraints = List.copyOf(requireNonNullElse(constraints, List.of()));
        rewriteRules = List.copyOf(requireNonNullElse(rewriteRules, List.of()));
    }

    public static SidPackage parse(String json) throws JsonProcessingException {
        return Json.obj(json, SidPackage.class);
    }

    private static <X> Optional<X> first(List<X> items, Function<X, String> id, @Nullable String key) {
        return key == null ? Optional.empty() : items.stream().filter(x -> key.equals(id.apply(x))).findFirst();
    }

    public Optional<Diagram> diagram(@Nullable String id) {
        return first(diagrams, Diagram::id, id);
    }

    public Optional<State> state(@Nullable String id) {
        return first(states, State::id, id);
    }

    public Optional<Csi> csi(@Nullable String id) {
        return first(csis, Csi::id, id);
    }

    /** Replaces every diagram carrying the same id. */
    public SidPackage withDiagram(Diagram d) {
        var next = diagrams.stream().map(x -> Objects.equals(x.id(), d.id()) ? d : x).toList();
        return new SidPackage(dofs, compartments, csis, next, states, constraints, rewriteRules);
    }

    /** Replaces every state carrying the same id. */
    public SidPackage withState(State s) {
        return mapStates(x -> Objects.equals(x.id(), s.id()) ? s : x);
    }

    public SidPackage mapStates(UnaryOperator<State> f) {
        return new SidPackage(dofs, compartments, csis, diagrams, states.stream().map(f).toList(), constraints, rewriteRules);
    }

    public JsonNode toJson() {
        return Json.node(this);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Dof(@JsonProperty("id") String id, @JsonProperty("description") @Nullable String description) {
        public Dof(String id) {
            this(id, null);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Compartment(@JsonProperty("id") String id, @JsonProperty("name") @Nullable String name) {
    }

    /**
     * Coupling/scope interface. An empty pair list leaves edge coupling unrestricted; it does
     * not forbid everything.
     */
    public record Csi(@JsonProperty("id") String id,
                      @JsonProperty("allowed_dofs") List<String> allowedDofs,
                      @JsonProperty("allowed_pairs") List<List<String>> allowedPairs) {
        public Csi {
            allowedDofs = List.copyOf(requireNonNullElse(allowedDofs, List.of()));
            allowedPairs = requireNonNullElse(allowedPairs, List.<List<String>>of()).stream()
                    .map(p -> p == null ? List.<String>of() : Collections.unmodifiableList(new ArrayList<>(p))).toList();
        }

        /** Well-formed (two-element) pairs only. */
        public Set<Pair> pairs() {
            var s = new LinkedHashSet<Pair>();
            for (var p : allowedPairs) if (p.size() == 2) s.add(new Pair(p.get(0), p.get(1)));
            return s;
        }

        public boolean allows(String fromDof, String toDof) {
            var pairs = pairs();
            return pairs.isEmpty() || pairs.contains(new Pair(fromDof, toDof));
        }
    }

    public record Pair(String from, String to) {
        @Override
        public String toString() {
            return "(" + from + ", " + to + ')';
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Constraint(@JsonProperty("id") String id,
                             @JsonProperty("type") Severity type,
                             @JsonProperty("predicate") @Nullable String predicate,
                             @JsonProperty("description") @Nullable String description) {
        public Constraint {
            type = requireNonNullElse(type, Severity.HARD);
        }

        public static Constraint hard(String id, String predicate) {
            return new Constraint(id, Severity.HARD, predicate, null);
        }

        public static Constraint soft(String id, String predicate) {
            return new Constraint(id, Severity.SOFT, predicate, null);
        }
    }

    public enum Severity {
        HARD, SOFT;

        @JsonCreator
        static Severity parse(String s) {
            return s == null || "hard".equalsIgnoreCase(s) ? HARD : SOFT;
        }

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
