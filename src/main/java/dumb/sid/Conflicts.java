package dumb.sid;

import dumb.sid.SidPackage.Constraint;
import dumb.sid.SidPackage.Csi;
import dumb.sid.SidPackage.Severity;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static dumb.sid.util.Log.message;
import static dumb.sid.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Conflict resolution framework: dispatches conflicts to resolution procedures, assigns I/N/U
 * labels, checks admissibility and authorizes rewrites.
 * <p>
 * Resolvers are pure. They return the state they would produce and leave adoption to the caller.
 */
public class Conflicts {

    private final Predicates predicates;

    public Conflicts(Predicates predicates) {
        this.predicates = requireNonNull(predicates);
    }

    public Predicates predicates() {
        return predicates;
    }

    public Resolution resolve(String type, Map<String, Object> details, State state, Diagram diagram) {
        message("CRF: Resolving conflict type '" + type + "'");
        var t = ConflictType.of(type);
        if (t.isEmpty()) {
            warning("CRF: Unknown conflict type '" + type + "', halting");
            return halt(Map.of("reason", "Unknown conflict type: " + type), state);
        }
        return switch (t.get()) {
            case HARD_VIOLATION -> halt(details, state);
            case AMBIGUOUS_CHOICE -> bifurcate(details, state);
            case SCOPE_OVERFLOW -> escalate(details, state);
            case DOF_INTERFERENCE -> partition(details, state);
            case TEMPORAL_MISMATCH -> defer(details, state);
            case SOFT_VIOLATION -> attenuate(details, state);
        };
    }

    /** Resolves only the most severe of several simultaneous conflicts; unknown types rank highest. */
    public Optional<Resolution> resolveMostSevere(List<Conflict> conflicts, State state, Diagram diagram) {
        return conflicts.stream()
                .min(Comparator.comparingInt(c -> ConflictType.of(c.type()).map(Enum::ordinal).orElse(-1)))
                .map(c -> resolve(c.type(), c.details(), state, diagram));
    }

    private static Resolution halt(Map<String, Object> details, State state) {
        var reason = String.valueOf(details.getOrDefault("reason", "Unresolvable hard constraint violation"));
        return new Resolution(Action.HALT, false, "Halted execution: " + reason, details, state.withHalt(reason));
    }

    private static Resolution bifurcate(Map<String, Object> details, State state) {
        var choices = list(details.get("choices"));
        return new Resolution(Action.BIFURCATE, true, "Bifurcated state into " + choices.size() + " parallel branches",
                Map.of("choices", choices), state.withBifurcation(choices));
    }

    private static Resolution escalate(Map<String, Object> details, State state) {
        var scope = details.getOrDefault("scope", "local");
        return new Resolution(Action.ESCALATE, true, "Escalated " + scope + " conflict to global scope", details, state.withEscalated(details));
    }

    private static Resolution partition(Map<String, Object> details, State state) {
        var elements = list(details.get("conflicting_elements"));
        return new Resolution(Action.PARTITION, true, "Partitioned " + elements.size() + " conflicting elements into separate compartments",
                Map.of("elements", elements), state.withPartitioned(elements));
    }

    private static Resolution defer(Map<String, Object> details, State state) {
        var type = details.getOrDefault("type", "unknown");
        return new Resolution(Action.DEFER, true, "Deferred conflict of type " + type + " to next compartment", details, state.withDeferred(details));
    }

    private static Resolution attenuate(Map<String, Object> details, State state) {
        var constraintId = String.valueOf(details.getOrDefault("constraint_id", "unknown"));
        message("CRF: Attenuating constraint " + constraintId);
        return new Resolution(Action.ATTENUATE, true, "Attenuated soft constraint " + constraintId,
                Map.of("constraint_id", constraintId), state.withAttenuated(constraintId));
    }

    private static List<Object> list(@Nullable Object o) {
        return o instanceof Collection<?> c ? new ArrayList<>(c) : List.of();
    }

    /**
     * Evaluates each constraint once against the whole diagram. A failing hard constraint is an
     * error, a failing soft one a warning; an unknown predicate is a warning.
     */
    public Findings evaluate(List<Constraint> constraints, State state, Diagram diagram, Csi csi) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        for (var c : constraints) {
            if (c.predicate() == null || c.predicate().isEmpty()) continue;
            var p = predicates.get(c.predicate());
            if (p.isEmpty()) {
                warnings.add("Unknown predicate " + c.predicate());
                continue;
            }
            var check = p.get().test(state, diagram, csi);
            if (check.ok()) continue;
            var msg = c.id() + " failed: " + check.message();
            (c.type() == Severity.HARD ? errors : warnings).add(msg);
        }
        return new Findings(errors, warnings);
    }

    /**
     * Diagram-global labelling: every element gets N if any hard constraint fails, else U if any
     * soft constraint fails, else I. Without constraints everything is I.
     */
    public Map<String, Label> label(Diagram diagram, List<Constraint> constraints, State state, Csi csi) {
        var verdict = Label.I;
        for (var c : constraints) {
            var p = predicates.get(c.predicate());
            if (p.isEmpty() || p.get().test(state, diagram, csi).ok()) continue;
            if (c.type() == Severity.HARD) {
                verdict = Label.N;
                break;
            }
            verdict = Label.U;
        }
        var labels = new LinkedHashMap<String, Label>();
        for (var id : diagram.elementIds()) labels.put(id, verdict);
        return labels;
    }

    /** Labels the state if it has no label map yet; otherwise returns it unchanged. */
    public State ensureLabeled(State state, Diagram diagram, List<Constraint> constraints, Csi csi) {
        return state.labeled() ? state : state.withLabels(label(diagram, constraints, state, csi));
    }

    public static Admissibility admissible(State state) {
        if (!state.labeled()) return new Admissibility(false, "inu_labels missing or invalid");
        var unresolved = 0;
        for (var e : state.labels().entrySet()) {
            if (e.getValue() == Label.N) return new Admissibility(false, "Element " + e.getKey() + " is N (forbidden)");
            if (e.getValue() == Label.U) unresolved++;
        }
        return unresolved > 0
                ? new Admissibility(true, "Admissible with " + unresolved + " unresolved (U) elements")
                : new Admissibility(true, "All elements admissible (I)");
    }

    /**
     * Constraint evaluation followed by the rule's preconditions. The returned authorization
     * carries the state labelled for the check.
     */
    public Authorization authorize(List<Constraint> constraints, State state, Diagram diagram, Csi csi, RewriteRule rule) {
        var labeled = ensureLabeled(state, diagram, constraints, csi);
        var f = evaluate(constraints, labeled, diagram, csi);
        var warnings = new ArrayList<>(f.warnings());
        if (!f.errors().isEmpty()) return new Authorization(false, f.errors(), warnings, labeled);

        for (var pre : rule.preconditions()) {
            switch (pre) {
                case RewriteRule.PRE_ADMISSIBLE -> {
                    var a = admissible(labeled);
                    if (!a.ok())
                        return new Authorization(false, List.of(rule.id() + " precondition failed: " + a.message()), warnings, labeled);
                }
                case RewriteRule.PRE_NO_HARD_CONFLICT -> {
                }
                default -> warnings.add("Rewrite " + rule.id() + " has unknown precondition " + pre);
            }
        }
        return new Authorization(true, List.of(), warnings, labeled);
    }

    /** Conflict categories, most severe first. */
    public enum ConflictType {
        HARD_VIOLATION, AMBIGUOUS_CHOICE, SCOPE_OVERFLOW, DOF_INTERFERENCE, TEMPORAL_MISMATCH, SOFT_VIOLATION;

        public static Optional<ConflictType> of(@Nullable String key) {
            return Arrays.stream(values()).filter(t -> t.key().equals(key)).findFirst();
        }

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Action {
        HALT, BIFURCATE, ESCALATE, PARTITION, DEFER, ATTENUATE
    }

    public record Conflict(String type, Map<String, Object> details) {
        public Conflict {
            details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        }
    }

    public record Resolution(Action action, boolean success, String message, Map<String, Object> data, State newState) {
        public Resolution {
            data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }

        public boolean halted() {
            return action == Action.HALT;
        }
    }

    public record Findings(List<String> errors, List<String> warnings) {
        public Findings {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }
    }

    public record Admissibility(boolean ok, String message) {
    }

    public record Authorization(boolean authorized, List<String> errors, List<String> warnings, State state) {
        public Authorization {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }
    }
}
