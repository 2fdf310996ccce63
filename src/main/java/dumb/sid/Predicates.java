package dumb.sid;

import dumb.sid.SidPackage.Csi;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static dumb.sid.util.Log.debug;

/**
 * Named boolean checks over {@code (state, diagram, csi)}. Built once and handed to whoever
 * evaluates constraints; there is no global registry.
 */
public final class Predicates {
    public static final String NO_CROSS_CSI_INTERACTION = "no_cross_csi_interaction";
    public static final String COLLAPSE_IRREVERSIBLE = "collapse_irreversible";
    public static final String NO_CYCLES = "no_cycles";
    public static final String VALID_COMPARTMENT_TRANSITIONS = "valid_compartment_transitions";

    private final Map<String, Predicate> table;

    private Predicates(Map<String, Predicate> table) {
        this.table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
        debug("Predicate registry: " + this.table.keySet());
    }

    public static Predicates standard() {
        var t = new LinkedHashMap<String, Predicate>();
        t.put(NO_CROSS_CSI_INTERACTION, Predicates::noCrossCsiInteraction);
        t.put(COLLAPSE_IRREVERSIBLE, Predicates::collapseIrreversible);
        t.put(NO_CYCLES, Predicates::noCycles);
        t.put(VALID_COMPARTMENT_TRANSITIONS, Predicates::validCompartmentTransitions);
        return new Predicates(t);
    }

    /** The standard table plus extra entries; an extra entry replaces a standard one of the same name. */
    public static Predicates with(Map<String, Predicate> extra) {
        var t = new LinkedHashMap<>(standard().table);
        t.putAll(extra);
        return new Predicates(t);
    }

    public Optional<Predicate> get(@Nullable String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(table.get(name));
    }

    public Set<String> names() {
        return table.keySet();
    }

    static Check noCrossCsiInteraction(State state, Diagram diagram, Csi csi) {
        if (csi.pairs().isEmpty()) return Check.ok("No allowed_pairs defined; skipping pair check");
        for (var e : diagram.edges()) {
            var from = diagram.node(e.from());
            var to = diagram.node(e.to());
            if (from.isEmpty() || to.isEmpty()) continue;
            for (var fd : from.get().dofRefs())
                for (var td : to.get().dofRefs())
                    if (!csi.allows(fd, td))
                        return Check.fail("Edge " + e.id() + " violates CSI pair (" + fd + ", " + td + ")");
        }
        return Check.ok("All edges within CSI pairs");
    }

    static Check collapseIrreversible(State state, Diagram diagram, Csi csi) {
        return diagram.nodes(Op.O).filter(n -> !n.markedIrreversible()).findFirst()
                .map(n -> Check.fail("Collapse node " + n.id() + " must be marked irreversible"))
                .orElse(Check.ok("All collapse nodes properly marked"));
    }

    static Check noCycles(State state, Diagram diagram, Csi csi) {
        return Graphs.findCycle(diagram)
                .map(n -> Check.fail("Cycle detected involving node " + n))
                .orElse(Check.ok("No cycles detected"));
    }

    static Check validCompartmentTransitions(State state, Diagram diagram, Csi csi) {
        return diagram.nodes(Op.T).filter(n -> !hasTarget(n)).findFirst()
                .map(n -> Check.fail("Transport node " + n.id() + " missing target_compartment in meta"))
                .orElse(Check.ok("All transport nodes valid"));
    }

    static boolean hasTarget(Diagram.Node n) {
        var target = n.meta().get(Diagram.META_TARGET_COMPARTMENT);
        return target != null && !"".equals(target) && !Boolean.FALSE.equals(target);
    }

    @FunctionalInterface
    public interface Predicate {
        Check test(State state, Diagram diagram, Csi csi);
    }

    public record Check(boolean ok, String message) {
        public static Check ok(String message) {
            return new Check(true, message);
        }

        public static Check fail(String message) {
            return new Check(false, message);
        }
    }
}
