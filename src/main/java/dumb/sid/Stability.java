package dumb.sid;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.sid.Predicates.Check;
import dumb.sid.SidPackage.Constraint;
import dumb.sid.SidPackage.Csi;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static dumb.sid.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Decides whether rewriting has reached a fixpoint. Four conditions are tested independently;
 * by default any one suffices, in strict mode all four are required.
 */
public class Stability {

    public static final int CONDITIONS = 4;

    private final Conflicts crf;

    public Stability(Conflicts crf) {
        this.crf = requireNonNull(crf);
    }

    public Report check(SidPackage pkg, String stateId, String diagramId, double tolerance, boolean requireAll) {
        var state = pkg.state(stateId).orElse(null);
        var diagram = pkg.diagram(diagramId).orElse(null);
        var csi = state == null ? null : pkg.csi(state.csiId()).orElse(null);
        if (state == null || diagram == null || csi == null)
            return new Report(false, List.of(), "Missing state, diagram, or CSI");

        var constraints = pkg.constraints();
        var checks = List.of(
                noAdmissibleRewrites(pkg.rewriteRules(), constraints, state, diagram, csi),
                invariantUnderTransport(diagram, state, csi, constraints),
                onlyIdentityRewrites(pkg.rewriteRules(), constraints, state, diagram, csi),
                loopConvergence(state, tolerance));
        var satisfied = checks.stream().filter(c -> c.ok()).map(c -> "[OK] " + c.message()).toList();

        boolean stable;
        String msg;
        if (requireAll) {
            stable = satisfied.size() == CONDITIONS;
            msg = stable
                    ? "System is STABLE (all " + CONDITIONS + " conditions met)"
                    : "System is NOT STABLE (" + satisfied.size() + "/" + CONDITIONS + " conditions met, need all)";
        } else {
            stable = !satisfied.isEmpty();
            msg = stable
                    ? "System is STABLE (" + satisfied.size() + " condition(s) met)"
                    : "System is NOT STABLE (no termination conditions met)";
        }
        message("Stability check: " + msg);
        return new Report(stable, satisfied, msg);
    }

    /** Checks every rule for authorization and applicability without committing anything. */
    public Check noAdmissibleRewrites(List<RewriteRule> rules, List<Constraint> constraints, State state, Diagram diagram, Csi csi) {
        for (var rule : rules)
            if (crf.authorize(constraints, state, diagram, csi, rule).authorized() && Rewrite.applicable(diagram, rule))
                return Check.fail("Rewrite " + rule.id() + " is still admissible");
        return Check.ok("No admissible rewrites remain");
    }

    /**
     * Every T node must itself be admissible, and nothing labelled I in the state may lose
     * that label on re-evaluation. New admissible elements are fine.
     */
    public Check invariantUnderTransport(Diagram diagram, State state, Csi csi, List<Constraint> constraints) {
        var transports = diagram.nodes(Op.T).toList();
        if (transports.isEmpty()) return Check.ok("No transport operations present");

        var computed = crf.label(diagram, constraints, state, csi);
        for (var t : transports)
            if (computed.get(t.id()) != Label.I)
                return Check.fail("Transport node " + t.id() + " is not in admissible region");
        for (var e : state.labelsOrEmpty().entrySet())
            if (e.getValue() == Label.I && computed.get(e.getKey()) != Label.I)
                return Check.fail("Previously admissible element " + e.getKey() + " is no longer admissible");
        return Check.ok("Admissible region invariant under transport");
    }

    public Check onlyIdentityRewrites(List<RewriteRule> rules, List<Constraint> constraints, State state, Diagram diagram, Csi csi) {
        for (var rule : rules) {
            if (Rewrite.isIdentity(rule)) continue;
            if (crf.authorize(constraints, state, diagram, csi, rule).authorized())
                return Check.fail("Non-identity rewrite " + rule.id() + " present");
        }
        return Check.ok("Only identity rewrites authorized");
    }

    /** Compares the last two loop history snapshots. Fewer than two is never converged. */
    public static Check loopConvergence(State state, double tolerance) {
        var history = state.loopHistory();
        if (history.size() < 2) return Check.fail("Insufficient loop history for convergence check");
        var delta = Delta.of(history.get(history.size() - 2), history.get(history.size() - 1));
        if (delta.changes == 0) return Check.ok("Loop has fully converged (no changes)");
        var ratio = delta.ratio();
        return ratio < tolerance
                ? Check.ok("Loop gain converged (change ratio: " + fmt(ratio) + ")")
                : Check.fail("Loop not converged (change ratio: " + fmt(ratio) + ")");
    }

    private static String fmt(double x) {
        return String.format(Locale.ROOT, "%.6f", x);
    }

    /**
     * Structural metrics. A ratio whose denominator is zero is left undefined ({@code null}),
     * never replaced by a default.
     */
    public Optional<Metrics> metrics(SidPackage pkg, String stateId, String diagramId) {
        var state = pkg.state(stateId);
        var diagram = pkg.diagram(diagramId);
        if (state.isEmpty() || diagram.isEmpty()) return Optional.empty();
        var s = state.get();
        var d = diagram.get();

        var labels = s.labelsOrEmpty();
        var admissible = (int) labels.values().stream().filter(l -> l == Label.I).count();
        var nodes = d.nodes().size();
        var collapse = (int) d.nodes(Op.O).count();
        var coupling = (int) d.nodes(Op.C).count();
        var transport = (int) d.nodes(Op.T).count();
        var validTransport = (int) d.nodes(Op.T).filter(Predicates::hasTarget).count();

        var history = s.loopHistory();
        Double loopGain = history.size() < 2 ? null
                : Delta.of(history.get(history.size() - 2), history.get(history.size() - 1)).gain();

        return Optional.of(new Metrics(admissible, ratio(admissible, labels.size()),
                collapse, ratio(collapse, nodes),
                coupling, ratio(coupling, nodes),
                transport, ratio(validTransport, transport),
                loopGain));
    }

    private static @Nullable Double ratio(int n, int total) {
        return total == 0 ? null : (double) n / total;
    }

    private record Delta(int changes, int keys) {
        static Delta of(State.Snapshot prev, State.Snapshot curr) {
            var keys = new LinkedHashSet<>(prev.labels().keySet());
            keys.addAll(curr.labels().keySet());
            var changes = (int) keys.stream().filter(k -> prev.labels().get(k) != curr.labels().get(k)).count();
            return new Delta(changes, keys.size());
        }

        double ratio() {
            return keys == 0 ? 0 : (double) changes / keys;
        }

        @Nullable Double gain() {
            return Stability.ratio(changes, keys);
        }
    }

    public record Report(boolean stable, List<String> satisfied, String message) {
        public Report {
            satisfied = List.copyOf(satisfied);
        }
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record Metrics(@JsonProperty("admissible_volume") int admissibleVolume,
                          @JsonProperty("admissible_ratio") @Nullable Double admissibleRatio,
                          @JsonProperty("collapse_count") int collapseCount,
                          @JsonProperty("collapse_ratio") @Nullable Double collapseRatio,
                          @JsonProperty("coupling_count") int couplingCount,
                          @JsonProperty("gradient_coherence") @Nullable Double gradientCoherence,
                          @JsonProperty("transport_count") int transportCount,
                          @JsonProperty("transport_fidelity") @Nullable Double transportFidelity,
                          @JsonProperty("loop_gain") @Nullable Double loopGain) {
    }
}
