package dumb.sid;

import dumb.sid.ExprParser.ParseException;
import dumb.sid.SidPackage.Csi;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Function;

import static dumb.sid.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Whole-package consistency checks. One pass collects every finding instead of stopping at the
 * first; nothing here throws for a malformed package.
 */
public class Validator {

    private final Conflicts crf;

    public Validator(Conflicts crf) {
        this.crf = requireNonNull(crf);
    }

    public Report validate(SidPackage pkg) {
        var out = new ArrayList<Finding>();
        var diagrams = index(pkg.diagrams(), Diagram::id, "diagram", out);
        var csis = index(pkg.csis(), Csi::id, "CSI", out);
        var dofs = index(pkg.dofs(), SidPackage.Dof::id, "DOF", out);
        var compartments = index(pkg.compartments(), SidPackage.Compartment::id, "compartment", out);
        var states = index(pkg.states(), State::id, "state", out);

        for (var d : diagrams.values()) diagram(d, dofs.keySet(), compartments.keySet(), out);
        for (var s : states.values()) stateRefs(s, diagrams.keySet(), csis.keySet(), compartments.keySet(), out);
        for (var d : diagrams.values()) collapse(d, out);
        for (var c : csis.values()) csiPairs(c, dofs.keySet(), out);
        for (var s : states.values()) csiBoundaries(s, diagrams, csis, out);
        for (var r : pkg.rewriteRules()) rule(r, out);

        var constraints = pkg.constraints();
        for (var s : states.values()) {
            var d = diagrams.get(s.diagramId());
            var csi = csis.get(s.csiId());
            if (d == null || csi == null) continue;
            var labeled = crf.ensureLabeled(s, d, constraints, csi);
            var f = crf.evaluate(constraints, labeled, d, csi);
            for (var w : f.warnings())
                out.add(Finding.warning(Category.CONSTRAINT_VIOLATION, w, Map.of("state_id", s.id())));
            for (var e : f.errors())
                out.add(Finding.error(Category.CONSTRAINT_VIOLATION, e, Map.of("state_id", s.id())));
        }

        var report = new Report(out);
        message("Validation complete: " + report.errors().size() + " errors, " + report.warnings().size() + " warnings");
        return report;
    }

    private static <X> Map<String, X> index(List<X> items, Function<X, String> id, String type, List<Finding> out) {
        var index = new LinkedHashMap<String, X>();
        for (var x : items) {
            var key = id.apply(x);
            if (key == null || key.isEmpty())
                out.add(Finding.error(Category.MISSING_ID, type + " missing id", Map.of("item_type", type)));
            else if (index.containsKey(key))
                out.add(Finding.error(Category.DUPLICATE_ID, "Duplicate " + type + " id: " + key, Map.of("item_type", type, "id", key)));
            else
                index.put(key, x);
        }
        return index;
    }

    private static void diagram(Diagram d, Set<String> dofs, Set<String> compartments, List<Finding> out) {
        var did = d.id();
        var nodeIds = new HashSet<String>();
        for (var n : d.nodes()) {
            if (n.id() == null || n.id().isEmpty()) {
                out.add(Finding.error(Category.MISSING_ID, "Diagram " + did + " has node missing id", ctx("diagram_id", did)));
                continue;
            }
            if (!nodeIds.add(n.id()))
                out.add(Finding.error(Category.DUPLICATE_ID, "Diagram " + did + " has duplicate node id " + n.id(),
                        ctx("diagram_id", did, "node_id", n.id())));
            for (var dof : n.dofRefs())
                if (!dofs.contains(dof))
                    out.add(Finding.error(Category.MISSING_REFERENCE, "Diagram " + did + " node " + n.id() + " references unknown DOF " + dof,
                            ctx("diagram_id", did, "node_id", n.id(), "dof", dof)));
        }

        var edgeIds = new HashSet<String>();
        for (var e : d.edges()) {
            if (e.id() == null || e.id().isEmpty()) {
                out.add(Finding.error(Category.MISSING_ID, "Diagram " + did + " has edge missing id", ctx("diagram_id", did)));
                continue;
            }
            if (!edgeIds.add(e.id()))
                out.add(Finding.error(Category.DUPLICATE_ID, "Diagram " + did + " has duplicate edge id " + e.id(),
                        ctx("diagram_id", did, "edge_id", e.id())));
            if (!nodeIds.contains(e.from()) || !nodeIds.contains(e.to()))
                out.add(Finding.error(Category.MISSING_REFERENCE, "Diagram " + did + " edge " + e.id() + " references missing node",
                        ctx("diagram_id", did, "edge_id", e.id(), "from", e.from(), "to", e.to())));
        }

        for (var n : d.nodes())
            for (var in : n.inputs())
                if (!nodeIds.contains(in))
                    out.add(Finding.error(Category.MISSING_REFERENCE, "Diagram " + did + " node " + n.id() + " references missing input " + in,
                            ctx("diagram_id", did, "node_id", n.id(), "input_id", in)));

        var cid = d.compartmentId();
        if (cid != null && !cid.isEmpty() && !compartments.contains(cid))
            out.add(Finding.error(Category.MISSING_REFERENCE, "Diagram " + did + " references missing compartment " + cid,
                    ctx("diagram_id", did, "compartment_id", cid)));
    }

    private static void stateRefs(State s, Set<String> diagrams, Set<String> csis, Set<String> compartments, List<Finding> out) {
        if (!diagrams.contains(s.diagramId()))
            out.add(Finding.error(Category.MISSING_REFERENCE, "State " + s.id() + " references missing diagram " + s.diagramId(),
                    ctx("state_id", s.id(), "diagram_id", s.diagramId())));
        if (!csis.contains(s.csiId()))
            out.add(Finding.error(Category.MISSING_REFERENCE, "State " + s.id() + " references missing CSI " + s.csiId(),
                    ctx("state_id", s.id(), "csi_id", s.csiId())));
        var cid = s.compartmentId();
        if (cid != null && !cid.isEmpty() && !compartments.contains(cid))
            out.add(Finding.error(Category.MISSING_REFERENCE, "State " + s.id() + " references missing compartment " + cid,
                    ctx("state_id", s.id(), "compartment_id", cid)));
    }

    private static void collapse(Diagram d, List<Finding> out) {
        d.nodes(Op.O).filter(n -> !n.markedIrreversible()).forEach(n ->
                out.add(Finding.error(Category.COLLAPSE_NOT_IRREVERSIBLE,
                        "Collapse node " + n.id() + " in diagram " + d.id() + " must set irreversible=true",
                        ctx("diagram_id", d.id(), "node_id", n.id(), "op", Op.O.symbol))));
    }

    /** Every declared CSI, referenced or not: pairs must be two known DOFs. */
    private static void csiPairs(Csi csi, Set<String> dofs, List<Finding> out) {
        var cid = csi.id();
        for (var pair : csi.allowedPairs()) {
            if (pair.size() != 2) {
                out.add(Finding.error(Category.INVALID_CSI_PAIR, "CSI " + cid + " allowed_pair must have exactly 2 elements, got " + pair.size(),
                        ctx("csi_id", cid, "pair", pair)));
                continue;
            }
            for (var dof : pair)
                if (!dofs.contains(dof))
                    out.add(Finding.error(Category.INVALID_CSI_PAIR_DOF, "CSI " + cid + " allowed_pair references unknown DOF: " + dof,
                            ctx("csi_id", cid, "pair", pair, "unknown_dof", dof)));
        }
    }

    /** DOF usage and edge coupling of a state's diagram against the state's CSI. */
    private static void csiBoundaries(State s, Map<String, Diagram> diagrams, Map<String, Csi> csis, List<Finding> out) {
        var d = diagrams.get(s.diagramId());
        var csi = csis.get(s.csiId());
        if (d == null || csi == null) {
            out.add(Finding.error(Category.MISSING_REFERENCE, "State " + s.id() + " references missing diagram or CSI",
                    ctx("state_id", s.id(), "diagram_id", s.diagramId(), "csi_id", s.csiId())));
            return;
        }
        var cid = csi.id();
        var allowed = new HashSet<>(csi.allowedDofs());
        for (var n : d.nodes())
            for (var dof : n.dofRefs())
                if (!allowed.contains(dof))
                    out.add(Finding.error(Category.DOF_OUTSIDE_CSI, "Diagram " + d.id() + " node " + n.id() + " uses DOF " + dof + " outside CSI " + cid,
                            ctx("diagram_id", d.id(), "node_id", n.id(), "dof", dof, "csi_id", cid)));

        var pairs = csi.pairs();
        if (pairs.isEmpty()) return;
        for (var e : d.edges()) {
            var from = d.node(e.from());
            var to = d.node(e.to());
            if (from.isEmpty() || to.isEmpty()) continue;
            for (var fd : from.get().dofRefs())
                for (var td : to.get().dofRefs()) {
                    var p = new SidPackage.Pair(fd, td);
                    if (!pairs.contains(p))
                        out.add(Finding.error(Category.CSI_PAIR_VIOLATION, "Diagram " + d.id() + " edge " + e.id() + " violates CSI " + cid + " pair " + p,
                                ctx("diagram_id", d.id(), "edge_id", e.id(), "csi_id", cid, "pair", List.of(fd, td))));
                }
        }
    }

    /** A rule needs one complete form; expression forms are parsed now so bad patterns surface early. */
    private static void rule(RewriteRule r, List<Finding> out) {
        if (!r.hasEdgeForm() && !r.hasExprForm())
            out.add(Finding.error(Category.INVALID_REWRITE_RULE,
                    "Rewrite " + r.id() + " must define pattern+replacement or pattern_expr+replacement_expr", ctx("rule_id", r.id())));
        if (!r.hasExprForm()) return;
        try {
            ExprParser.parse(r.patternExpr());
            ExprParser.parse(r.replacementExpr());
        } catch (ParseException e) {
            out.add(Finding.error(Category.INVALID_REWRITE_EXPR, "Rewrite " + r.id() + " has invalid expr: " + e.getMessage(),
                    ctx("rule_id", r.id(), "error", e.getMessage())));
        }
    }

    /** Ordered key/value context tolerating null values, which {@link Map#of} does not. */
    private static Map<String, Object> ctx(@Nullable Object... kv) {
        var m = new LinkedHashMap<String, Object>();
        for (var i = 0; i + 1 < kv.length; i += 2) m.put(String.valueOf(kv[i]), kv[i + 1]);
        return Collections.unmodifiableMap(m);
    }

    public enum Category {
        MISSING_ID,
        DUPLICATE_ID,
        MISSING_REFERENCE,
        COLLAPSE_NOT_IRREVERSIBLE,
        INVALID_CSI_PAIR,
        INVALID_CSI_PAIR_DOF,
        DOF_OUTSIDE_CSI,
        CSI_PAIR_VIOLATION,
        INVALID_REWRITE_RULE,
        INVALID_REWRITE_EXPR,
        CONSTRAINT_VIOLATION;

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Level {ERROR, WARNING}

    public record Finding(Category category, Level level, String message, Map<String, Object> context) {
        static Finding error(Category c, String message, Map<String, Object> context) {
            return new Finding(c, Level.ERROR, message, context);
        }

        static Finding warning(Category c, String message, Map<String, Object> context) {
            return new Finding(c, Level.WARNING, message, context);
        }

        public boolean isError() {
            return level == Level.ERROR;
        }

        @Override
        public String toString() {
            return message;
        }
    }

    public record Report(List<Finding> findings) {
        public Report {
            findings = List.copyOf(findings);
        }

        public List<String> errors() {
            return findings.stream().filter(Finding::isError).map(Finding::message).toList();
        }

        public List<String> warnings() {
            return findings.stream().filter(f -> !f.isError()).map(Finding::message).toList();
        }

        public boolean ok() {
            return findings.stream().noneMatch(Finding::isError);
        }

        public List<Finding> of(Category c) {
            return findings.stream().filter(f -> f.category() == c).toList();
        }
    }
}
