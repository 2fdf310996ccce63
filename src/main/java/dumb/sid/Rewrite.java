package dumb.sid;

import dumb.sid.Diagram.Edge;
import dumb.sid.Diagram.Node;
import dumb.sid.Diagram.StructureException;
import dumb.sid.ExprParser.ParseException;
import dumb.sid.RulePattern.SidePattern;
import dumb.sid.SidPackage.Constraint;
import dumb.sid.SidPackage.Csi;

import java.util.*;

import static dumb.sid.util.Log.debug;
import static dumb.sid.util.Log.warning;
import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

/**
 * Constrained graph rewriting. Every rule application is authorized by the {@link Conflicts}
 * framework, built on a private working copy, checked for cycles and only then returned. A
 * rejected rewrite returns the input diagram untouched.
 */
public class Rewrite {

    private static final String DEFAULT_RULE_ID = "rw";

    private final Conflicts crf;
    private final Sid.Configuration config;

    public Rewrite(Conflicts crf, Sid.Configuration config) {
        this.crf = requireNonNull(crf);
        this.config = requireNonNull(config);
    }

    /**
     * Authorizes and applies one rule. With {@code all} every non-overlapping match is
     * rewritten, up to the configured match cap; otherwise only the first one. A diagram with
     * dangling references is never rewritten.
     */
    public Result apply(List<Constraint> constraints, State state, Diagram diagram, Csi csi, RewriteRule rule, boolean all) {
        var messages = new ArrayList<String>();
        try {
            diagram.checkStructure();
        } catch (StructureException e) {
            warning("Rewrite " + rule.id() + " skipped: " + e.getMessage());
            messages.add("ERROR: " + e.getMessage());
            return Result.unchanged(diagram, messages);
        }
        var auth = crf.authorize(constraints, state, diagram, csi, rule);
        for (var w : auth.warnings()) messages.add("WARNING: " + w);
        if (!auth.authorized()) {
            for (var e : auth.errors()) messages.add("ERROR: " + e);
            warning("Rewrite " + rule.id() + " skipped: " + auth.errors());
            return Result.unchanged(diagram, messages);
        }
        return rule.hasExprForm()
                ? applyExpr(diagram, rule, all, messages)
                : applyEdges(diagram, rule, all, messages);
    }

    private Result applyExpr(Diagram diagram, RewriteRule rule, boolean all, List<String> messages) {
        Expr pattern, replacement;
        try {
            pattern = ExprParser.parse(rule.patternExpr());
            replacement = ExprParser.parse(rule.replacementExpr());
        } catch (ParseException e) {
            messages.add("ERROR: " + e.getMessage());
            return Result.unchanged(diagram, messages);
        }

        var matches = Matcher.exprAll(diagram, pattern, all ? config.maxMatches() : 1);
        if (matches.isEmpty()) {
            messages.add("Rewrite " + rule.id() + " not applicable");
            return Result.unchanged(diagram, messages);
        }

        var draft = new Draft(diagram, ruleId(rule));
        try {
            for (var match : matches) {
                var root = draft.build(replacement, new LinkedHashMap<>(match.bindings()));
                var removed = new LinkedHashSet<>(match.matched());
                removed.removeAll(match.bound());
                draft.splice(removed, root);
            }
        } catch (StructureException e) {
            messages.add("ERROR: " + e.getMessage());
            return Result.unchanged(diagram, messages);
        }
        return commit(diagram, draft, rule, messages);
    }

    private Result applyEdges(Diagram diagram, RewriteRule rule, boolean all, List<String> messages) {
        RulePattern pattern, replacement;
        try {
            pattern = RulePattern.parse(rule.pattern());
            replacement = RulePattern.parse(rule.replacement());
        } catch (IllegalArgumentException e) {
            messages.add("ERROR: " + e.getMessage());
            return Result.unchanged(diagram, messages);
        }

        var matches = all
                ? Matcher.all(diagram, pattern, config.maxMatches())
                : Matcher.first(diagram, pattern, Set.of()).stream().toList();
        if (matches.isEmpty()) {
            messages.add("Rewrite " + rule.id() + " not applicable");
            return Result.unchanged(diagram, messages);
        }

        var draft = new Draft(diagram, ruleId(rule));
        try {
            for (var match : matches) draft.replace(match, replacement);
        } catch (StructureException e) {
            messages.add("ERROR: " + e.getMessage());
            return Result.unchanged(diagram, messages);
        }
        return commit(diagram, draft, rule, messages);
    }

    private static Result commit(Diagram original, Draft draft, RewriteRule rule, List<String> messages) {
        var candidate = draft.diagram();
        if (Graphs.hasCycle(candidate)) {
            warning("Rewrite " + rule.id() + " rejected: would introduce a cycle");
            messages.add("ERROR: Rewrite " + rule.id() + " would introduce cycle");
            return Result.unchanged(original, messages);
        }
        debug("Rewrite " + rule.id() + " applied to " + original.id());
        messages.add("Rewrite " + rule.id() + " applied");
        return new Result(true, candidate, messages);
    }

    /**
     * One pass of every rule of the package, in order, against a diagram. The state is labelled
     * up front and relabelled after each applied rewrite. The pass stops with a warning once the
     * iteration ceiling is reached.
     */
    public Result apply(SidPackage pkg, String stateId, String diagramId) {
        var diagram = pkg.diagram(diagramId);
        var state = pkg.state(stateId);
        var csi = state.flatMap(s -> pkg.csi(s.csiId()));
        if (diagram.isEmpty() || state.isEmpty() || csi.isEmpty())
            return Result.unchanged(diagram.orElseGet(() -> new Diagram(diagramId, null, List.of(), List.of())),
                    List.of("ERROR: missing state, diagram, or CSI"));

        var constraints = pkg.constraints();
        var current = diagram.get();
        var s = crf.ensureLabeled(state.get(), current, constraints, csi.get());
        var messages = new ArrayList<String>();
        var applied = false;
        var iteration = 0;
        for (var rule : pkg.rewriteRules()) {
            if (iteration >= config.maxRewriteIterations()) {
                warning("Rewrite iteration limit (" + config.maxRewriteIterations() + ") reached");
                messages.add("WARNING: Iteration limit (" + config.maxRewriteIterations() + ") reached");
                break;
            }
            var r = apply(constraints, s, current, csi.get(), rule, config.applyAll());
            messages.addAll(r.messages());
            if (r.applied()) {
                current = r.diagram();
                s = s.withLabels(crf.label(current, constraints, s, csi.get()));
                applied = true;
            }
            iteration++;
        }
        return new Result(applied, current, messages);
    }

    /**
     * Runs {@link #apply(SidPackage, String, String)} and, when something was rewritten, swaps
     * the new diagram into the package and relabels every state over it, appending a loop
     * history snapshot.
     */
    public Outcome applyToPackage(SidPackage pkg, String stateId, String diagramId) {
        var r = apply(pkg, stateId, diagramId);
        if (!r.applied()) return new Outcome(r, pkg);
        var d = r.diagram();
        var constraints = pkg.constraints();
        var next = pkg.withDiagram(d).mapStates(s -> {
            if (!diagramId.equals(s.diagramId())) return s;
            var csi = pkg.csi(s.csiId());
            if (csi.isEmpty()) return s;
            var labels = crf.label(d, constraints, s, csi.get());
            return s.withLabels(labels).withSnapshot(labels, config.maxLoopHistory());
        });
        return new Outcome(r, next);
    }

    /** Whether the rule's pattern matches somewhere, regardless of authorization. */
    public static boolean applicable(Diagram diagram, RewriteRule rule) {
        if (rule.hasExprForm()) {
            try {
                return Matcher.expr(diagram, ExprParser.parse(rule.patternExpr())).isPresent();
            } catch (ParseException e) {
                debug("Rule " + rule.id() + " has malformed pattern_expr: " + e.getMessage());
                return false;
            }
        }
        if (!rule.hasEdgeForm()) return false;
        try {
            return Matcher.first(diagram, RulePattern.parse(rule.pattern()), Set.of()).isPresent();
        } catch (IllegalArgumentException e) {
            debug("Rule " + rule.id() + " has malformed pattern: " + e.getMessage());
            return false;
        }
    }

    /** Pattern and replacement are structurally equal once parsed. */
    public static boolean isIdentity(RewriteRule rule) {
        try {
            if (rule.hasExprForm())
                return ExprParser.parse(rule.patternExpr()).equals(ExprParser.parse(rule.replacementExpr()));
            if (rule.hasEdgeForm())
                return RulePattern.parse(rule.pattern()).equals(RulePattern.parse(rule.replacement()));
        } catch (ParseException | IllegalArgumentException e) {
            debug("Rule " + rule.id() + " is not parseable: " + e.getMessage());
        }
        return false;
    }

    private static String ruleId(RewriteRule rule) {
        return requireNonNullElse(rule.id(), DEFAULT_RULE_ID);
    }

    /** Working copy of a diagram under rewrite. Never escapes this class half-built. */
    private static final class Draft {
        final Diagram base;
        final String ruleId;
        final List<Node> nodes;
        final List<Edge> edges;
        final Set<String> nodeIds = new HashSet<>();
        final Set<String> edgeIds = new HashSet<>();

        Draft(Diagram base, String ruleId) {
            this.base = base;
            this.ruleId = ruleId;
            this.nodes = new ArrayList<>(base.nodes());
            this.edges = new ArrayList<>(base.edges());
            for (var n : nodes) nodeIds.add(n.id());
            for (var e : edges) edgeIds.add(e.id());
        }

        Diagram diagram() {
            return base.with(nodes, edges);
        }

        /** Smallest free {@code <prefix><k>}, k from 1. */
        private static String freeId(String prefix, Set<String> taken) {
            var k = 1;
            while (taken.contains(prefix + k)) k++;
            return prefix + k;
        }

        String addNode(Op op, List<String> dofRefs, List<String> inputs, Map<String, Object> meta) {
            var id = freeId(ruleId + "_n", nodeIds);
            nodeIds.add(id);
            nodes.add(new Node(id, op, dofRefs, inputs, op == Op.O ? Boolean.TRUE : null, meta));
            return id;
        }

        void addEdge(String from, String to, String label) {
            var id = freeId(ruleId + "_e", edgeIds);
            edgeIds.add(id);
            edges.add(new Edge(id, from, to, label));
        }

        /** Builds a replacement expression the way the compiler would, reusing bound nodes. */
        String build(Expr e, Map<String, String> bindings) {
            if (e instanceof Expr.Atom a) {
                if (a.variable()) return bound(a, bindings);
                return addNode(Op.P, List.of(a.name()), List.of(), Map.of());
            }
            var app = (Expr.Apply) e;
            var atoms = new ArrayList<String>();
            var inputs = new ArrayList<String>();
            for (var arg : app.args()) {
                if (arg instanceof Expr.Atom a) {
                    if (a.variable()) inputs.add(bound(a, bindings));
                    else atoms.add(a.name());
                } else {
                    inputs.add(build(arg, bindings));
                }
            }
            List<String> dofRefs = List.of();
            Map<String, Object> meta = Map.of();
            if (app.op().bearsDofs() && !atoms.isEmpty() && inputs.isEmpty()) dofRefs = atoms;
            else if (!atoms.isEmpty()) meta = Map.of(Diagram.META_ATOM_ARGS, List.copyOf(atoms));

            var id = addNode(app.op(), dofRefs, inputs, meta);
            for (var in : inputs) addEdge(in, id, Diagram.ARG);
            return id;
        }

        private static String bound(Expr.Atom a, Map<String, String> bindings) {
            var id = bindings.get(a.varName());
            if (id == null) throw new StructureException("Unbound variable " + a.name());
            return id;
        }

        /**
         * Drops the removed nodes and the edges inside them. Edges and inputs crossing the
         * removed region are reattached to {@code root}; self loops and duplicates that this
         * produces are dropped.
         */
        void splice(Set<String> removed, String root) {
            var keptNodes = new ArrayList<Node>();
            for (var n : nodes) {
                if (removed.contains(n.id())) continue;
                if (n.inputs().stream().noneMatch(removed::contains)) {
                    keptNodes.add(n);
                    continue;
                }
                var inputs = n.inputs().stream()
                        .map(in -> removed.contains(in) ? root : in)
                        .filter(in -> !in.equals(n.id()))
                        .distinct().toList();
                keptNodes.add(n.withInputs(inputs));
            }

            var keptEdges = new ArrayList<Edge>();
            var seen = new HashSet<List<String>>();
            for (var e : edges) {
                var fromRemoved = removed.contains(e.from());
                var toRemoved = removed.contains(e.to());
                if (fromRemoved && toRemoved) continue;
                var x = toRemoved ? e.withTo(root) : fromRemoved ? e.withFrom(root) : e;
                if (Objects.equals(x.from(), x.to())) continue;
                if (seen.add(Arrays.asList(x.from(), x.to(), x.label()))) keptEdges.add(x);
            }

            nodes.clear();
            nodes.addAll(keptNodes);
            edges.clear();
            edges.addAll(keptEdges);
            nodeIds.removeAll(removed);
        }

        /**
         * Removes the consumed edges and adds one edge per replacement pattern. A bound
         * variable with an operator gets a wrapper node over the bound node, shared within the
         * match; an unbound variable must name an operator and creates a fresh node.
         */
        void replace(Matcher.Match match, RulePattern replacement) {
            var consumed = new HashSet<>(match.edges());
            edges.removeIf(e -> consumed.contains(e.id()));
            edgeIds.removeAll(consumed);

            var bindings = new LinkedHashMap<>(match.bindings());
            var wrappers = new HashMap<List<String>, String>();
            for (var p : replacement.edges()) {
                var from = ensure(p.left(), bindings, wrappers);
                var to = ensure(p.right(), bindings, wrappers);
                addEdge(from, to, p.label());
            }
        }

        private String ensure(SidePattern side, Map<String, String> bindings, Map<List<String>, String> wrappers) {
            var id = bindings.get(side.var());
            if (id != null) {
                if (side.op() == null) return id;
                return wrappers.computeIfAbsent(List.of(side.op().symbol, id),
                        k -> addNode(side.op(), List.of(), List.of(id), Map.of()));
            }
            if (side.op() == null)
                throw new StructureException("Unbound variable " + side.var() + " requires op in replacement");
            var created = addNode(side.op(), List.of(), List.of(), Map.of());
            bindings.put(side.var(), created);
            return created;
        }
    }

    public record Result(boolean applied, Diagram diagram, List<String> messages) {
        public Result {
            requireNonNull(diagram);
            messages = List.copyOf(messages);
        }

        static Result unchanged(Diagram d, List<String> messages) {
            return new Result(false, d, messages);
        }
    }

    /** A rewrite pass together with the package it produced. */
    public record Outcome(Result result, SidPackage pkg) {
    }
}
