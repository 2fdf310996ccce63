package dumb.sid;

import dumb.sid.Diagram.Edge;
import dumb.sid.Diagram.Node;
import dumb.sid.RulePattern.EdgePattern;
import dumb.sid.RulePattern.SidePattern;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Finds rewrite patterns in diagrams. Enumeration follows document order of edges and nodes,
 * so equal inputs always give equal matches.
 */
enum Matcher {
    ;

    /**
     * Backtracking search over the edges. The work-stack holds one frame per pattern position
     * with the bindings and consumed edges so far and an iterator over the remaining candidates.
     */
    static Optional<Match> first(Diagram d, RulePattern pattern, Set<String> forbidden) {
        var edges = d.edges();
        var patterns = pattern.edges();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(0, Map.of(), List.of(), edges.iterator()));
        while (!stack.isEmpty()) {
            var top = stack.peek();
            if (top.index == patterns.size())
                return Optional.of(new Match(top.bindings, top.used));
            if (!top.next.hasNext()) {
                stack.pop();
                continue;
            }
            var e = top.next.next();
            if (e.id() == null || forbidden.contains(e.id()) || top.used.contains(e.id())) continue;
            var b = match(patterns.get(top.index), e, d, top.bindings);
            if (b == null) continue;
            var used = new ArrayList<>(top.used);
            used.add(e.id());
            stack.push(new Frame(top.index + 1, b, used, edges.iterator()));
        }
        return Optional.empty();
    }

    /** Non-overlapping matches: edges consumed by one match are unavailable to the next. */
    static List<Match> all(Diagram d, RulePattern pattern, int max) {
        var matches = new ArrayList<Match>();
        var forbidden = new HashSet<String>();
        while (matches.size() < max) {
            var m = first(d, pattern, forbidden);
            if (m.isEmpty()) break;
            forbidden.addAll(m.get().edges());
            matches.add(m.get());
        }
        return matches;
    }

    private static @Nullable Map<String, String> match(EdgePattern p, Edge e, Diagram d, Map<String, String> bindings) {
        if (!Objects.equals(p.label(), e.label())) return null;
        var from = d.node(e.from());
        var to = d.node(e.to());
        if (from.isEmpty() || to.isEmpty()) return null;
        var b = bind(p.left(), from.get(), bindings);
        return b == null ? null : bind(p.right(), to.get(), b);
    }

    private static @Nullable Map<String, String> bind(SidePattern side, Node n, Map<String, String> bindings) {
        if (!side.accepts(n) || n.id() == null) return null;
        var existing = bindings.get(side.var());
        if (existing != null) return existing.equals(n.id()) ? bindings : null;
        var b = new LinkedHashMap<>(bindings);
        b.put(side.var(), n.id());
        return b;
    }

    /** Tries every node as the pattern root, in document order. */
    static Optional<ExprMatch> expr(Diagram d, Expr pattern) {
        return exprAll(d, pattern, 1).stream().findFirst();
    }

    /**
     * Non-overlapping expression matches, roots in document order. A later match may share
     * bound nodes with an earlier one but may not touch the structure an earlier match consumes,
     * nor consume a node an earlier match binds.
     */
    static List<ExprMatch> exprAll(Diagram d, Expr pattern, int max) {
        var matches = new ArrayList<ExprMatch>();
        var consumed = new HashSet<String>();
        var kept = new HashSet<String>();
        for (var root : d.nodeIndex().keySet()) {
            if (matches.size() >= max) break;
            var matched = new LinkedHashSet<String>();
            var bound = new LinkedHashSet<String>();
            var b = expr(pattern, root, d, Map.of(), matched, bound);
            if (b == null) continue;
            if (!Collections.disjoint(matched, consumed) || !Collections.disjoint(bound, consumed)
                    || !Collections.disjoint(matched, kept)) continue;
            consumed.addAll(matched);
            kept.addAll(bound);
            matches.add(new ExprMatch(root, b, matched, bound));
        }
        return matches;
    }

    /**
     * A variable binds to the node itself. A constant atom matches a node carrying it as a dof
     * reference or atom argument. An application matches on operator, then either pairs its
     * arguments with the node's inputs or, for a leaf node, checks atom arguments against it.
     */
    private static @Nullable Map<String, String> expr(Expr pattern, String nodeId, Diagram d, Map<String, String> bindings,
                                                      Set<String> matched, Set<String> bound) {
        var node = d.node(nodeId).orElse(null);
        if (node == null) return null;
        if (pattern instanceof Expr.Atom a)
            return a.variable() ? bindVar(a, nodeId, bindings, bound) : (carries(node, a.name()) ? bindings : null);

        var app = (Expr.Apply) pattern;
        if (node.op() != app.op()) return null;
        matched.add(nodeId);
        var inputs = node.inputs();
        var b = bindings;
        if (!inputs.isEmpty()) {
            if (inputs.size() < app.args().size()) return null;
            for (var i = 0; i < app.args().size(); i++) {
                b = expr(app.args().get(i), inputs.get(i), d, b, matched, bound);
                if (b == null) return null;
            }
            return b;
        }
        for (var arg : app.args()) {
            if (!(arg instanceof Expr.Atom a)) return null;
            if (a.variable()) {
                b = bindVar(a, nodeId, b, bound);
                if (b == null) return null;
            } else if (!carries(node, a.name())) {
                return null;
            }
        }
        return b;
    }

    private static @Nullable Map<String, String> bindVar(Expr.Atom a, String nodeId, Map<String, String> bindings, Set<String> bound) {
        var existing = bindings.get(a.varName());
        if (existing != null && !existing.equals(nodeId)) return null;
        var b = new LinkedHashMap<>(bindings);
        b.put(a.varName(), nodeId);
        bound.add(nodeId);
        return b;
    }

    private static boolean carries(Node n, String atom) {
        if (n.dofRefs().contains(atom)) return true;
        return n.meta(Diagram.META_ATOM_ARGS).filter(v -> v instanceof Collection<?> c && c.contains(atom)).isPresent();
    }

    /** Variable bindings plus the ids of the consumed edges, in consumption order. */
    record Match(Map<String, String> bindings, List<String> edges) {
        Match {
            bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
            edges = List.copyOf(edges);
        }
    }

    /**
     * @param matched nodes covered by operator applications of the pattern
     * @param bound   nodes bound to variables; these survive the rewrite
     */
    record ExprMatch(String root, Map<String, String> bindings, Set<String> matched, Set<String> bound) {
        ExprMatch {
            bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
            matched = Collections.unmodifiableSet(new LinkedHashSet<>(matched));
            bound = Collections.unmodifiableSet(new LinkedHashSet<>(bound));
        }
    }

    private record Frame(int index, Map<String, String> bindings, List<String> used, Iterator<Edge> next) {
    }
}
