package dumb.sid;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured rewrite pattern: a comma separated list of edge patterns such as
 * {@code P(a) --arg--> C(b), b --arg--> T(c)}. Each side binds a variable and may require an
 * operator.
 */
public record RulePattern(List<EdgePattern> edges) {

    public RulePattern {
        edges = List.copyOf(edges);
        if (edges.isEmpty()) throw new IllegalArgumentException("Empty rule pattern");
    }

    /**
     * @throws IllegalArgumentException when a segment lacks {@code --label-->} or a side is malformed
     */
    public static RulePattern parse(@Nullable String text) {
        if (text == null || !text.contains("--") || !text.contains("-->"))
            throw new IllegalArgumentException("Invalid rule pattern: '" + (text == null ? "" : text) + "'");
        var edges = new ArrayList<EdgePattern>();
        for (var raw : text.split(",")) {
            var segment = raw.strip();
            if (segment.isEmpty()) continue;
            var dash = segment.indexOf("--");
            var arrow = dash < 0 ? -1 : segment.indexOf("-->", dash + 2);
            if (dash < 0 || arrow < 0)
                throw new IllegalArgumentException("Invalid rule segment: '" + segment + "'");
            edges.add(new EdgePattern(
                    SidePattern.parse(segment.substring(0, dash)),
                    segment.substring(dash + 2, arrow).strip(),
                    SidePattern.parse(segment.substring(arrow + 3))));
        }
        return new RulePattern(edges);
    }

    @Override
    public String toString() {
        return edges.stream().map(EdgePattern::toString).collect(Collectors.joining(", "));
    }

    /** One side of an edge pattern: {@code Op(var)} or a bare {@code var}. */
    public record SidePattern(@Nullable Op op, String var) {

        static SidePattern parse(String text) {
            var t = text.strip();
            var open = t.indexOf('(');
            if (open < 0 || !t.endsWith(")")) {
                if (t.isEmpty() || t.contains("(") || t.contains(")"))
                    throw new IllegalArgumentException("Invalid side pattern: '" + t + "'");
                return new SidePattern(null, t);
            }
            var symbol = t.substring(0, open).strip();
            var name = t.substring(open + 1, t.length() - 1).strip();
            if (name.isEmpty())
                throw new IllegalArgumentException("Invalid side pattern: '" + t + "'");
            var op = Op.of(symbol).orElseThrow(() -> new IllegalArgumentException("Unknown operator '" + symbol + "' in side pattern: '" + t + "'"));
            return new SidePattern(op, name);
        }

        boolean accepts(Diagram.Node n) {
            return op == null || n.op() == op;
        }

        @Override
        public String toString() {
            return op == null ? var : op.symbol + '(' + var + ')';
        }
    }

    public record EdgePattern(SidePattern left, String label, SidePattern right) {
        @Override
        public String toString() {
            return left + " --" + label + "--> " + right;
        }
    }
}
