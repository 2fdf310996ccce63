package dumb.sid;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static dumb.sid.Diagram.*;

/**
 * Compiles a parsed expression into a diagram: one node per operator application and one
 * {@code arg} edge from each structured argument to its parent. Atom arguments of DOF-bearing
 * operators become dof references instead of nodes.
 */
public class DiagramCompiler {

    public static final String DEFAULT_DIAGRAM_ID = "d_expr";

    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private int counter = 0;

    private DiagramCompiler() {
    }

    public static Diagram compile(Expr expr) {
        return compile(expr, DEFAULT_DIAGRAM_ID, null);
    }

    public static Diagram compile(Expr expr, String diagramId, @Nullable String compartmentId) {
        var c = new DiagramCompiler();
        if (expr instanceof Expr.Atom a) {
            c.nodes.add(new Node(c.nextId("n"), Op.P, List.of(a.name()), List.of(), null, Map.of(META_ATOM_ONLY, true)));
        } else {
            c.build((Expr.Apply) expr);
        }
        return new Diagram(diagramId, compartmentId, c.nodes, c.edges).checkStructure();
    }

    private String nextId(String prefix) {
        return prefix + (++counter);
    }

    private String build(Expr.Apply expr) {
        var atoms = new ArrayList<String>();
        var inputs = new ArrayList<String>();
        for (var arg : expr.args()) {
            if (arg instanceof Expr.Atom a) atoms.add(a.name());
            else inputs.add(build((Expr.Apply) arg));
        }

        var op = expr.op();
        List<String> dofRefs = List.of();
        Map<String, Object> meta = Map.of();
        if (op.bearsDofs() && !atoms.isEmpty() && inputs.isEmpty()) {
            dofRefs = atoms;
        } else if (!atoms.isEmpty()) {
            meta = Map.of(META_ATOM_ARGS, List.copyOf(atoms));
        }

        var id = nextId("n");
        nodes.add(new Node(id, op, dofRefs, inputs, op == Op.O ? Boolean.TRUE : null, meta));
        for (var in : inputs)
            edges.add(new Edge(nextId("e"), in, id, ARG));
        return id;
    }
}
