package dumb.sid;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.sid.ExprParser.ParseException;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractSidTest {

    /** DOFs, two compartments, one CSI, one two-node diagram, one labelled state, one rule. */
    static final String MINIMAL_PACKAGE = """
            {
              "dofs": [
                {"id": "Freedom", "description": "Freedom axis"},
                {"id": "Energy"},
                {"id": "Position"},
                {"id": "Momentum"}
              ],
              "compartments": [
                {"id": "c1", "name": "Compartment 1"},
                {"id": "c2", "name": "Compartment 2"}
              ],
              "csis": [
                {
                  "id": "csi1",
                  "allowed_dofs": ["Freedom", "Energy", "Position", "Momentum"],
                  "allowed_pairs": [["Freedom", "Energy"], ["Energy", "Freedom"], ["Position", "Momentum"]]
                }
              ],
              "diagrams": [
                {
                  "id": "diag1",
                  "compartment_id": "c1",
                  "nodes": [
                    {"id": "n1", "op": "P", "dof_refs": ["Freedom"]},
                    {"id": "n2", "op": "P", "dof_refs": ["Energy"]}
                  ],
                  "edges": [
                    {"id": "e1", "from": "n1", "to": "n2", "label": "arg"}
                  ]
                }
              ],
              "states": [
                {
                  "id": "s1",
                  "diagram_id": "diag1",
                  "csi_id": "csi1",
                  "compartment_id": "c1",
                  "inu_labels": {"n1": "I", "n2": "I", "e1": "I"}
                }
              ],
              "constraints": [
                {"id": "c1", "type": "hard", "predicate": "no_cycles"},
                {"id": "c2", "type": "hard", "predicate": "collapse_irreversible"}
              ],
              "rewrite_rules": [
                {
                  "id": "r1",
                  "pattern_expr": "P(Freedom)",
                  "replacement_expr": "S+(Freedom)",
                  "preconditions": ["admissible"]
                }
              ]
            }
            """;

    protected Sid sid;
    protected SidPackage pkg;

    @BeforeEach
    void setUp() {
        sid = new Sid();
        pkg = pkg(MINIMAL_PACKAGE);
    }

    static SidPackage pkg(String json) {
        try {
            return SidPackage.parse(json);
        } catch (JsonProcessingException e) {
            fail("Package fixture does not bind: " + e.getOriginalMessage());
            return null;
        }
    }

    static Expr expr(String text) {
        try {
            return ExprParser.parse(text);
        } catch (ParseException e) {
            fail("Failed to parse expression '" + text + "': " + e.getMessage());
            return null;
        }
    }

    static Diagram compile(String text) {
        return DiagramCompiler.compile(expr(text));
    }

    static Diagram.Node node(String id, Op op, String... dofs) {
        return new Diagram.Node(id, op, List.of(dofs), List.of(), op == Op.O ? Boolean.TRUE : null, Map.of());
    }

    static Diagram.Edge edge(String id, String from, String to) {
        return new Diagram.Edge(id, from, to, Diagram.ARG);
    }

    static Diagram diagram(String id, List<Diagram.Node> nodes, List<Diagram.Edge> edges) {
        return new Diagram(id, null, nodes, edges);
    }

    SidPackage.Csi csi1() {
        return pkg.csi("csi1").orElseThrow();
    }

    State s1() {
        return pkg.state("s1").orElseThrow();
    }

    Diagram diag1() {
        return pkg.diagram("diag1").orElseThrow();
    }

    static State unlabeled(String id, String diagramId) {
        return new State(id, diagramId, "csi1", "c1", null);
    }

    static SidPackage withRules(SidPackage p, RewriteRule... rules) {
        return new SidPackage(p.dofs(), p.compartments(), p.csis(), p.diagrams(), p.states(), p.constraints(), List.of(rules));
    }
}
