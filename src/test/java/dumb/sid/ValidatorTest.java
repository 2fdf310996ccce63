package dumb.sid;

import dumb.sid.SidPackage.Constraint;
import dumb.sid.SidPackage.Csi;
import dumb.sid.SidPackage.Dof;
import dumb.sid.Validator.Category;
import dumb.sid.Validator.Level;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorTest extends AbstractSidTest {

    private SidPackage with(List<Diagram> diagrams, List<State> states, List<Csi> csis) {
        return new SidPackage(pkg.dofs(), pkg.compartments(), csis, diagrams, states, pkg.constraints(), pkg.rewriteRules());
    }

    private static List<String> messages(Validator.Report r, Category c) {
        return r.of(c).stream().map(Validator.Finding::message).toList();
    }

    @Test
    void minimalPackageIsClean() {
        var r = sid.validate(pkg);
        assertTrue(r.ok(), r.errors().toString());
        assertTrue(r.findings().isEmpty(), r.findings().toString());
    }

    @Test
    void collapseMustBeIrreversible() {
        var d = diagram("diag1", List.of(node("n1", Op.P, "Freedom"), new Diagram.Node("n3", Op.O)), List.of());
        var r = sid.validate(pkg.withDiagram(d));
        assertFalse(r.ok());
        assertEquals(List.of("Collapse node n3 in diagram diag1 must set irreversible=true"), messages(r, Category.COLLAPSE_NOT_IRREVERSIBLE));
        var f = r.of(Category.COLLAPSE_NOT_IRREVERSIBLE).get(0);
        assertEquals("n3", f.context().get("node_id"));
        assertEquals("O", f.context().get("op"));
        // the hard collapse constraint fails as well
        assertEquals(List.of("c2 failed: Collapse node n3 must be marked irreversible"), messages(r, Category.CONSTRAINT_VIOLATION));
    }

    @Test
    void compiledCollapseIsClean() throws Exception {
        var d = sid.compile("O(P(Energy))", "diag1", "c1");
        var r = sid.validate(pkg.withDiagram(d));
        assertTrue(r.of(Category.COLLAPSE_NOT_IRREVERSIBLE).isEmpty());
        assertTrue(r.ok(), r.errors().toString());
    }

    @Test
    void duplicateAndMissingIds() {
        var p = new SidPackage(List.of(new Dof("Freedom"), new Dof("Freedom"), new Dof(null, "anonymous")),
                pkg.compartments(), pkg.csis(), pkg.diagrams(), pkg.states(), pkg.constraints(), pkg.rewriteRules());
        var r = sid.validate(p);
        assertEquals(List.of("Duplicate DOF id: Freedom"), messages(r, Category.DUPLICATE_ID));
        assertEquals(List.of("DOF missing id"), messages(r, Category.MISSING_ID));
    }

    @Test
    void duplicateNodeIds() {
        var d = diagram("diag1", List.of(node("n1", Op.P, "Freedom"), node("n1", Op.P, "Energy")), List.of());
        var r = sid.validate(pkg.withDiagram(d));
        assertEquals(List.of("Diagram diag1 has duplicate node id n1"), messages(r, Category.DUPLICATE_ID));
    }

    @Test
    void danglingReferences() {
        var n1 = new Diagram.Node("n1", Op.P, List.of("Gravity"), List.of("n7"), null, Map.of());
        var d = new Diagram("diag1", "c9", List.of(n1, node("n2", Op.P, "Energy")), List.of(edge("e1", "n1", "n2"), edge("e2", "n2", "n8")));
        var r = sid.validate(pkg.withDiagram(d));
        var missing = messages(r, Category.MISSING_REFERENCE);
        assertTrue(missing.contains("Diagram diag1 node n1 references unknown DOF Gravity"), missing.toString());
        assertTrue(missing.contains("Diagram diag1 edge e2 references missing node"), missing.toString());
        assertTrue(missing.contains("Diagram diag1 node n1 references missing input n7"), missing.toString());
        assertTrue(missing.contains("Diagram diag1 references missing compartment c9"), missing.toString());
        assertEquals(List.of("Diagram diag1 node n1 uses DOF Gravity outside CSI csi1"), messages(r, Category.DOF_OUTSIDE_CSI));
        assertEquals(List.of("Diagram diag1 edge e1 violates CSI csi1 pair (Gravity, Energy)"), messages(r, Category.CSI_PAIR_VIOLATION));
    }

    @Test
    void stateReferences() {
        var stray = new State("s9", "diag1", "nope", "c7", null);
        var r = sid.validate(with(pkg.diagrams(), List.of(s1(), stray), pkg.csis()));
        assertEquals(List.of(
                "State s9 references missing CSI nope",
                "State s9 references missing compartment c7",
                "State s9 references missing diagram or CSI"), messages(r, Category.MISSING_REFERENCE));
    }

    @Test
    void malformedCsiPairs() {
        var csi = new Csi("csi1", csi1().allowedDofs(),
                List.of(List.of("Freedom"), List.of("Freedom", "Gravity"), List.of("Freedom", "Energy")));
        var r = sid.validate(with(pkg.diagrams(), pkg.states(), List.of(csi)));
        assertEquals(List.of("CSI csi1 allowed_pair must have exactly 2 elements, got 1"), messages(r, Category.INVALID_CSI_PAIR));
        assertEquals(List.of("CSI csi1 allowed_pair references unknown DOF: Gravity"), messages(r, Category.INVALID_CSI_PAIR_DOF));
        // the one edge is still within the well-formed pairs
        assertTrue(r.of(Category.CSI_PAIR_VIOLATION).isEmpty());
    }

    @Test
    void everyDeclaredCsiHasItsPairsChecked() {
        var unused = new Csi("csi2", List.of("Freedom"), List.of(List.of("Freedom", "Gravity")));
        var r = sid.validate(with(pkg.diagrams(), pkg.states(), List.of(csi1(), unused)));
        assertEquals(List.of("CSI csi2 allowed_pair references unknown DOF: Gravity"), messages(r, Category.INVALID_CSI_PAIR_DOF));
        assertEquals("csi2", r.of(Category.INVALID_CSI_PAIR_DOF).get(0).context().get("csi_id"));
    }

    @Test
    void sharedCsiIsReportedOnce() {
        var csi = new Csi("csi1", csi1().allowedDofs(), List.of(List.of("Freedom", "Gravity"), List.of("Freedom", "Energy")));
        var s2 = new State("s2", "diag1", "csi1", "c1", null);
        var r = sid.validate(with(pkg.diagrams(), List.of(s1(), s2), List.of(csi)));
        assertEquals(List.of("CSI csi1 allowed_pair references unknown DOF: Gravity"), messages(r, Category.INVALID_CSI_PAIR_DOF));
    }

    @Test
    void emptyPairListAllowsAnyCoupling() {
        var open = new Csi("csi1", csi1().allowedDofs(), List.of());
        var d = diagram("diag1", List.of(node("n1", Op.P, "Position"), node("n2", Op.P, "Freedom")), List.of(edge("e1", "n1", "n2")));
        var r = sid.validate(with(List.of(d), pkg.states(), List.of(open)));
        assertTrue(r.ok(), r.errors().toString());
    }

    @Test
    void rewriteRules() {
        var p = withRules(pkg,
                new RewriteRule("half", "P(a) --arg--> C(b)", null, null, null, List.of()),
                RewriteRule.exprs("broken", "P(", "P(a)"));
        var r = sid.validate(p);
        assertEquals(List.of("Rewrite half must define pattern+replacement or pattern_expr+replacement_expr"),
                messages(r, Category.INVALID_REWRITE_RULE));
        var bad = messages(r, Category.INVALID_REWRITE_EXPR);
        assertEquals(1, bad.size());
        assertTrue(bad.get(0).startsWith("Rewrite broken has invalid expr: "), bad.get(0));
    }

    @Test
    void softFailuresAndUnknownPredicatesAreWarnings() {
        var cyclic = diagram("diag1", List.of(node("n1", Op.P, "Freedom"), node("n2", Op.P, "Energy")),
                List.of(edge("e1", "n1", "n2"), edge("e2", "n2", "n1")));
        var p = new SidPackage(pkg.dofs(), pkg.compartments(), pkg.csis(), List.of(cyclic), List.of(unlabeled("s1", "diag1")),
                List.of(Constraint.soft("loops", Predicates.NO_CYCLES), Constraint.hard("magic", "is_magic")), List.of());
        var r = sid.validate(p);
        assertTrue(r.ok(), r.errors().toString());
        var warnings = r.of(Category.CONSTRAINT_VIOLATION);
        assertEquals(2, warnings.size());
        assertTrue(warnings.stream().allMatch(f -> f.level() == Level.WARNING));
        assertTrue(warnings.get(0).message().startsWith("loops failed: Cycle detected involving node n"), warnings.get(0).message());
        assertEquals("s1", warnings.get(0).context().get("state_id"));
        assertEquals("Unknown predicate is_magic", warnings.get(1).message());
    }

    @Test
    void everyFindingIsReported() {
        var d = diagram("diag1", List.of(node("n1", Op.P, "Gravity"), new Diagram.Node("n3", Op.O)), List.of());
        var p = withRules(pkg.withDiagram(d), new RewriteRule("none", null, null, null, null, List.of()));
        var r = sid.validate(p);
        assertEquals(r.errors().size(), r.findings().stream().filter(Validator.Finding::isError).count());
        assertFalse(r.of(Category.MISSING_REFERENCE).isEmpty());
        assertFalse(r.of(Category.COLLAPSE_NOT_IRREVERSIBLE).isEmpty());
        assertFalse(r.of(Category.DOF_OUTSIDE_CSI).isEmpty());
        assertFalse(r.of(Category.INVALID_REWRITE_RULE).isEmpty());
        assertEquals("collapse_not_irreversible", Category.COLLAPSE_NOT_IRREVERSIBLE.key());
    }
}
