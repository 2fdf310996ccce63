package dumb.sid;

import dumb.sid.SidPackage.Constraint;
import dumb.sid.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StabilityTest extends AbstractSidTest {

    private static final Map<String, Label> ALL_I = Map.of("n1", Label.I, "n2", Label.I);
    private static final Map<String, Label> ONE_N = Map.of("n1", Label.I, "n2", Label.N);

    private static State history(State s, Map<String, Label> prev, Map<String, Label> curr) {
        return s.withSnapshot(prev, 100).withSnapshot(curr, 100);
    }

    /**
     * A P node feeding a transport without a target compartment, under a soft transport
     * constraint: the minimal package's rule stays applicable and the transport stays unresolved.
     */
    private SidPackage unsettled() {
        var dt = diagram("dt", List.of(node("n1", Op.P, "Freedom"), new Diagram.Node("n2", Op.T)), List.of(edge("e1", "n1", "n2")));
        return new SidPackage(pkg.dofs(), pkg.compartments(), pkg.csis(), List.of(dt), List.of(unlabeled("s2", "dt")),
                List.of(Constraint.soft("ct", Predicates.VALID_COMPARTMENT_TRANSITIONS)), pkg.rewriteRules());
    }

    @Test
    void minimalPackageIsStableByTransportOnly() {
        var r = sid.stability(pkg, "s1", "diag1");
        assertTrue(r.stable());
        assertEquals(List.of("[OK] No transport operations present"), r.satisfied());
        assertEquals("System is STABLE (1 condition(s) met)", r.message());
    }

    @Test
    void strictModeNeedsAllFour() {
        var strict = new Sid(new Sid.Configuration().withRequireAll(true));
        var r = strict.stability(pkg, "s1", "diag1");
        assertFalse(r.stable());
        assertEquals("System is NOT STABLE (1/4 conditions met, need all)", r.message());
    }

    @Test
    void fixpointMeetsEveryCondition() {
        var settled = withRules(pkg).withState(history(s1(), ALL_I, ALL_I));
        var strict = new Sid(new Sid.Configuration().withRequireAll(true));
        var r = strict.stability(settled, "s1", "diag1");
        assertTrue(r.stable(), r.toString());
        assertEquals(Stability.CONDITIONS, r.satisfied().size());
        assertEquals("System is STABLE (all 4 conditions met)", r.message());
    }

    @Test
    void identityRulesDoNotBlockStability() {
        var settled = withRules(pkg, RewriteRule.exprs("id", "P(Freedom)", "P(Freedom)"));
        var r = sid.stability(settled, "s1", "diag1");
        assertTrue(r.satisfied().contains("[OK] Only identity rewrites authorized"), r.satisfied().toString());
        // the identity rule still matches, so rewrites remain admissible
        assertFalse(r.satisfied().contains("[OK] No admissible rewrites remain"));
    }

    @Test
    void unsettledPackageMeetsNothing() {
        var r = sid.stability(unsettled(), "s2", "dt");
        assertFalse(r.stable());
        assertTrue(r.satisfied().isEmpty());
        assertEquals("System is NOT STABLE (no termination conditions met)", r.message());
    }

    @Test
    void individualConditionMessages() {
        var p = unsettled();
        var s = p.state("s2").orElseThrow();
        var d = p.diagram("dt").orElseThrow();
        var st = sid.stability;
        assertEquals("Rewrite r1 is still admissible", st.noAdmissibleRewrites(p.rewriteRules(), p.constraints(), s, d, csi1()).message());
        assertEquals("Transport node n2 is not in admissible region", st.invariantUnderTransport(d, s, csi1(), p.constraints()).message());
        assertEquals("Non-identity rewrite r1 present", st.onlyIdentityRewrites(p.rewriteRules(), p.constraints(), s, d, csi1()).message());
    }

    @Test
    void unauthorizedRulesDoNotCount() {
        var forbidden = s1().withLabels(Map.of("n1", Label.N));
        var st = sid.stability;
        assertTrue(st.noAdmissibleRewrites(pkg.rewriteRules(), pkg.constraints(), forbidden, diag1(), csi1()).ok());
        assertTrue(st.onlyIdentityRewrites(pkg.rewriteRules(), pkg.constraints(), forbidden, diag1(), csi1()).ok());
    }

    @Test
    void transportMustKeepAdmissibleRegion() {
        var targeted = new Diagram.Node("n1", Op.T, List.of(), List.of(), null, Map.of(Diagram.META_TARGET_COMPARTMENT, "c2"));
        var d = diagram("dt2", List.of(targeted), List.of());
        var st = sid.stability;

        var kept = st.invariantUnderTransport(d, unlabeled("s", "dt2").withLabels(Map.of("n1", Label.I)), csi1(), pkg.constraints());
        assertTrue(kept.ok());
        assertEquals("Admissible region invariant under transport", kept.message());

        var lost = st.invariantUnderTransport(d, unlabeled("s", "dt2").withLabels(Map.of("gone", Label.I)), csi1(), pkg.constraints());
        assertFalse(lost.ok());
        assertEquals("Previously admissible element gone is no longer admissible", lost.message());
    }

    @Test
    void convergence() {
        var s = s1();
        assertEquals("Insufficient loop history for convergence check", Stability.loopConvergence(s, 1e-6).message());
        assertFalse(Stability.loopConvergence(s.withSnapshot(ALL_I, 100), 1e-6).ok());

        var still = Stability.loopConvergence(history(s, ALL_I, ALL_I), 0);
        assertTrue(still.ok());
        assertEquals("Loop has fully converged (no changes)", still.message());

        var moving = Stability.loopConvergence(history(s, ALL_I, ONE_N), 1e-6);
        assertFalse(moving.ok());
        assertEquals("Loop not converged (change ratio: 0.500000)", moving.message());

        var loose = Stability.loopConvergence(history(s, ALL_I, ONE_N), 0.6);
        assertTrue(loose.ok());
        assertEquals("Loop gain converged (change ratio: 0.500000)", loose.message());
    }

    @Test
    void convergenceComparesTheKeyUnion() {
        var s = history(s1(), Map.of("a", Label.I), Map.of("b", Label.I));
        assertEquals("Loop not converged (change ratio: 1.000000)", Stability.loopConvergence(s, 0.5).message());
    }

    @Test
    void historyIsBounded() {
        var s = s1();
        for (var i = 0; i < 5; i++) s = s.withSnapshot(ALL_I, 3);
        assertEquals(3, s.loopHistory().size());
    }

    @Test
    void missingInputs() {
        var r = sid.stability(pkg, "s1", "nope");
        assertFalse(r.stable());
        assertEquals("Missing state, diagram, or CSI", r.message());
        assertTrue(sid.metrics(pkg, "nope", "diag1").isEmpty());
    }

    @Test
    void metricsOfMinimalPackage() {
        var m = sid.metrics(pkg, "s1", "diag1").orElseThrow();
        assertEquals(3, m.admissibleVolume());
        assertEquals(1.0, m.admissibleRatio());
        assertEquals(0, m.collapseCount());
        assertEquals(0.0, m.collapseRatio());
        assertEquals(0, m.couplingCount());
        assertEquals(0.0, m.gradientCoherence());
        assertEquals(0, m.transportCount());
        // no transports, no fidelity
        assertNull(m.transportFidelity());
        assertNull(m.loopGain());

        var doc = Json.node(m);
        assertTrue(doc.get("transport_fidelity").isNull());
        assertTrue(doc.get("loop_gain").isNull());
        assertEquals(3, doc.get("admissible_volume").asInt());
    }

    @Test
    void metricsOfUnsettledPackage() {
        var p = unsettled();
        var m = sid.metrics(p.withState(history(p.state("s2").orElseThrow(), ALL_I, ONE_N)), "s2", "dt").orElseThrow();
        // the state was never labelled, so there is no admissible ratio
        assertEquals(0, m.admissibleVolume());
        assertNull(m.admissibleRatio());
        assertEquals(1, m.transportCount());
        assertEquals(0.0, m.transportFidelity());
        assertEquals(0.5, m.loopGain());
    }

    @Test
    void rewriteThenConverge() {
        var first = sid.rewrite(pkg, "s1", "diag1");
        var settled = first.pkg().withState(first.pkg().state("s1").orElseThrow()
                .withSnapshot(first.pkg().state("s1").orElseThrow().labels(), 100));
        var r = sid.stability(settled, "s1", "diag1");
        assertTrue(r.satisfied().contains("[OK] No admissible rewrites remain"), r.satisfied().toString());
        assertTrue(r.satisfied().contains("[OK] Loop has fully converged (no changes)"), r.satisfied().toString());
        assertEquals(0.0, sid.metrics(settled, "s1", "diag1").orElseThrow().loopGain());
    }
}
