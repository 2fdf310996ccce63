package dumb.sid;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.sid.ExprParser.ParseException;
import dumb.sid.SidPackage.Constraint;
import dumb.sid.SidPackage.Csi;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dumb.sid.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Entry point to the pipeline: parse, compile, validate, label, resolve, rewrite and check
 * stability. One instance owns one configuration and one predicate registry; it keeps no other
 * state between calls.
 */
public class Sid {

    public static final int DEFAULT_MAX_REWRITE_ITERATIONS = 1000;
    public static final int DEFAULT_MAX_MATCHES = 1000;
    public static final int DEFAULT_MAX_LOOP_HISTORY = 100;
    public static final double DEFAULT_TOLERANCE = 1e-6;
    public static final boolean DEFAULT_REQUIRE_ALL_CONDITIONS = false;
    public static final boolean DEFAULT_APPLY_ALL = true;

    public final Configuration config;
    public final Conflicts crf;
    public final Validator validator;
    public final Rewrite rewrite;
    public final Stability stability;

    public Sid() {
        this(new Configuration(), Predicates.standard());
    }

    public Sid(Configuration config) {
        this(config, Predicates.standard());
    }

    public Sid(Configuration config, Predicates predicates) {
        this.config = requireNonNull(config);
        this.crf = new Conflicts(predicates);
        this.validator = new Validator(crf);
        this.rewrite = new Rewrite(crf, config);
        this.stability = new Stability(crf);
        message("SID engine ready: " + config + ", predicates " + predicates.names());
    }

    public Expr parse(String text) throws ParseException {
        return ExprParser.parse(text);
    }

    public Diagram compile(String text) throws ParseException {
        return DiagramCompiler.compile(parse(text));
    }

    public Diagram compile(String text, String diagramId, @Nullable String compartmentId) throws ParseException {
        return DiagramCompiler.compile(parse(text), diagramId, compartmentId);
    }

    /** The "dump expression" surface: one expression in, its diagram document out. */
    public JsonNode dump(String text, String diagramId, @Nullable String compartmentId) throws ParseException {
        return compile(text, diagramId, compartmentId).toJson();
    }

    public Validator.Report validate(SidPackage pkg) {
        return validator.validate(pkg);
    }

    public Map<String, Label> label(Diagram diagram, List<Constraint> constraints, State state, Csi csi) {
        return crf.label(diagram, constraints, state, csi);
    }

    public Conflicts.Resolution resolve(String type, Map<String, Object> details, State state, Diagram diagram) {
        return crf.resolve(type, details, state, diagram);
    }

    public Rewrite.Outcome rewrite(SidPackage pkg, String stateId, String diagramId) {
        return rewrite.applyToPackage(pkg, stateId, diagramId);
    }

    public Stability.Report stability(SidPackage pkg, String stateId, String diagramId) {
        return stability.check(pkg, stateId, diagramId, config.tolerance(), config.requireAllConditions());
    }

    public Optional<Stability.Metrics> metrics(SidPackage pkg, String stateId, String diagramId) {
        return stability.metrics(pkg, stateId, diagramId);
    }

    public record Configuration(
            @JsonProperty("maxRewriteIterations") int maxRewriteIterations,
            @JsonProperty("maxMatches") int maxMatches,
            @JsonProperty("maxLoopHistory") int maxLoopHistory,
            @JsonProperty("tolerance") double tolerance,
            @JsonProperty("requireAllConditions") boolean requireAllConditions,
            @JsonProperty("applyAll") boolean applyAll
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("maxRewriteIterations") Integer maxRewriteIterations,
                @JsonProperty("maxMatches") Integer maxMatches,
                @JsonProperty("maxLoopHistory") Integer maxLoopHistory,
                @JsonProperty("tolerance") Double tolerance,
                @JsonProperty("requireAllConditions") Boolean requireAllConditions,
                @JsonProperty("applyAll") Boolean applyAll
        ) {
            this(
                    maxRewriteIterations != null ? maxRewriteIterations : DEFAULT_MAX_REWRITE_ITERATIONS,
                    maxMatches != null ? maxMatches : DEFAULT_MAX_MATCHES,
                    maxLoopHistory != null ? maxLoopHistory : DEFAULT_MAX_LOOP_HISTORY,
                    tolerance != null ? tolerance : DEFAULT_TOLERANCE,
                    requireAllConditions != null ? requireAllConditions : DEFAULT_REQUIRE_ALL_CONDITIONS,
                    applyAll != null ? applyAll : DEFAULT_APPLY_ALL
            );
        }

        public Configuration() {
            this(DEFAULT_MAX_REWRITE_ITERATIONS, DEFAULT_MAX_MATCHES, DEFAULT_MAX_LOOP_HISTORY, DEFAULT_TOLERANCE,
                    DEFAULT_REQUIRE_ALL_CONDITIONS, DEFAULT_APPLY_ALL);
        }

        public Configuration {
            if (maxRewriteIterations < 0 || maxMatches < 0)
                throw new IllegalArgumentException("Rewrite limits must be non-negative");
            if (maxLoopHistory < 2)
                throw new IllegalArgumentException("maxLoopHistory must keep at least two snapshots");
            if (tolerance < 0)
                throw new IllegalArgumentException("tolerance must be non-negative");
        }

        public Configuration withTolerance(double t) {
            return new Configuration(maxRewriteIterations, maxMatches, maxLoopHistory, t, requireAllConditions, applyAll);
        }

        public Configuration withRequireAll(boolean all) {
            return new Configuration(maxRewriteIterations, maxMatches, maxLoopHistory, tolerance, all, applyAll);
        }

        public Configuration withMaxRewriteIterations(int n) {
            return new Configuration(n, maxMatches, maxLoopHistory, tolerance, requireAllConditions, applyAll);
        }

        public Configuration withMaxMatches(int n) {
            return new Configuration(maxRewriteIterations, n, maxLoopHistory, tolerance, requireAllConditions, applyAll);
        }
    }
}
