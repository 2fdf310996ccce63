package dumb.sid;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNullElse;

/**
 * A rewrite given either as an edge pattern pair ({@code pattern}/{@code replacement}, e.g.
 * {@code P(a) --arg--> C(b)}) or as an expression pair with free variables
 * ({@code pattern_expr}/{@code replacement_expr}). The expression form wins when both are present.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RewriteRule(@JsonProperty("id") String id,
                          @JsonProperty("pattern") @Nullable String pattern,
                          @JsonProperty("replacement") @Nullable String replacement,
                          @JsonProperty("pattern_expr") @Nullable String patternExpr,
                          @JsonProperty("replacement_expr") @Nullable String replacementExpr,
                          @JsonProperty("preconditions") List<String> preconditions) {
    public static final String PRE_ADMISSIBLE = "admissible";
    public static final String PRE_NO_HARD_CONFLICT = "no_hard_conflict";

    public RewriteRule {
        preconditions = List.copyOf(requireNonNullElse(preconditions, List.of()));
    }

    public static RewriteRule edges(String id, String pattern, String replacement, String... preconditions) {
        return new RewriteRule(id, pattern, replacement, null, null, List.of(preconditions));
    }

    public static RewriteRule exprs(String id, String patternExpr, String replacementExpr, String... preconditions) {
        return new RewriteRule(id, null, null, patternExpr, replacementExpr, List.of(preconditions));
    }

    public boolean hasEdgeForm() {
        return present(pattern) && present(replacement);
    }

    public boolean hasExprForm() {
        return present(patternExpr) && present(replacementExpr);
    }

    private static boolean present(@Nullable String s) {
        return s != null && !s.isEmpty();
    }
}
