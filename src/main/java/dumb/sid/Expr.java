package dumb.sid;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.sid.util.Json;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Parsed operator expression: either a bare identifier or an operator applied to arguments.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Expr.Atom.class, name = "atom"),
        @JsonSubTypes.Type(value = Expr.Apply.class, name = "op")
})
public sealed interface Expr permits Expr.Atom, Expr.Apply {

    static boolean isVariable(String name) {
        if (name.startsWith("$")) return name.length() > 1;
        return name.length() == 1 && Character.isLowerCase(name.charAt(0));
    }

    String toText();

    Set<String> vars();

    default JsonNode toJson() {
        return Json.node(this);
    }

    record Atom(@JsonProperty("name") String name) implements Expr {
        public Atom {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Empty atom");
        }

        @JsonIgnore
        public boolean variable() {
            return isVariable(name);
        }

        /** Variable name without the {@code $} marker. */
        @JsonIgnore
        public String varName() {
            return name.startsWith("$") ? name.substring(1) : name;
        }

        @Override
        public String toText() {
            return name;
        }

        @Override
        public Set<String> vars() {
            return variable() ? Set.of(varName()) : Set.of();
        }
    }

    record Apply(@JsonProperty("op") Op op, @JsonProperty("args") List<Expr> args) implements Expr {
        public Apply {
            requireNonNull(op);
            args = List.copyOf(requireNonNull(args));
        }

        public Apply(Op op, Expr... args) {
            this(op, List.of(args));
        }

        @Override
        public String toText() {
            return args.isEmpty() ? op.symbol : args.stream().map(Expr::toText).collect(Collectors.joining(",", op.symbol + "(", ")"));
        }

        @Override
        public Set<String> vars() {
            return args.stream().flatMap(a -> a.vars().stream()).collect(Collectors.toCollection(TreeSet::new));
        }
    }
}
