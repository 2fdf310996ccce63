package dumb.sid;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of diagram operators. Each carries its surface symbol and the
 * argument bounds the parser enforces; {@code maxArgs == -1} means unbounded.
 */
public enum Op {
    P("P", 1, 1),
    S_PLUS("S+", 1, -1),
    S_MINUS("S-", 1, -1),
    O("O", 1, 1),
    C("C", 2, 2),
    T("T", 1, 1);

    public final String symbol;
    public final int minArgs;
    public final int maxArgs;

    Op(String symbol, int minArgs, int maxArgs) {
        this.symbol = symbol;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public static Optional<Op> of(@Nullable String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }

    @JsonCreator
    static Op parse(String symbol) {
        return of(symbol).orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + symbol));
    }

    /** Whether atom arguments of this operator become dof references on the produced node. */
    public boolean bearsDofs() {
        return switch (this) {
            case P, S_PLUS, S_MINUS -> true;
            case O, C, T -> false;
        };
    }

    public boolean bounded() {
        return maxArgs >= 0;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
