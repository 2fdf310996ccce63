package dumb.sid;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer and recursive-descent parser for operator expressions such as
 * {@code C(P(Freedom),S+(Justice,Peace))}.
 * <p>
 * Grammar: {@code expr := IDENT | OP ( '(' expr (',' expr)* ')' )?}. An operator written
 * without parentheses has zero arguments. Arity is checked as soon as an argument list closes,
 * and any error aborts the whole parse.
 */
public class ExprParser {
    private static final int CONTEXT_SIZE = 20;

    private final String text;
    private final List<Token> tokens;
    private int pos = 0;

    private ExprParser(String text, List<Token> tokens) {
        this.text = text;
        this.tokens = tokens;
    }

    public static Expr parse(String text) throws ParseException {
        var parser = new ExprParser(text, tokenize(text));
        var expr = parser.parseExpr();
        var trailing = parser.peek();
        if (trailing != null)
            throw parser.error("Unexpected trailing token '" + trailing.value + "'", trailing);
        return expr;
    }

    public static List<Token> tokenize(String text) throws ParseException {
        var tokens = new ArrayList<Token>();
        int i = 0, line = 1, col = 1;
        var n = text.length();
        while (i < n) {
            var c = text.charAt(i);
            if (c == '\n') {
                i++;
                line++;
                col = 1;
                continue;
            }
            if (Character.isWhitespace(c)) {
                i++;
                col++;
                continue;
            }
            var start = i;
            TokenKind kind;
            switch (c) {
                case '(' -> {
                    kind = TokenKind.LPAREN;
                    i++;
                }
                case ')' -> {
                    kind = TokenKind.RPAREN;
                    i++;
                }
                case ',' -> {
                    kind = TokenKind.COMMA;
                    i++;
                }
                default -> {
                    if (c != '$' && !isIdentStart(c))
                        throw new ParseException("Unexpected character '" + c + "'", line, col, context(text, i));
                    if (c == '$' && (i + 1 >= n || !isIdentStart(text.charAt(i + 1))))
                        throw new ParseException("Pattern variable must start with '$' followed by a letter or '_'", line, col, context(text, i));
                    i++;
                    while (i < n && isIdentPart(text.charAt(i))) i++;
                    var word = text.substring(start, i);
                    if (word.equals("S") && i < n && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
                        i++;
                        kind = TokenKind.OP;
                    } else if (Op.of(word).isPresent()) {
                        kind = TokenKind.OP;
                    } else {
                        kind = Expr.isVariable(word) ? TokenKind.VAR : TokenKind.IDENT;
                    }
                }
            }
            tokens.add(new Token(kind, text.substring(start, i), start, line, col));
            col += i - start;
        }
        return tokens;
    }

    private static boolean isIdentStart(char c) {
        return c == '_' || (c < 128 && Character.isLetter(c));
    }

    private static boolean isIdentPart(char c) {
        return c == '_' || (c < 128 && Character.isLetterOrDigit(c));
    }

    private static String context(String text, int at) {
        return text.substring(Math.max(0, at - CONTEXT_SIZE / 2), Math.min(text.length(), at + CONTEXT_SIZE / 2));
    }

    private Token peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private Token consume(TokenKind expected) throws ParseException {
        var t = peek();
        if (t == null)
            throw endOfInput("Expected " + expected.describe);
        if (t.kind != expected)
            throw error("Expected " + expected.describe + " found '" + t.value + "'", t);
        pos++;
        return t;
    }

    private Expr parseExpr() throws ParseException {
        var t = peek();
        if (t == null) throw endOfInput(tokens.isEmpty() ? "Empty expression" : "Unexpected end of input");
        switch (t.kind) {
            case IDENT, VAR -> {
                pos++;
                return new Expr.Atom(t.value);
            }
            case OP -> {
                pos++;
                var op = Op.of(t.value).orElseThrow(() -> error("Unknown operator '" + t.value + "'", t));
                var next = peek();
                List<Expr> args = List.of();
                if (next != null && next.kind == TokenKind.LPAREN) {
                    pos++;
                    args = parseExprList();
                    consume(TokenKind.RPAREN);
                }
                checkArity(op, args.size(), t);
                return new Expr.Apply(op, args);
            }
            default -> throw error("Unexpected token '" + t.value + "'", t);
        }
    }

    private List<Expr> parseExprList() throws ParseException {
        var exprs = new ArrayList<Expr>();
        exprs.add(parseExpr());
        while (peek() != null && peek().kind == TokenKind.COMMA) {
            pos++;
            exprs.add(parseExpr());
        }
        return exprs;
    }

    private void checkArity(Op op, int count, Token at) throws ParseException {
        if (count < op.minArgs)
            throw error("Operator '" + op.symbol + "' requires at least " + op.minArgs + " argument(s), got " + count, at);
        if (op.bounded() && count > op.maxArgs)
            throw error("Operator '" + op.symbol + "' accepts at most " + op.maxArgs + " argument(s), got " + count, at);
    }

    private ParseException error(String message, Token at) {
        return new ParseException(message, at.line, at.col, context(text, at.pos));
    }

    private ParseException endOfInput(String message) {
        var last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        return last == null
                ? new ParseException(message, "")
                : new ParseException(message, last.line, last.col + last.value.length(), context(text, text.length()));
    }

    public enum TokenKind {
        OP("operator"), IDENT("identifier"), VAR("pattern variable"), LPAREN("'('"), RPAREN("')'"), COMMA("','");

        final String describe;

        TokenKind(String describe) {
            this.describe = describe;
        }
    }

    public record Token(TokenKind kind, String value, int pos, int line, int col) {
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message, String context) {
            this(message, -1, -1, context);
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
