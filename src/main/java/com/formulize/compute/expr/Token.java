package com.formulize.compute.expr;

/**
 * A lexical token.
 *
 * @param kind   Token category.
 * @param text   Source text; for strings the unquoted content.
 * @param number Numeric value for {@link Kind#NUMBER}, NaN otherwise.
 * @param pos    Offset in the source.
 */
public record Token(Kind kind, String text, double number, int pos) {

    public enum Kind {
        NUMBER, IDENT, STRING, SYMBOL, EOF
    }

    public boolean is(String symbol) {
        return (kind == Kind.SYMBOL || kind == Kind.IDENT) && text.equals(symbol);
    }

    @Override
    public String toString() {
        return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
}
