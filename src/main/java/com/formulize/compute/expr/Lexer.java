package com.formulize.compute.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression source into tokens. Operators are matched longest first.
 * Script-dialect sources may carry {@code //} and {@code /* *\/} comments,
 * which are skipped.
 */
public final class Lexer {
    private static final String[] MATH_SYMBOLS = {
            ".*", "./", "==", "!=", "<=", ">=",
            "+", "-", "*", "/", "%", "^", "<", ">", "=",
            "(", ")", "[", "]", ",", ":", "?"
    };
    private static final String[] SCRIPT_SYMBOLS = {
            "===", "!==", "**",
            "==", "!=", "<=", ">=", "&&", "||", "+=", "-=", "*=", "/=",
            "+", "-", "*", "/", "%", "<", ">", "=", "!",
            "(", ")", "[", "]", "{", "}", ",", ":", "?", ";", "."
    };

    private final String input;
    private final String[] symbols;
    private final boolean comments;
    private int pos;

    public Lexer(String input, Dialect dialect) {
        this.input = input;
        this.symbols = dialect == Dialect.SCRIPT ? SCRIPT_SYMBOLS : MATH_SYMBOLS;
        this.comments = dialect == Dialect.SCRIPT;
    }

    public static List<Token> tokenize(String input, Dialect dialect) {
        return new Lexer(input, dialect).tokenize();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (pos >= input.length()) {
                tokens.add(new Token(Token.Kind.EOF, "", Double.NaN, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = input.charAt(pos);
        if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))))
            return number();
        if (isIdentStart(c))
            return ident();
        if (c == '"' || c == '\'')
            return string(c);
        for (String s : symbols) {
            if (input.startsWith(s, pos)) {
                Token t = new Token(Token.Kind.SYMBOL, s, Double.NaN, pos);
                pos += s.length();
                return t;
            }
        }
        throw err("Unexpected character '" + c + "'");
    }

    private Token number() {
        int start = pos;
        while (pos < input.length() && isDigit(input.charAt(pos)))
            pos++;
        if (pos < input.length() && input.charAt(pos) == '.'
                && !(pos + 1 < input.length() && (input.charAt(pos + 1) == '*' || input.charAt(pos + 1) == '/'))) {
            pos++;
            while (pos < input.length() && isDigit(input.charAt(pos)))
                pos++;
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-'))
                pos++;
            if (pos < input.length() && isDigit(input.charAt(pos))) {
                while (pos < input.length() && isDigit(input.charAt(pos)))
                    pos++;
            } else {
                // not an exponent, e.g. "2e" followed by an identifier
                pos = mark;
            }
        }
        String text = input.substring(start, pos);
        return new Token(Token.Kind.NUMBER, text, Double.parseDouble(text), start);
    }

    private Token ident() {
        int start = pos;
        while (pos < input.length() && isIdentPart(input.charAt(pos)))
            pos++;
        return new Token(Token.Kind.IDENT, input.substring(start, pos), Double.NaN, start);
    }

    private Token string(char quote) {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote)
                return new Token(Token.Kind.STRING, sb.toString(), Double.NaN, start);
            if (c == '\\' && pos < input.length())
                c = input.charAt(pos++);
            sb.append(c);
        }
        throw err("Unterminated string");
    }

    private void skipTrivia() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (comments && input.startsWith("//", pos)) {
                while (pos < input.length() && input.charAt(pos) != '\n')
                    pos++;
            } else if (comments && input.startsWith("/*", pos)) {
                int end = input.indexOf("*/", pos + 2);
                if (end < 0)
                    throw err("Unterminated comment");
                pos = end + 2;
            } else {
                return;
            }
        }
    }

    private EvalException err(String msg) {
        return new EvalException(msg + " at position " + pos);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}
