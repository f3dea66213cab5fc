package com.formulize.compute.symbolic;

import com.formulize.compute.expr.Parser;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bidirectional map between variable ids and the symbols the expression
 * language accepts.
 *
 * <ul>
 * <li>every character outside {@code [A-Za-z0-9_$]} becomes {@code _}</li>
 * <li>a leading character that cannot start a symbol gets a {@code _}
 * prefix</li>
 * <li>a reserved word gets a {@code var_} prefix</li>
 * <li>clashes between distinct ids get {@code _2}, {@code _3}, ... suffixes</li>
 * </ul>
 *
 * An id that is already a valid symbol always keeps it. The others are
 * processed in sorted order, so the mapping depends only on the set of ids and
 * never on insertion order.
 */
public final class NameTranslator {
    private static final Pattern INVALID = Pattern.compile("[^A-Za-z0-9_$]");
    private static final Pattern BRACED = Pattern.compile("\\{([^{}]+)}");

    private final Map<String, String> toSymbol = new LinkedHashMap<>();
    private final Map<String, String> toId = new LinkedHashMap<>();

    public NameTranslator(Collection<String> ids) {
        Set<String> sorted = new TreeSet<>(ids);
        Set<String> taken = new HashSet<>();
        for (String id : sorted) {
            if (sanitize(id).equals(id))
                taken.add(id);
        }
        for (String id : sorted) {
            String symbol = sanitize(id);
            if (!symbol.equals(id)) {
                String base = symbol;
                for (int n = 2; taken.contains(symbol); n++)
                    symbol = base + "_" + n;
                taken.add(symbol);
            }
            toSymbol.put(id, symbol);
            toId.put(symbol, id);
        }
    }

    /** The sanitization rule alone, without collision handling. */
    public static String sanitize(String id) {
        String s = INVALID.matcher(id).replaceAll("_");
        if (s.isEmpty() || !(Character.isLetter(s.charAt(0)) || s.charAt(0) == '_' || s.charAt(0) == '$'))
            s = "_" + s;
        if (Parser.RESERVED.contains(s.toLowerCase(Locale.ROOT)))
            s = "var_" + s;
        return s;
    }

    /** @return The symbol for an id, or null if the id is unknown. */
    public String symbol(String id) {
        return toSymbol.get(id);
    }

    /** @return The id behind a symbol, or null if the symbol is unknown. */
    public String id(String symbol) {
        return toId.get(symbol);
    }

    public Map<String, String> symbols() {
        return Collections.unmodifiableMap(toSymbol);
    }

    /**
     * Replaces {@code {id}} markup with the id's symbol. Braced names that are
     * not registered ids are sanitized on the spot.
     */
    public String preprocess(String expression) {
        Matcher m = BRACED.matcher(expression);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1).trim();
            String symbol = toSymbol.getOrDefault(name, sanitize(name));
            m.appendReplacement(sb, Matcher.quoteReplacement(symbol));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
