package com.joinhints.hint;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Utilities for the multi-part relation names that hints refer to.
 *
 * <p>A relation name is written as dot-separated parts; a part containing dots or other
 * special characters is enclosed in backticks, with an embedded backtick doubled:
 * <pre>
 *   orders             → [orders]
 *   sales.orders       → [sales, orders]
 *   `my.db`.orders     → [my.db, orders]
 *   `a``b`             → [a`b]
 * </pre>
 */
public final class RelationIdentifiers {

    private RelationIdentifiers() {}

    /**
     * Parses a relation name into its parts.
     *
     * @param name the relation name as written in a hint
     * @return the name parts
     * @throws IllegalArgumentException if the name is empty, has an empty part, or has an
     *         unterminated backtick
     */
    public static List<String> parse(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Relation name cannot be null or empty");
        }

        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean quotedPart = false;
        int i = 0;
        while (i < name.length()) {
            char c = name.charAt(i);
            if (inQuotes) {
                if (c == '`') {
                    if (i + 1 < name.length() && name.charAt(i + 1) == '`') {
                        current.append('`');
                        i++;
                    } else {
                        inQuotes = false;
                        if (i + 1 < name.length() && name.charAt(i + 1) != '.') {
                            throw new IllegalArgumentException("Unexpected character after backtick in relation name: " + name);
                        }
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '`') {
                if (current.length() > 0) {
                    throw new IllegalArgumentException("Unexpected backtick in relation name: " + name);
                }
                inQuotes = true;
                quotedPart = true;
            } else if (c == '.') {
                addPart(parts, current, quotedPart, name);
                current.setLength(0);
                quotedPart = false;
            } else {
                current.append(c);
            }
            i++;
        }

        if (inQuotes) {
            throw new IllegalArgumentException("Unterminated backtick in relation name: " + name);
        }
        addPart(parts, current, quotedPart, name);
        return List.copyOf(parts);
    }

    private static void addPart(List<String> parts, StringBuilder part, boolean quoted, String name) {
        if (part.length() == 0 && !quoted) {
            throw new IllegalArgumentException("Empty part in relation name: " + name);
        }
        parts.add(part.toString());
    }

    /**
     * Renders name parts back into a single relation name, quoting parts that need it.
     *
     * @param nameParts the name parts
     * @return the quoted name
     */
    public static String quoted(List<String> nameParts) {
        return nameParts.stream()
            .map(RelationIdentifiers::quotePartIfNeeded)
            .collect(Collectors.joining("."));
    }

    private static String quotePartIfNeeded(String part) {
        if (!part.isEmpty() && part.matches("[a-zA-Z0-9_]+")) {
            return part;
        }
        return "`" + part.replace("`", "``") + "`";
    }

    /**
     * Checks whether the name given in a hint refers to the relation identified in the query.
     *
     * <p>The hint may use a suffix of the full identifier, so {@code orders} matches
     * {@code sales.orders}, but not the other way around.
     *
     * @param identInHint the name parts written in the hint
     * @param identInQuery the full identifier of the relation in the plan
     * @param caseSensitive whether name parts are compared case-sensitively
     * @return true if the hint refers to the relation
     */
    public static boolean matches(List<String> identInHint, List<String> identInQuery, boolean caseSensitive) {
        if (identInHint.isEmpty() || identInHint.size() > identInQuery.size()) {
            return false;
        }
        int offset = identInQuery.size() - identInHint.size();
        for (int i = 0; i < identInHint.size(); i++) {
            String a = identInHint.get(i);
            String b = identInQuery.get(offset + i);
            if (caseSensitive ? !a.equals(b) : !a.equalsIgnoreCase(b)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders a hint name and its parameters the way they were written, e.g.
     * {@code BROADCAST(sales.orders, c)}.
     *
     * @param name the hint name
     * @param parameters the hint parameters
     * @return the printable hint
     */
    public static String prettyHint(String name, List<Object> parameters) {
        String params = parameters.stream()
            .map(RelationIdentifiers::prettyParameter)
            .collect(Collectors.joining(", ", "(", ")"));
        return name + params;
    }

    private static String prettyParameter(Object parameter) {
        if (parameter instanceof List<?> parts) {
            return parts.stream().map(String::valueOf).collect(Collectors.joining("."));
        }
        return String.valueOf(parameter);
    }
}
