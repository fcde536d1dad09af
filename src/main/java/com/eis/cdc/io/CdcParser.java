package com.eis.cdc.io;

import com.eis.cdc.api.Component;
import com.eis.cdc.circuit.Circuit;
import com.eis.cdc.circuit.Parallel;
import com.eis.cdc.circuit.Series;
import com.eis.cdc.element.Element;
import com.eis.cdc.element.ElementType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Circuit description code parser.
 *
 * <p>
 * Recursive descent over the nested-bracket grammar:
 * <ul>
 * <li>Elements: a mnemonic ({@code R}, {@code Wo}, ...) with an optional
 * parameter block {@code {key=value[f][/lower[/upper]],...[:label]}}</li>
 * <li>Series {@code [ ... ]}, any number of items</li>
 * <li>Parallel {@code ( ... )}, at least two items</li>
 * </ul>
 * Text that is not enclosed in a single top-level series is treated as if it
 * were, and blank text is the empty circuit {@code []}. Brackets may nest at
 * most {@link #MAX_NESTING} deep. The resulting tree is
 * normalized, so {@link Circuit#toString()} is canonical.
 */
public final class CdcParser {
    /** Deepest bracket nesting accepted. */
    public static final int MAX_NESTING = 256;

    private CdcParser() {
        // Utility class
    }

    /**
     * Parses CDC text.
     *
     * @throws CdcParseException if the text is malformed.
     */
    public static Circuit parse(String cdc) {
        if (cdc == null || cdc.isBlank())
            return new Circuit(Series.of());
        return new MiniParser(cdc).parseCircuit();
    }

    private static final class MiniParser {
        private final String input;
        private int pos;

        MiniParser(String input) {
            this.input = input;
        }

        Circuit parseCircuit() {
            List<Component> items = new ArrayList<>();
            skipWS();
            while (pos < input.length()) {
                items.add(parseItem(0));
                skipWS();
            }
            if (items.size() > 1) {
                for (Component c : items)
                    if (c instanceof Series s && s.isEmpty())
                        throw err("Empty series", 0, null);
            }
            return new Circuit(Series.of(items));
        }

        private Component parseItem(int depth) {
            skipWS();
            char c = input.charAt(pos);
            return switch (c) {
                case '[' -> parseSeries(depth);
                case '(' -> parseParallel(depth);
                case ']', ')' -> throw err("Unmatched '" + c + "'", pos, String.valueOf(c));
                default -> {
                    if (Character.isUpperCase(c))
                        yield parseElement();
                    throw err("Unexpected character '" + c + "'", pos, String.valueOf(c));
                }
            };
        }

        private Series parseSeries(int depth) {
            int start = pos;
            List<Component> items = parseGroup('[', ']', depth);
            if (items.isEmpty() && depth > 0)
                throw err("Empty series", start, input.substring(start, pos));
            return Series.of(items);
        }

        private Parallel parseParallel(int depth) {
            int start = pos;
            List<Component> items = parseGroup('(', ')', depth);
            if (items.size() < 2)
                throw err("Parallel connection requires at least two items", start, input.substring(start, pos));
            try {
                return Parallel.of(items);
            } catch (IllegalArgumentException e) {
                throw err(e.getMessage(), start, input.substring(start, pos));
            }
        }

        private List<Component> parseGroup(char open, char close, int depth) {
            int start = pos;
            if (depth >= MAX_NESTING)
                throw err("Nesting too deep", pos, String.valueOf(open));
            expect(open);
            List<Component> items = new ArrayList<>();
            while (true) {
                skipWS();
                if (pos >= input.length())
                    throw err("Unmatched '" + open + "'", start, input.substring(start));
                char c = input.charAt(pos);
                if (c == close) {
                    pos++;
                    return items;
                }
                if (c == ']' || c == ')')
                    throw err("Unmatched '" + open + "' closed by '" + c + "'", start, input.substring(start, pos + 1));
                items.add(parseItem(depth + 1));
            }
        }

        private Element parseElement() {
            int start = pos;
            pos++;
            while (pos < input.length() && Character.isLowerCase(input.charAt(pos)))
                pos++;
            String symbol = input.substring(start, pos);
            ElementType type = ElementType.fromSymbol(symbol);
            if (type == null)
                throw err("Unknown element '" + symbol + "'", start, symbol);
            Element element = type.create();
            skipWS();
            if (pos < input.length() && input.charAt(pos) == '{')
                parseParameters(element);
            return element;
        }

        private void parseParameters(Element element) {
            int start = pos;
            expect('{');
            Set<String> seen = new HashSet<>();
            while (true) {
                skipWS();
                if (pos >= input.length())
                    throw err("Unmatched '{'", start, input.substring(start));
                char c = input.charAt(pos);
                if (c == '}') {
                    pos++;
                    return;
                }
                if (c == ':') {
                    pos++;
                    parseLabel(element, start);
                    continue;
                }
                parseParameter(element, seen);
                skipWS();
                if (pos < input.length() && input.charAt(pos) == ',')
                    pos++;
                else if (pos < input.length() && input.charAt(pos) != '}' && input.charAt(pos) != ':')
                    throw err("Expected ',' or '}'", pos, String.valueOf(input.charAt(pos)));
            }
        }

        private void parseLabel(Element element, int blockStart) {
            int s = pos;
            while (pos < input.length() && input.charAt(pos) != '}')
                pos++;
            if (pos >= input.length())
                throw err("Unmatched '{'", blockStart, input.substring(blockStart));
            try {
                element.setLabel(input.substring(s, pos));
            } catch (IllegalArgumentException e) {
                throw err(e.getMessage(), s, input.substring(s, pos));
            }
        }

        private void parseParameter(Element element, Set<String> seen) {
            int s = pos;
            while (pos < input.length()
                    && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_'))
                pos++;
            String key = input.substring(s, pos);
            if (key.isEmpty())
                throw err("Expected parameter name", s, pos < input.length() ? String.valueOf(input.charAt(pos)) : null);
            if (!element.getType().hasParameter(key))
                throw err("Unknown parameter '" + key + "' for element " + element.getSymbol(), s, key);
            if (!seen.add(key))
                throw err("Duplicate parameter '" + key + "'", s, key);
            expect('=');
            int valuePos = pos;
            double value = parseNumber();
            if (Double.isInfinite(value))
                throw err("Parameter value must be finite", valuePos, input.substring(valuePos, pos));
            boolean fixed = false;
            if (pos < input.length() && (input.charAt(pos) == 'f' || input.charAt(pos) == 'F')) {
                fixed = true;
                pos++;
            }
            ElementType.ParameterDefault def = element.getType().getDefault(key);
            double lower = def.lower();
            double upper = def.upper();
            skipWS();
            if (pos < input.length() && input.charAt(pos) == '/') {
                pos++;
                lower = parseNumber();
                skipWS();
                if (pos < input.length() && input.charAt(pos) == '/') {
                    pos++;
                    upper = parseNumber();
                }
            }
            if (lower > upper)
                throw err("Lower limit exceeds upper limit of '" + key + "'", s, input.substring(s, pos));
            element.applySettings(key, value, lower, upper, fixed);
        }

        private double parseNumber() {
            skipWS();
            int s = pos;
            if (pos < input.length() && (input.charAt(pos) == '-' || input.charAt(pos) == '+'))
                pos++;
            if (input.regionMatches(true, pos, "inf", 0, 3)) {
                pos += 3;
                return input.charAt(s) == '-' ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            }
            int digits = 0;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
                digits++;
            }
            if (pos < input.length() && input.charAt(pos) == '.') {
                pos++;
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    pos++;
                    digits++;
                }
            }
            if (digits == 0)
                throw err("Malformed number", s, input.substring(s, Math.min(pos + 1, input.length())));
            if (pos + 1 < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
                int e = pos + 1;
                if (input.charAt(e) == '+' || input.charAt(e) == '-')
                    e++;
                if (e < input.length() && Character.isDigit(input.charAt(e))) {
                    pos = e;
                    while (pos < input.length() && Character.isDigit(input.charAt(pos)))
                        pos++;
                }
            }
            return Double.parseDouble(input.substring(s, pos));
        }

        private void expect(char c) {
            skipWS();
            if (pos >= input.length() || input.charAt(pos) != c)
                throw err("Expected '" + c + "'", pos,
                        pos < input.length() ? String.valueOf(input.charAt(pos)) : null);
            pos++;
        }

        private void skipWS() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos)))
                pos++;
        }

        private CdcParseException err(String reason, int at, String offending) {
            return new CdcParseException(reason, at, offending);
        }
    }
}
