package org.neuralchilli.rasterindex.raster;

import org.neuralchilli.rasterindex.domain.BandMapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a flat raster-calculator expression into JEXL source.
 *
 * Grammar, lowest precedence first:
 * <pre>
 *   expr    := term (('+' | '-') term)*
 *   term    := unary (('*' | '/') unary)*
 *   unary   := ('-' | '+') unary | power
 *   power   := primary ('^' unary)?
 *   primary := number | band symbol | '(' expr ')'
 * </pre>
 * {@code ^} is exponentiation, right-associative and tighter than unary minus
 * ({@code -G^2} is {@code -(G^2)}). JEXL reads {@code ^} as xor, so powers are
 * emitted as {@code math:pow(a, b)}. Every operation is parenthesized in the output.
 *
 * Band symbols become variables {@code v0..vn} and numeric literals become
 * constants {@code c0..cn}, so all arithmetic runs on doubles.
 */
final class RasterCalcTranslator {

    static final String MATH_NAMESPACE = "math";

    private final String expression;
    private final BandMapping bandMapping;
    private final Map<String, String> bandVariables = new LinkedHashMap<>();
    private final List<Double> constants = new ArrayList<>();
    private int pos;

    private RasterCalcTranslator(String expression, BandMapping bandMapping) {
        this.expression = expression;
        this.bandMapping = bandMapping;
    }

    /**
     * Translated expression.
     *
     * @param source        JEXL source
     * @param bandVariables band symbol to variable name, in order of first use
     * @param constants     value of constant {@code c<i>} at index i
     */
    record Translation(String source, Map<String, String> bandVariables, List<Double> constants) {
    }

    /**
     * @throws IllegalArgumentException on syntax errors or band symbols missing from the mapping
     */
    static Translation translate(String expression, BandMapping bandMapping) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression cannot be null or empty");
        }

        RasterCalcTranslator translator = new RasterCalcTranslator(expression, bandMapping);
        String source = translator.parseExpression();
        translator.skipWhitespace();
        if (translator.pos < expression.length()) {
            throw translator.error("Unexpected '" + expression.charAt(translator.pos) + "'");
        }

        return new Translation(
                source,
                Collections.unmodifiableMap(translator.bandVariables),
                List.copyOf(translator.constants)
        );
    }

    private String parseExpression() {
        String left = parseTerm();
        while (true) {
            char op = peek();
            if (op != '+' && op != '-') {
                return left;
            }
            pos++;
            left = "(" + left + " " + op + " " + parseTerm() + ")";
        }
    }

    private String parseTerm() {
        String left = parseUnary();
        while (true) {
            char op = peek();
            if (op != '*' && op != '/') {
                return left;
            }
            pos++;
            left = "(" + left + " " + op + " " + parseUnary() + ")";
        }
    }

    private String parseUnary() {
        char op = peek();
        if (op == '-') {
            pos++;
            return "(-" + parseUnary() + ")";
        }
        if (op == '+') {
            pos++;
            return parseUnary();
        }
        return parsePower();
    }

    private String parsePower() {
        String base = parsePrimary();
        if (peek() == '^') {
            pos++;
            return MATH_NAMESPACE + ":pow(" + base + ", " + parseUnary() + ")";
        }
        return base;
    }

    private String parsePrimary() {
        char next = peek();

        if (next == '(') {
            pos++;
            String inner = parseExpression();
            if (peek() != ')') {
                throw error("Missing ')'");
            }
            pos++;
            return "(" + inner + ")";
        }
        if (Character.isDigit(next) || next == '.') {
            return constant(readNumber());
        }
        if (Character.isLetter(next) || next == '_') {
            return band(readIdentifier());
        }
        if (next == 0) {
            throw error("Unexpected end of expression");
        }
        throw error("Unexpected '" + next + "'");
    }

    private String readNumber() {
        int start = pos;
        while (pos < expression.length() && (Character.isDigit(expression.charAt(pos)) || expression.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < expression.length() && (expression.charAt(pos) == 'e' || expression.charAt(pos) == 'E')) {
            pos++;
            if (pos < expression.length() && (expression.charAt(pos) == '+' || expression.charAt(pos) == '-')) {
                pos++;
            }
            while (pos < expression.length() && Character.isDigit(expression.charAt(pos))) {
                pos++;
            }
        }
        return expression.substring(start, pos);
    }

    private String readIdentifier() {
        int start = pos;
        while (pos < expression.length()
                && (Character.isLetterOrDigit(expression.charAt(pos)) || expression.charAt(pos) == '_')) {
            pos++;
        }
        return expression.substring(start, pos);
    }

    private String constant(String literal) {
        double value;
        try {
            value = Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + literal + "'");
        }
        constants.add(value);
        return "c" + (constants.size() - 1);
    }

    private String band(String symbol) {
        if (!bandMapping.contains(symbol)) {
            throw error("Unknown band symbol '" + symbol + "', band mapping defines " + bandMapping.symbols());
        }
        return bandVariables.computeIfAbsent(symbol, key -> "v" + bandVariables.size());
    }

    private char peek() {
        skipWhitespace();
        return pos < expression.length() ? expression.charAt(pos) : 0;
    }

    private void skipWhitespace() {
        while (pos < expression.length() && Character.isWhitespace(expression.charAt(pos))) {
            pos++;
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at position " + pos + " in: " + expression);
    }
}
