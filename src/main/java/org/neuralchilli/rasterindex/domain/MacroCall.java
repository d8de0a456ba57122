package org.neuralchilli.rasterindex.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One {@code func_<name>(<args>)} occurrence inside a formula template.
 * Arguments are bare comma-separated tokens; scanning stops at the first
 * closing parenthesis, so nested calls inside arguments are not recognised.
 */
public record MacroCall(String wholeMatch, String functionName, List<String> arguments) {

    public static final String PREFIX = "func_";

    private static final Pattern CALL_PATTERN = Pattern.compile("(func_(\\w+)\\(([^)]*)\\))");

    public MacroCall {
        if (wholeMatch == null || wholeMatch.isBlank()) {
            throw new IllegalArgumentException("Macro match cannot be null or empty");
        }
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("Macro function name cannot be null or empty");
        }
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    /**
     * Find all macro calls in an expression, in order of appearance.
     */
    public static List<MacroCall> scan(String expression) {
        List<MacroCall> calls = new ArrayList<>();
        if (expression == null) {
            return calls;
        }

        Matcher matcher = CALL_PATTERN.matcher(expression);
        while (matcher.find()) {
            List<String> args = Arrays.stream(matcher.group(3).split(","))
                    .map(String::strip)
                    .filter(arg -> !arg.isEmpty())
                    .toList();
            calls.add(new MacroCall(matcher.group(1), matcher.group(2), args));
        }
        return calls;
    }

    public static boolean containsMacros(String expression) {
        return expression != null && CALL_PATTERN.matcher(expression).find();
    }

    /**
     * First argument, or null when the call has none.
     */
    public String firstArgument() {
        return arguments.isEmpty() ? null : arguments.get(0);
    }
}
