package org.neuralchilli.rasterindex.core;

import org.neuralchilli.rasterindex.domain.BandMapping;
import org.neuralchilli.rasterindex.domain.BandStatistic;
import org.neuralchilli.rasterindex.domain.MacroCall;
import org.neuralchilli.rasterindex.raster.BandStatisticsProvider;
import org.neuralchilli.rasterindex.raster.RasterHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Expands formula templates into flat band expressions.
 *
 * Each round scans the expression for {@code func_<name>(<args>)} calls and
 * substitutes them: band statistics become numeric literals, {@code func_index(X)}
 * becomes X's raw template in parentheses. Rounds repeat until no call remains.
 * Expansion is bounded so a cyclic reference fails instead of looping.
 */
public class FormulaResolver {

    private static final Logger log = LoggerFactory.getLogger(FormulaResolver.class);

    static final String INDEX_FUNCTION = "index";

    private final FormulaLibrary library;
    private final BandStatisticsProvider statistics;
    private final int maxRounds;

    public FormulaResolver(FormulaLibrary library, BandStatisticsProvider statistics) {
        // One round per formula in the longest chain, plus one for the statistics it ends in
        this(library, statistics, library.maxReferenceDepth() + 1);
    }

    public FormulaResolver(FormulaLibrary library, BandStatisticsProvider statistics, int maxRounds) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("Max expansion rounds must be >= 1");
        }
        this.library = library;
        this.statistics = statistics;
        this.maxRounds = maxRounds;
    }

    /**
     * Resolve a library formula by name.
     */
    public String resolveIndex(String index, RasterHandle raster, BandMapping bandMapping) {
        return resolve(library.template(index), raster, bandMapping);
    }

    /**
     * Expand a template into an expression containing only band symbols,
     * numbers and arithmetic operators.
     *
     * @throws FormulaException      on unknown functions, bands or formulas
     * @throws CyclicFormulaException if expansion does not converge
     */
    public String resolve(String template, RasterHandle raster, BandMapping bandMapping) {
        if (template == null || template.isBlank()) {
            throw new FormulaException("Formula template cannot be null or empty");
        }

        String built = template;
        List<MacroCall> calls = MacroCall.scan(built);
        int rounds = 0;

        while (!calls.isEmpty()) {
            if (++rounds > maxRounds) {
                throw new CyclicFormulaException(String.format(
                        "Formula expansion did not converge after %d rounds, check for cyclic " +
                                "func_index references: %s", maxRounds, template));
            }

            for (MacroCall call : calls) {
                built = built.replace(call.wholeMatch(), substitute(call, built, raster, bandMapping));
            }
            calls = MacroCall.scan(built);
        }

        log.debug("Input index: {}; Built index: {}", template, built);
        return built;
    }

    private String substitute(MacroCall call, String expression, RasterHandle raster, BandMapping bandMapping) {
        String argument = call.firstArgument();
        if (argument == null) {
            throw new FormulaException("Missing argument in " + call.wholeMatch());
        }

        if (INDEX_FUNCTION.equals(call.functionName())) {
            String referenced = library.find(argument)
                    .orElseThrow(() -> new FormulaException(
                            "Unknown index formula '" + argument + "' in " + call.wholeMatch()))
                    .template();

            // A lone reference needs no grouping
            if (expression.strip().equals(call.wholeMatch())) {
                return referenced;
            }
            return "(" + referenced + ")";
        }

        Optional<BandStatistic> statistic = BandStatistic.fromFunctionName(call.functionName());
        if (statistic.isEmpty()) {
            throw new FormulaException("Unknown function '" + MacroCall.PREFIX + call.functionName() +
                    "' in " + call.wholeMatch());
        }

        Integer band = bandMapping.bandFor(argument);
        if (band == null) {
            throw new FormulaException("Unknown band symbol '" + argument + "' in " + call.wholeMatch() +
                    "; band mapping defines " + bandMapping.symbols());
        }

        double value = statistics.statistic(raster, band, statistic.get());
        return formatLiteral(value, call);
    }

    static String formatLiteral(double value, MacroCall call) {
        if (!Double.isFinite(value)) {
            throw new FormulaException("Statistic for " + call.wholeMatch() + " is not a finite number: " + value);
        }

        String literal = BigDecimal.valueOf(value).toPlainString();
        if (!literal.contains(".")) {
            literal = literal + ".0";
        }
        return value < 0 ? "(" + literal + ")" : literal;
    }
}
