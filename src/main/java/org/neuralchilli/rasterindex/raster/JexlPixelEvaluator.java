package org.neuralchilli.rasterindex.raster;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.JexlExpression;
import org.apache.commons.jexl3.MapContext;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.neuralchilli.rasterindex.domain.BandMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Evaluates a flat band expression over every pixel of a {@link BandRaster}
 * with JEXL and stages the single-band float result in the {@link StagingArea}.
 */
@ApplicationScoped
public class JexlPixelEvaluator implements PixelEvaluator {

    private static final Logger log = LoggerFactory.getLogger(JexlPixelEvaluator.class);

    @Inject
    StagingArea stagingArea;

    private final JexlEngine jexl;

    public JexlPixelEvaluator() {
        this.jexl = new JexlBuilder()
                .cache(256)
                .strict(true)
                .silent(false)
                .arithmetic(new RasterArithmetic(true))
                .namespaces(Map.<String, Object>of(RasterCalcTranslator.MATH_NAMESPACE, Math.class))
                .permissions(JexlPermissions.UNRESTRICTED)
                .create();
    }

    JexlPixelEvaluator(StagingArea stagingArea) {
        this();
        this.stagingArea = stagingArea;
    }

    @Override
    public EvaluationOutcome evaluate(String expression, RasterHandle raster, BandMapping bandMapping, String stagingPath) {
        if (!(raster instanceof BandRaster bandRaster)) {
            return EvaluationOutcome.failed("Unsupported raster handle: " + raster);
        }

        RasterCalcTranslator.Translation translation;
        JexlExpression compiled;
        try {
            translation = RasterCalcTranslator.translate(expression, bandMapping);
            compiled = jexl.createExpression(translation.source());
        } catch (IllegalArgumentException | JexlException e) {
            log.warn("Invalid expression {}: {}", expression, e.getMessage());
            return EvaluationOutcome.failed("Invalid expression: " + e.getMessage());
        }

        log.debug("Evaluating {} as {}", expression, translation.source());

        MapContext context = new MapContext();
        List<Double> constants = translation.constants();
        for (int i = 0; i < constants.size(); i++) {
            context.set("c" + i, constants.get(i));
        }

        int variables = translation.bandVariables().size();
        String[] names = new String[variables];
        float[][] samples = new float[variables][];
        int v = 0;
        for (Map.Entry<String, String> entry : translation.bandVariables().entrySet()) {
            Integer band = bandMapping.bandFor(entry.getKey());
            if (band > bandRaster.bandCount()) {
                return EvaluationOutcome.failed("Band " + band + " mapped to '" + entry.getKey() +
                        "' does not exist in " + bandRaster.name() + " (" + bandRaster.bandCount() + " bands)");
            }
            names[v] = entry.getValue();
            samples[v] = bandRaster.band(band);
            v++;
        }

        float[] output = new float[bandRaster.pixelCount()];
        try {
            for (int pixel = 0; pixel < output.length; pixel++) {
                for (int i = 0; i < variables; i++) {
                    context.set(names[i], (double) samples[i][pixel]);
                }
                Object value = compiled.evaluate(context);
                if (!(value instanceof Number number)) {
                    return EvaluationOutcome.failed("Expression did not produce a number: " + value);
                }
                output[pixel] = number.floatValue();
            }
        } catch (JexlException e) {
            log.warn("Evaluation of {} over {} failed: {}", expression, bandRaster.name(), e.getMessage());
            return EvaluationOutcome.failed("Evaluation failed: " + e.getMessage());
        }

        stagingArea.put(stagingPath, new StagingArea.StagedRaster(bandRaster.width(), bandRaster.height(), output));
        return EvaluationOutcome.succeeded();
    }
}
