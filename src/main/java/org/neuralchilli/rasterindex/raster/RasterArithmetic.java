package org.neuralchilli.rasterindex.raster;

import org.apache.commons.jexl3.JexlArithmetic;

import java.math.MathContext;

/**
 * Pixel arithmetic: division by zero yields NaN instead of failing the whole raster.
 */
public class RasterArithmetic extends JexlArithmetic {

    public RasterArithmetic(boolean strict) {
        super(strict);
    }

    public RasterArithmetic(boolean strict, MathContext bigdContext, int bigdScale) {
        super(strict, bigdContext, bigdScale);
    }

    @Override
    protected JexlArithmetic createWithOptions(boolean strict, MathContext bigdContext, int bigdScale) {
        return new RasterArithmetic(strict, bigdContext, bigdScale);
    }

    @Override
    public Object divide(Object left, Object right) {
        double divisor = toDouble(right);
        if (divisor == 0) {
            return Double.NaN;
        }
        return toDouble(left) / divisor;
    }
}
