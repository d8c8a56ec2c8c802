package com.taxledger.common;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Arbitrary-precision settings for one calculation run. Every ledger and engine receives an instance
 * through its constructor; all intermediate arithmetic uses {@link #mathContext()}, and figures are
 * quantized only at output boundaries (cents for totals, micro-units per unit, 8 dp for quantities).
 */
public final class NumericContext {

    public static final int DEFAULT_PRECISION = 28;
    public static final int DEFAULT_AMOUNT_SCALE = 2;
    public static final int DEFAULT_PER_UNIT_SCALE = 6;
    public static final int DEFAULT_QUANTITY_SCALE = 8;

    private final MathContext mathContext;
    private final int amountScale;
    private final int perUnitScale;
    private final int quantityScale;

    public NumericContext(int precision, RoundingMode roundingMode, int amountScale, int perUnitScale, int quantityScale) {
        if (precision <= 0) {
            throw new IllegalArgumentException("precision must be positive, got: " + precision);
        }
        Objects.requireNonNull(roundingMode, "roundingMode must not be null");
        this.mathContext = new MathContext(precision, roundingMode);
        this.amountScale = amountScale;
        this.perUnitScale = perUnitScale;
        this.quantityScale = quantityScale;
    }

    public static NumericContext defaults() {
        return new NumericContext(DEFAULT_PRECISION, RoundingMode.HALF_UP,
                DEFAULT_AMOUNT_SCALE, DEFAULT_PER_UNIT_SCALE, DEFAULT_QUANTITY_SCALE);
    }

    public MathContext mathContext() {
        return mathContext;
    }

    public RoundingMode roundingMode() {
        return mathContext.getRoundingMode();
    }

    public int precision() {
        return mathContext.getPrecision();
    }

    public BigDecimal multiply(BigDecimal a, BigDecimal b) {
        return a.multiply(b, mathContext);
    }

    public BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, mathContext);
    }

    public BigDecimal add(BigDecimal a, BigDecimal b) {
        return a.add(b, mathContext);
    }

    public BigDecimal subtract(BigDecimal a, BigDecimal b) {
        return a.subtract(b, mathContext);
    }

    public BigDecimal quantizeAmount(BigDecimal value) {
        return value.setScale(amountScale, roundingMode());
    }

    public BigDecimal quantizePerUnit(BigDecimal value) {
        return value.setScale(perUnitScale, roundingMode());
    }

    public BigDecimal quantizeQuantity(BigDecimal value) {
        return value.setScale(quantityScale, roundingMode());
    }

    /**
     * Tolerance for end-of-year reconciliation: 10^-(precision / 2). With the default precision that is 1e-14.
     */
    public BigDecimal reconciliationTolerance() {
        return BigDecimal.ONE.scaleByPowerOfTen(-(precision() / 2));
    }

    @Override
    public String toString() {
        return "NumericContext{" + mathContext + ", amountScale=" + amountScale
                + ", perUnitScale=" + perUnitScale + ", quantityScale=" + quantityScale + "}";
    }
}
