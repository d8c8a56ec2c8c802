package com.taxledger.costbasis.offsetting;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Derivative loss capping rule (§20 Abs. 6 EStG style). {@code derivativeLossCap} is the negative floor applied to
 * the conceptual derivative net when capping is enabled.
 */
public record OffsettingPolicy(boolean capDerivativeLosses, BigDecimal derivativeLossCap) {

    public static final BigDecimal DEFAULT_DERIVATIVE_LOSS_CAP = new BigDecimal("-20000");

    public OffsettingPolicy {
        Objects.requireNonNull(derivativeLossCap, "derivativeLossCap must not be null");
        if (derivativeLossCap.signum() > 0) {
            throw new IllegalArgumentException("derivativeLossCap must not be positive, got: " + derivativeLossCap);
        }
    }

    public static OffsettingPolicy defaults() {
        return new OffsettingPolicy(true, DEFAULT_DERIVATIVE_LOSS_CAP);
    }
}
