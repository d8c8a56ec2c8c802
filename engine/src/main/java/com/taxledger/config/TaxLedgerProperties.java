package com.taxledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Engine configuration. Documented in application.yml under taxledger.
 */
@ConfigurationProperties(prefix = "taxledger")
@Getter
@Setter
public class TaxLedgerProperties {

    private NumericProperties numeric = new NumericProperties();

    private OffsettingProperties offsetting = new OffsettingProperties();

    @Getter
    @Setter
    public static class NumericProperties {
        /** Significant digits for all intermediate arithmetic. */
        private int precision = 28;
        private RoundingMode roundingMode = RoundingMode.HALF_UP;
        /** Decimal places of reported EUR totals. */
        private int amountScale = 2;
        /** Decimal places of per-unit values. */
        private int perUnitScale = 6;
        /** Decimal places of lot and position quantities. */
        private int quantityScale = 8;
    }

    @Getter
    @Setter
    public static class OffsettingProperties {
        /** Floor the conceptual derivative net at {@link #derivativeLossCap} when it is negative. */
        private boolean capDerivativeLosses = true;
        private BigDecimal derivativeLossCap = new BigDecimal("-20000");
    }
}
