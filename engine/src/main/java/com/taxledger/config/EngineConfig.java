package com.taxledger.config;

import com.taxledger.common.NumericContext;
import com.taxledger.costbasis.offsetting.OffsettingPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns {@link TaxLedgerProperties} into the immutable values the engine receives through its constructors.
 */
@Configuration
@EnableConfigurationProperties(TaxLedgerProperties.class)
@Slf4j
public class EngineConfig {

    @Bean
    public NumericContext numericContext(TaxLedgerProperties properties) {
        TaxLedgerProperties.NumericProperties numeric = properties.getNumeric();
        NumericContext context = new NumericContext(numeric.getPrecision(), numeric.getRoundingMode(),
                numeric.getAmountScale(), numeric.getPerUnitScale(), numeric.getQuantityScale());
        log.info("Numeric context: {}", context);
        return context;
    }

    @Bean
    public OffsettingPolicy offsettingPolicy(TaxLedgerProperties properties) {
        TaxLedgerProperties.OffsettingProperties offsetting = properties.getOffsetting();
        return new OffsettingPolicy(offsetting.isCapDerivativeLosses(), offsetting.getDerivativeLossCap());
    }
}
