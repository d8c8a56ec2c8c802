package com.taxledger.pricing.config;

import com.taxledger.pricing.ExchangeRateProvider;
import com.taxledger.pricing.InMemoryExchangeRateProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Currency conversion configuration: properties and the default rate source.
 */
@Configuration
@EnableConfigurationProperties(FxProperties.class)
public class FxConfig {

    /** Empty table; the statement import fills it. Replaced by any other provider bean. */
    @Bean
    @ConditionalOnMissingBean(ExchangeRateProvider.class)
    public InMemoryExchangeRateProvider inMemoryExchangeRateProvider() {
        return new InMemoryExchangeRateProvider();
    }
}
