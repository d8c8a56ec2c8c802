package com.taxledger.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Currency conversion settings. Documented in application.yml under taxledger.fx.
 */
@ConfigurationProperties(prefix = "taxledger.fx")
@Getter
@Setter
public class FxProperties {

    /**
     * How many days to walk back from the requested date when no reference rate was published (weekends, holidays).
     */
    private int maxFallbackDays = 7;
}
