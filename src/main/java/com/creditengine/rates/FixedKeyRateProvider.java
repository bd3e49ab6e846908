package com.creditengine.rates;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Key rate provider returning a configured constant.
 *
 * Used in development and tests where the central bank service is not reachable.
 */
@Component
@ConditionalOnProperty(name = "credit-engine.rates.provider", havingValue = "fixed")
@Slf4j
public class FixedKeyRateProvider implements KeyRateProvider {

    private final BigDecimal rate;

    public FixedKeyRateProvider(@Value("${credit-engine.rates.fixed-rate:16.0}") BigDecimal rate) {
        this.rate = rate;
        log.info("Fixed key rate provider initialized: rate={}", rate);
    }

    @Override
    public BigDecimal getAnnualRate() {
        return rate;
    }
}
