package com.creditengine.rates;

import java.math.BigDecimal;

/**
 * Source of the central bank key rate that credits are priced from.
 *
 * Implementations may be slow or unavailable; callers are expected to fall back
 * to a configured rate when {@link #getAnnualRate()} throws.
 */
public interface KeyRateProvider {

    /**
     * Current key rate as an annual percentage, bank margin not included.
     *
     * @throws com.creditengine.common.exception.RateProviderException if the rate cannot be obtained
     */
    BigDecimal getAnnualRate();
}
