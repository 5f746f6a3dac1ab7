package com.churnmetrics.api.churn;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Stripe's customer churn formula: churned customers divided by the customers that could have
 * churned during the window (active at its start plus those acquired during it), as a percentage.
 *
 * @see <a href="https://stripe.com/resources/more/monthly-churn-101">Monthly churn 101</a>
 */
public final class ChurnRates {

    private ChurnRates() {
    }

    /**
     * @param churned   number of churned subscriptions.
     * @param totalBase active-at-start plus new subscriptions.
     * @return the churn percentage rounded half-up to 2 decimal places, or {@literal 0.0} when
     * {@code totalBase} is zero.
     */
    public static double churnRate(long churned, long totalBase) {
        if (totalBase <= 0) {
            return 0.0;
        }

        return BigDecimal.valueOf((double) churned / totalBase * 100)
            .setScale(2, RoundingMode.HALF_UP)
            .doubleValue();
    }
}
