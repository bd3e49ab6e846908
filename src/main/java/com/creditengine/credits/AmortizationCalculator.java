package com.creditengine.credits;

import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Annuity payment arithmetic.
 *
 * All rates are annual percentages; the monthly rate is {@code rate / 100 / 12}.
 * Every amount returned is rounded to two decimals, half away from zero.
 */
public final class AmortizationCalculator {

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);
    private static final BigDecimal MIN_PAYMENT = new BigDecimal("0.01");

    private AmortizationCalculator() {
    }

    /**
     * Fixed monthly payment for an annuity credit.
     *
     * @return zero when the principal or term is not positive or the rate is negative;
     *         otherwise a strictly positive amount
     */
    public static BigDecimal computeMonthlyPayment(BigDecimal principal, BigDecimal annualRatePercent, int termMonths) {
        if (principal == null || principal.signum() <= 0
                || annualRatePercent == null || annualRatePercent.signum() < 0
                || termMonths <= 0) {
            return round(BigDecimal.ZERO);
        }

        BigDecimal r = monthlyRate(annualRatePercent);
        BigDecimal payment;
        if (r.signum() == 0) {
            payment = principal.divide(BigDecimal.valueOf(termMonths), MC);
        } else {
            BigDecimal growth = BigDecimal.ONE.add(r).pow(termMonths, MC);
            payment = principal.multiply(r, MC).multiply(growth, MC)
                .divide(growth.subtract(BigDecimal.ONE), MC);
        }

        BigDecimal rounded = round(payment);
        return rounded.signum() == 0 ? MIN_PAYMENT : rounded;
    }

    /**
     * Principal and interest portions of one payment.
     *
     * The final payment takes the whole remaining principal, and its interest is whatever is
     * left of the monthly payment, so the principal portions of a schedule sum to the original
     * principal exactly.
     */
    public static PaymentSplit splitPayment(int paymentNumber, int termMonths, BigDecimal monthlyPayment,
                                            BigDecimal annualRatePercent, BigDecimal remainingPrincipal) {
        if (paymentNumber >= termMonths) {
            BigDecimal principal = round(remainingPrincipal);
            return new PaymentSplit(principal, round(monthlyPayment.subtract(principal)));
        }

        BigDecimal interest = round(remainingPrincipal.multiply(monthlyRate(annualRatePercent), MC));
        BigDecimal principal = round(monthlyPayment.subtract(interest));
        if (principal.compareTo(remainingPrincipal) > 0) {
            principal = round(remainingPrincipal);
        }
        if (principal.signum() < 0) {
            principal = round(BigDecimal.ZERO);
        }
        return new PaymentSplit(principal, interest);
    }

    /**
     * Full schedule for a credit disbursed on {@code startDate}; payment N falls due N months later.
     */
    public static List<ScheduledPayment> buildSchedule(BigDecimal principal, BigDecimal annualRatePercent,
                                                       int termMonths, LocalDate startDate) {
        BigDecimal monthlyPayment = computeMonthlyPayment(principal, annualRatePercent, termMonths);
        List<ScheduledPayment> schedule = new ArrayList<>(Math.max(termMonths, 0));
        if (monthlyPayment.signum() == 0) {
            return schedule;
        }

        BigDecimal remaining = round(principal);
        for (int n = 1; n <= termMonths; n++) {
            PaymentSplit split = splitPayment(n, termMonths, monthlyPayment, annualRatePercent, remaining);
            remaining = remaining.subtract(split.getPrincipal());
            schedule.add(new ScheduledPayment(n, startDate.plusMonths(n), monthlyPayment,
                split.getPrincipal(), split.getInterest(), remaining));
        }
        return schedule;
    }

    static BigDecimal monthlyRate(BigDecimal annualRatePercent) {
        return annualRatePercent.divide(HUNDRED, MC).divide(MONTHS_PER_YEAR, MC);
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    @Value
    public static class PaymentSplit {
        BigDecimal principal;
        BigDecimal interest;
    }

    @Value
    public static class ScheduledPayment {
        int paymentNumber;
        LocalDate dueDate;
        BigDecimal paymentAmount;
        BigDecimal principal;
        BigDecimal interest;
        /** Outstanding principal after this payment. */
        BigDecimal remainingBalance;
    }
}
