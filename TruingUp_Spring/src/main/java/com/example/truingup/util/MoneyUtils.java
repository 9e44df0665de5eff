package com.example.truingup.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * Decimal-exact money arithmetic.
 *
 * <p>Every monetary figure that leaves the rule engine goes through {@link #roundMoney(BigDecimal)}.
 * Ratios such as 1/3 are multiplied at full {@link BigDecimal} precision and rounded once, HALF_UP,
 * so no binary floating point error can creep into an audited amount.
 */
public final class MoneyUtils {

    public static final int MONEY_SCALE = 2;

    private MoneyUtils() {}

    public static BigDecimal roundMoney(BigDecimal value) {
        return roundMoney(value, MONEY_SCALE);
    }

    public static BigDecimal roundMoney(BigDecimal value, int places) {
        Objects.requireNonNull(value, "value");
        return value.setScale(places, RoundingMode.HALF_UP);
    }

    /** Goes through the shortest decimal string of {@code value}, so 0.1 rounds as 0.1 and not as 0.1000000000000000055. */
    public static BigDecimal roundMoney(double value, int places) {
        return roundMoney(BigDecimal.valueOf(value), places);
    }

    /** {@code amount × ratio}, rounded once. */
    public static BigDecimal share(BigDecimal amount, BigDecimal ratio) {
        return roundMoney(amount.multiply(ratio));
    }

    public static BigDecimal sum(Collection<BigDecimal> values) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal v : values) {
            if (v != null) total = total.add(v);
        }
        return roundMoney(total);
    }

    /** 12,345,678.90 style, independent of the JVM default locale. */
    public static String format(BigDecimal value) {
        return String.format(Locale.ENGLISH, "%,.2f", value);
    }

    /** 0.333.. -> "33.33%". */
    public static String formatPercent(BigDecimal ratio) {
        return roundMoney(ratio.movePointRight(2)).toPlainString() + "%";
    }
}
