package com.admissionsgenie.shared;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Helper for managing currency amounts.
 *
 * For now assume everything is USD. Amounts are truncated (not rounded) to whole cents, so a
 * total built by summing amounts never drifts from the sum of its parts.
 */
public class CurrencyUtil {
    private static final int DECIMAL_PLACES = 2;
    private static final BigDecimal SCALE_FACTOR = BigDecimal.TEN.pow(DECIMAL_PLACES);

    /**
     * Convert proto (whole + decimal) → BigDecimal.
     */
    private static BigDecimal protoToBigDecimal(CurrencyValue proto) {
        BigDecimal whole = BigDecimal.valueOf(proto.getWholeAmount());
        BigDecimal fraction = BigDecimal.valueOf(proto.getDecimalAmount()).divide(SCALE_FACTOR,
                DECIMAL_PLACES, RoundingMode.UNNECESSARY);
        return whole.add(fraction);
    }

    private static BigDecimal standardize(BigDecimal value) {
        return value.setScale(DECIMAL_PLACES, RoundingMode.DOWN);
    }

    /**
     * Convert BigDecimal → proto (whole + two-digit decimal). Extra decimal places are
     * truncated.
     */
    private static CurrencyValue bigDecimalToProto(BigDecimal amount) {
        // Shift decimal point right by two places e.g. 123.45 × 100 = 12345
        long units = standardize(amount).multiply(SCALE_FACTOR).longValueExact();
        return minUnitToProto(units);
    }

    private static CurrencyValue minUnitToProto(long units) {
        long whole = units / SCALE_FACTOR.longValue(); // -12345 / 100 = -123
        int decimal = (int) (units % SCALE_FACTOR.longValue()); // -12345 % 100 = -45
        return CurrencyValue.newBuilder().setWholeAmount(whole).setDecimalAmount(decimal).build();
    }

    public record CurrencyAmount(BigDecimal value) {
        public CurrencyAmount(BigDecimal value) {
            this.value = standardize(value);
        }

        public static final CurrencyAmount ZERO = new CurrencyAmount(BigDecimal.ZERO);
        public static final CurrencyAmount ONE = new CurrencyAmount(BigDecimal.ONE);

        public CurrencyValue toProto() {
            return bigDecimalToProto(value);
        }

        public CurrencyAmount add(CurrencyAmount other) {
            return new CurrencyAmount(value.add(other.value));
        }

        public CurrencyAmount subtract(CurrencyAmount other) {
            return new CurrencyAmount(value.subtract(other.value));
        }

        /** Multiplies by an arbitrary factor, truncating the product to whole cents. */
        public CurrencyAmount multiply(BigDecimal factor) {
            return new CurrencyAmount(value.multiply(factor));
        }

        public CurrencyAmount times(int count) {
            return new CurrencyAmount(value.multiply(BigDecimal.valueOf(count)));
        }

        /** Divides into {@code parts} equal shares, truncated to whole cents. */
        public CurrencyAmount divide(int parts) {
            if (parts <= 0) {
                throw new IllegalArgumentException("Cannot divide into " + parts + " parts");
            }
            return new CurrencyAmount(
                    value.divide(BigDecimal.valueOf(parts), DECIMAL_PLACES, RoundingMode.DOWN));
        }

        public CurrencyAmount negate() {
            return new CurrencyAmount(value.negate());
        }

        public boolean isNegative() {
            return value.signum() < 0;
        }

        public boolean isEqualTo(CurrencyAmount other) {
            return value.compareTo(other.value) == 0;
        }

        public boolean isGreaterThan(CurrencyAmount other) {
            return value.compareTo(other.value) > 0;
        }

        public boolean isGreaterThanOrEqualTo(CurrencyAmount other) {
            return value.compareTo(other.value) >= 0;
        }

        public boolean isLessThan(CurrencyAmount other) {
            return value.compareTo(other.value) < 0;
        }

        public boolean isLessThanOrEqualTo(CurrencyAmount other) {
            return value.compareTo(other.value) <= 0;
        }

        public double doubleValue() {
            return value.doubleValue();
        }

        @Override
        public String toString() {
            return "$" + value.toPlainString();
        }

        public static CurrencyAmount sum(Iterable<CurrencyAmount> amounts) {
            CurrencyAmount total = ZERO;
            for (CurrencyAmount amount : amounts) {
                total = total.add(amount);
            }
            return total;
        }

        public static CurrencyAmount fromProto(CurrencyValue proto) {
            return new CurrencyAmount(protoToBigDecimal(proto));
        }

        public static CurrencyAmount from(BigDecimal amount) {
            return new CurrencyAmount(amount);
        }

        public static CurrencyAmount from(String amount) {
            return CurrencyAmount.from(new BigDecimal(amount));
        }
    }
}
