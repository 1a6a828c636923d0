package com.admissionsgenie.admission.rates;

import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;

/** Per-diem rate for stay days {@code firstDay} through {@code lastDay}, inclusive. */
public record DayTier(int firstDay, int lastDay, CurrencyAmount rate) {

    public DayTier {
        if (firstDay < 1 || lastDay < firstDay) {
            throw new IllegalArgumentException("Invalid day tier " + firstDay + "-" + lastDay);
        }
    }

    /** Number of days of a {@code lengthOfStay}-day stay that fall in this tier. */
    public int daysWithin(int lengthOfStay) {
        return Math.max(0, Math.min(lastDay, lengthOfStay) - firstDay + 1);
    }

    public String label() {
        return "Days " + firstDay + "-" + lastDay;
    }
}
