package com.admissionsgenie.admission.rates;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class VariablePerDiemScheduleTest {

    private static final VariablePerDiemSchedule NTA_STYLE = new VariablePerDiemSchedule(
            ImmutableList.of(new VariablePerDiemSchedule.Step(1, new BigDecimal("3.0")),
                    new VariablePerDiemSchedule.Step(4, BigDecimal.ONE)));

    @Test
    void factorForDay_holdsUntilNextStep() {
        assertEquals(0, new BigDecimal("3.0").compareTo(NTA_STYLE.factorForDay(1)));
        assertEquals(0, new BigDecimal("3.0").compareTo(NTA_STYLE.factorForDay(3)));
        assertEquals(0, BigDecimal.ONE.compareTo(NTA_STYLE.factorForDay(4)));
        assertEquals(0, BigDecimal.ONE.compareTo(NTA_STYLE.factorForDay(90)));
    }

    @Test
    void cumulativeFactor_sumsDailyFactors() {
        assertEquals(0, new BigDecimal("9.0").compareTo(NTA_STYLE.cumulativeFactor(3)));
        assertEquals(0, new BigDecimal("16.0").compareTo(NTA_STYLE.cumulativeFactor(10)),
                "3 days at 3.0 plus 7 days at 1.0");
        assertEquals(0, BigDecimal.TEN.compareTo(VariablePerDiemSchedule.NONE.cumulativeFactor(10)));
    }

    @Test
    void constructor_rejectsBadSteps() {
        assertThrows(IllegalArgumentException.class, () -> new VariablePerDiemSchedule(
                ImmutableList.of(new VariablePerDiemSchedule.Step(2, BigDecimal.ONE))),
                "Schedule must start on day 1");
        assertThrows(IllegalArgumentException.class, () -> new VariablePerDiemSchedule(
                ImmutableList.of(new VariablePerDiemSchedule.Step(1, BigDecimal.ONE),
                        new VariablePerDiemSchedule.Step(1, BigDecimal.ONE))),
                "Steps must be in increasing order");
    }
}
