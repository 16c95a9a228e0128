package com.flagship.treasury_ledger.allocation;

import com.flagship.treasury_ledger.exception.ErrorKind;
import com.flagship.treasury_ledger.exception.InvalidRuleConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AllocationRuleTest {

    private static AllocationRule rule(List<AllocationShare> shares) {
        return AllocationRule.create("test-rule", 100, shares, null, null, null, "tester");
    }

    @Test
    @DisplayName("Shares summing to exactly 100 validate")
    void validRule() {
        assertDoesNotThrow(() -> rule(List.of(
            AllocationShare.of("operating", "60.5"),
            AllocationShare.of("reserve", "39.5"))).validate());
    }

    @Test
    @DisplayName("Sums of 99 and 101 are rejected")
    void sumMustBeHundred() {
        InvalidRuleConfigurationException under = assertThrows(InvalidRuleConfigurationException.class,
                () -> rule(List.of(AllocationShare.of("operating", "50"), AllocationShare.of("reserve", "49"))).validate());
        assertEquals(ErrorKind.INVALID_RULE_CONFIGURATION, under.getKind());
        assertEquals("99", under.getDetails().get("sum"));

        assertThrows(InvalidRuleConfigurationException.class,
                () -> rule(List.of(AllocationShare.of("operating", "50"), AllocationShare.of("reserve", "51"))).validate());
    }

    @Test
    @DisplayName("Zero, negative and over-100 percentages are rejected")
    void percentageRange() {
        assertThrows(InvalidRuleConfigurationException.class,
                () -> rule(List.of(AllocationShare.of("operating", "100"), AllocationShare.of("reserve", "0"))).validate());
        assertThrows(InvalidRuleConfigurationException.class,
                () -> rule(List.of(AllocationShare.of("operating", "110"), AllocationShare.of("reserve", "-10"))).validate());
    }

    @Test
    @DisplayName("More than two decimals and duplicate targets are rejected")
    void precisionAndDuplicates() {
        assertThrows(InvalidRuleConfigurationException.class,
                () -> rule(List.of(AllocationShare.of("operating", "33.333"),
                        AllocationShare.of("reserve", "66.667"))).validate());
        assertThrows(InvalidRuleConfigurationException.class,
                () -> rule(List.of(AllocationShare.of("operating", "50"),
                        AllocationShare.of("operating", "50"))).validate());
    }

    @Test
    @DisplayName("Empty allocations and inverted bounds are rejected")
    void emptyAndBounds() {
        assertThrows(InvalidRuleConfigurationException.class, () -> rule(List.of()).validate());

        AllocationRule inverted = AllocationRule.create("inverted", 1,
                List.of(AllocationShare.of("operating", "100")),
                new BigDecimal("500"), new BigDecimal("100"), null, "tester");
        assertThrows(InvalidRuleConfigurationException.class, inverted::validate);
    }

    @Test
    @DisplayName("Bounds are inclusive and optional")
    void accepts() {
        AllocationRule bounded = AllocationRule.create("bounded", 1,
                List.of(AllocationShare.of("operating", "100")),
                new BigDecimal("10"), new BigDecimal("20"), null, "tester");

        assertFalse(bounded.accepts(new BigDecimal("9.99999999")));
        assertTrue(bounded.accepts(new BigDecimal("10")));
        assertTrue(bounded.accepts(new BigDecimal("20.00")));
        assertFalse(bounded.accepts(new BigDecimal("20.00000001")));
        assertTrue(rule(List.of(AllocationShare.of("operating", "100"))).accepts(new BigDecimal("1000000")));
    }

    @Test
    @DisplayName("Deactivation keeps everything but the active flag")
    void deactivate() {
        AllocationRule active = rule(List.of(AllocationShare.of("operating", "100")));
        AllocationRule inactive = active.deactivate();

        assertFalse(inactive.isActive());
        assertEquals(active.getId(), inactive.getId());
        assertEquals(active.getShares(), inactive.getShares());
    }
}
