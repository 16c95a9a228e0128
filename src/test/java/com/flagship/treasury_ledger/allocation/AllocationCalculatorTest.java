package com.flagship.treasury_ledger.allocation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AllocationCalculatorTest {

    private static final List<AllocationShare> DEFAULT_SPLIT = List.of(
        AllocationShare.of("operating", "50"),
        AllocationShare.of("reserve", "20"),
        AllocationShare.of("rewards", "15"),
        AllocationShare.of("development", "10"),
        AllocationShare.of("marketing", "5"));

    private static BigDecimal sum(List<BigDecimal> amounts) {
        return amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Test
    @DisplayName("100.00 splits into 50/20/15/10/5 with no remainder")
    void evenSplit() {
        List<BigDecimal> amounts = AllocationCalculator.split(new BigDecimal("100.00"), DEFAULT_SPLIT);

        assertEquals(List.of(
            new BigDecimal("50.00000000"),
            new BigDecimal("20.00000000"),
            new BigDecimal("15.00000000"),
            new BigDecimal("10.00000000"),
            new BigDecimal("5.00000000")), amounts);
    }

    @Test
    @DisplayName("Flooring remainder goes to the largest share")
    void remainderGoesToLargestShare() {
        List<AllocationShare> thirds = List.of(
            AllocationShare.of("a", "33.33"),
            AllocationShare.of("b", "33.34"),
            AllocationShare.of("c", "33.33"));

        List<BigDecimal> amounts = AllocationCalculator.split(new BigDecimal("0.00000010"), thirds);

        // each floors to 0.00000003; the 0.00000001 left over lands on b
        assertEquals(new BigDecimal("0.00000003"), amounts.get(0));
        assertEquals(new BigDecimal("0.00000004"), amounts.get(1));
        assertEquals(new BigDecimal("0.00000003"), amounts.get(2));
        assertEquals(0, sum(amounts).compareTo(new BigDecimal("0.0000001")));
    }

    @Test
    @DisplayName("Ties on the largest percentage favour the first share")
    void tieGoesToFirst() {
        List<AllocationShare> halves = List.of(
            AllocationShare.of("a", "50"),
            AllocationShare.of("b", "50"));

        List<BigDecimal> amounts = AllocationCalculator.split(new BigDecimal("0.00000001"), halves);

        assertEquals(new BigDecimal("0.00000001"), amounts.get(0));
        assertEquals(new BigDecimal("0E-8"), amounts.get(1));
    }

    @Test
    @DisplayName("Children always sum to the deposit, including awkward amounts")
    void conservesValue() {
        for (String amount : List.of("0.00000001", "0.00000003", "1", "33.33333333", "999999.99999999", "12345.6789")) {
            BigDecimal deposit = new BigDecimal(amount);
            List<BigDecimal> amounts = AllocationCalculator.split(deposit, DEFAULT_SPLIT);
            assertEquals(0, sum(amounts).compareTo(deposit), "split of " + amount + " must conserve value");
            amounts.forEach(a -> assertEquals(8, a.scale()));
        }
    }

    @Test
    @DisplayName("Negative amounts and empty share lists are rejected")
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class,
                () -> AllocationCalculator.split(new BigDecimal("-1"), DEFAULT_SPLIT));
        assertThrows(IllegalArgumentException.class,
                () -> AllocationCalculator.split(BigDecimal.TEN, List.of()));
    }
}
