package com.di.splitnova.sampling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ThresholdCalculator Tests")
class ThresholdCalculatorTest {

    private static final double EPS = 1e-12;

    // ============================================================================
    // Bounds
    // ============================================================================

    @Test
    @DisplayName("Should compute the Bernstein/Chernoff bounds for p=0.1, N=1000")
    void testComputeBounds_KnownValues() {
        ThresholdBounds bounds = ThresholdCalculator.computeBounds(0.1, 1000, 5e-5);
        assertEquals(0.061610234548191506, bounds.qLow(), EPS);
        assertEquals(0.15549708991306982, bounds.qHigh(), EPS);
    }

    @Test
    @DisplayName("Should tighten around p as the population grows")
    void testComputeBounds_LargePopulation() {
        ThresholdBounds bounds = ThresholdCalculator.computeBounds(0.5, 1_000_000, 5e-5);
        assertEquals(0.4968596146950574, bounds.qLow(), EPS);
        assertEquals(0.5031568997747449, bounds.qHigh(), EPS);
    }

    @Test
    @DisplayName("Should clamp bounds to the unit interval")
    void testComputeBounds_Clamped() {
        ThresholdBounds tiny = ThresholdCalculator.computeBounds(0.001, 10, 5e-5);
        assertEquals(0.0, tiny.qLow());
        ThresholdBounds full = ThresholdCalculator.computeBounds(1.0, 10, 5e-5);
        assertEquals(1.0, full.qHigh());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 1.0, -0.1, 1.5, Double.NaN})
    @DisplayName("Should reject delta outside (0, 1)")
    void testComputeBounds_InvalidDelta(double delta) {
        assertThrows(InvalidConfigurationException.class, () -> ThresholdCalculator.computeBounds(0.1, 1000, delta));
    }

    // ============================================================================
    // Initial thresholds
    // ============================================================================

    @Test
    @DisplayName("Should place the single set at zero")
    void testInitialThresholds_SingleSet() {
        Map<String, Threshold> thresholds =
                ThresholdCalculator.initialThresholds(Map.of("sample", 100L), 1000, 5e-5);
        Threshold t = thresholds.get("sample");
        assertEquals(0.0, t.low());
        assertEquals(0.061610234548191506, t.accept(), EPS);
        assertEquals(0.15549708991306982, t.waitlistCutoff(), EPS);
    }

    @Test
    @DisplayName("Should lay sets out back to back without overlap")
    void testInitialThresholds_Disjoint() {
        Map<String, Long> targets = new LinkedHashMap<>();
        targets.put("train", 600L);
        targets.put("valid", 150L);
        targets.put("test", 150L);
        Map<String, Threshold> thresholds = ThresholdCalculator.initialThresholds(targets, 100_000, 5e-5);

        Threshold train = thresholds.get("train");
        Threshold valid = thresholds.get("valid");
        Threshold test = thresholds.get("test");
        assertEquals(0.0, train.low());
        assertEquals(train.waitlistCutoff(), valid.low());
        assertEquals(valid.waitlistCutoff(), test.low());
        assertTrue(test.waitlistCutoff() <= 1.0);
    }

    @Test
    @DisplayName("Should clip the last set at one instead of failing")
    void testInitialThresholds_ClippedAtOne() {
        Map<String, Long> targets = new LinkedHashMap<>();
        targets.put("train", 545L);
        targets.put("test", 454L);
        Map<String, Threshold> thresholds = ThresholdCalculator.initialThresholds(targets, 1000, 5e-5);

        Threshold train = thresholds.get("train");
        Threshold test = thresholds.get("test");
        assertTrue(train.waitlistCutoff() < 1.0);
        assertEquals(train.waitlistCutoff(), test.low());
        assertEquals(1.0, test.accept());
        assertEquals(1.0, test.waitlistCutoff());
    }

    @Test
    @DisplayName("Should fail when a set would start beyond the key space")
    void testInitialThresholds_CapacityExceeded() {
        // each 25-of-100 set reserves about 0.59 of the key space, so 'c' starts past 1.0
        Map<String, Long> targets = new LinkedHashMap<>();
        targets.put("a", 25L);
        targets.put("b", 25L);
        targets.put("c", 25L);
        targets.put("d", 25L);
        CapacityExceededException ex = assertThrows(CapacityExceededException.class,
                () -> ThresholdCalculator.initialThresholds(targets, 100, 5e-5));
        assertTrue(ex.getRequiredWidth() >= 1.0);
        assertTrue(ex.getMessage().contains("'c'"));
    }
}
