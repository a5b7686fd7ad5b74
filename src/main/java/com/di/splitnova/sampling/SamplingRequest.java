package com.di.splitnova.sampling;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Clock;
import java.util.Map;

/**
 * Parameters of one sampling run.
 * <ul>
 *   <li>{@code setSizes} – set name to ratio-or-count, in output order.</li>
 *   <li>{@code count} – population size; when {@code null} the sampler counts the input once.</li>
 *   <li>{@code delta} – error bound, default {@value ThresholdCalculator#DEFAULT_DELTA}.</li>
 *   <li>{@code seed} – when {@code null} a wall-clock seed is chosen and reported back.</li>
 *   <li>{@code reproportion} – scale sizes down instead of failing when oversubscribed.</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class SamplingRequest {

    @Singular
    Map<String, Double> setSizes;

    Long count;

    @Builder.Default
    double delta = ThresholdCalculator.DEFAULT_DELTA;

    Long seed;

    boolean reproportion;

    /** The configured seed, or the current epoch second of {@code clock} when none was given. */
    public long resolveSeed(Clock clock) {
        return seed != null ? seed : clock.instant().getEpochSecond();
    }
}
