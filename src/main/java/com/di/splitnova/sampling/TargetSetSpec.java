package com.di.splitnova.sampling;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A named subset to draw from the population.
 *
 * @param name unique set name; also used as the output directory name
 * @param size a ratio in {@code (0, 1)} or an absolute record count {@code >= 1}
 */
public record TargetSetSpec(String name, double size) implements Serializable {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    public TargetSetSpec {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Target set name cannot be null or empty");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidConfigurationException(
                    "Target set name '" + name + "' must match " + NAME_PATTERN.pattern());
        }
        if (Double.isNaN(size) || Double.isInfinite(size) || size <= 0.0) {
            throw new InvalidConfigurationException(
                    "Target set '" + name + "' has invalid size " + size + "; expected a ratio in (0,1) or a count >= 1");
        }
    }

    /** {@code true} when {@link #size()} is a fraction of the population rather than a count. */
    public boolean isRatio() {
        return size < 1.0;
    }

    /**
     * Ordered set sizes for the common train/test split. Both sets are drawn from disjoint key
     * intervals, so a record can never land in both.
     */
    public static Map<String, Double> trainTest(double trainSize, double testSize) {
        Map<String, Double> sizes = new LinkedHashMap<>();
        sizes.put("train", trainSize);
        sizes.put("test", testSize);
        return sizes;
    }
}
