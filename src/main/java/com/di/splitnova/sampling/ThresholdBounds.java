package com.di.splitnova.sampling;

/**
 * Raw acceptance ({@code qLow}) and waitlist ({@code qHigh}) quantiles for a single sampling ratio,
 * before any offset is applied.
 */
public record ThresholdBounds(double qLow, double qHigh) {
}
