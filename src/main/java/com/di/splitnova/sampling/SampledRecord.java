package com.di.splitnova.sampling;

/**
 * A record labelled with the target set it was drawn into.
 */
public record SampledRecord<T>(String setName, T record) {
}
