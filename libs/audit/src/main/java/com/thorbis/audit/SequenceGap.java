package com.thorbis.audit;

/**
 * A run of missing sequence numbers, both bounds inclusive.
 */
public record SequenceGap(long fromSequence, long toSequence) {}
