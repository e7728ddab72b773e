package com.atelier.sync.core.merge;

import java.time.Instant;

/**
 * Diagnostic record of one disagreement between a local and a remote snapshot. For collection fields the values
 * are the ids present on only one side.
 */
public record MergeConflict(String field, Object localValue, Object remoteValue, Instant detectedAt) {}
