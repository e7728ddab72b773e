package com.atelier.sync.core.remote;

/**
 * Outcome of writing one project to the remote store.
 *
 * @param syncVersion version stamped on the remote project record
 * @param itemsWritten lineage and wardrobe items written
 * @param itemsSkipped malformed items left out of the write
 */
public record PushResult(long syncVersion, int itemsWritten, int itemsSkipped) {}
