package com.atelier.sync.core.merge;

public enum MergeStrategy {
    /** Keep the local snapshot; only monotonic counters are taken from remote. */
    PREFER_LOCAL,
    /** Keep the remote snapshot; only monotonic counters are taken from local. */
    PREFER_REMOTE,
    /** Newer scalars win; collections are unioned by id with newer-wins on collision. */
    SMART
}
