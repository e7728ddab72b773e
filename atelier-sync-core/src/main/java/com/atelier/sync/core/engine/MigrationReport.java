package com.atelier.sync.core.engine;

/**
 * Counts from pushing local-only projects to the remote store.
 *
 * @param total local projects examined
 * @param migrated projects pushed
 * @param skipped projects already remote or owned by another identity
 * @param errors projects whose push failed
 */
public record MigrationReport(int total, int migrated, int skipped, int errors) {}
