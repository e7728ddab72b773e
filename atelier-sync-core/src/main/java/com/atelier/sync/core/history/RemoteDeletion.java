package com.atelier.sync.core.history;

import com.atelier.sync.spi.LineagePartition;

/** A lineage item that must be deleted from one remote partition. */
public record RemoteDeletion(LineagePartition partition, String itemId) {}
