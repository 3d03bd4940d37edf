package com.skilldeck.catalog.sync;

import com.skilldeck.catalog.model.SkillRecord;

import java.util.List;

/**
 * Outcome of a successful reconciliation pass.
 *
 * @param catalog Every row in the store after the batch committed (detached).
 * @param report  What the pass did.
 */
public record SyncResult(List<SkillRecord> catalog, SyncReport report) {

    public SyncResult {
        catalog = List.copyOf(catalog);
    }
}
