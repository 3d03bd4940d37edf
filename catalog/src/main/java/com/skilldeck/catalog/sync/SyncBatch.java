package com.skilldeck.catalog.sync;

import com.skilldeck.catalog.model.SkillRecord;

import java.util.List;
import java.util.UUID;

/**
 * Everything one reconciliation pass wants to write, applied in a single
 * transaction by {@code CatalogStore.applyBatch}.
 *
 * @param inserts New records (no id yet).
 * @param updates Records whose definition mirror changed; matched to rows by id.
 * @param deletes Ids of rows whose file is gone.
 */
public record SyncBatch(List<SkillRecord> inserts, List<SkillRecord> updates, List<UUID> deletes) {

    public SyncBatch {
        inserts = List.copyOf(inserts);
        updates = List.copyOf(updates);
        deletes = List.copyOf(deletes);
    }

    public boolean isEmpty() {
        return inserts.isEmpty() && updates.isEmpty() && deletes.isEmpty();
    }
}
