package com.skilldeck.catalog.sync;

/**
 * Counts from one reconciliation pass.
 *
 * @param inserted  Rows created for newly discovered files.
 * @param updated   Matched rows whose definition changed.
 * @param unchanged Matched rows that were already up to date.
 * @param deleted   Rows removed because their file disappeared.
 * @param malformed Candidate files skipped because they did not parse.
 * @param conflicts Candidate files skipped because an earlier file had the same identity key.
 */
public record SyncReport(
        int inserted,
        int updated,
        int unchanged,
        int deleted,
        int malformed,
        int conflicts) {

    /** Number of skills in the catalog after the pass. */
    public int total() {
        return inserted + updated + unchanged;
    }
}
