package com.skilldeck.catalog.sync;

import com.skilldeck.catalog.model.SkillRecord;
import com.skilldeck.catalog.model.SourceKind;
import com.skilldeck.catalog.skill.SkillCandidate;

/**
 * (sourceKind, identityKey) pair: matches a file on disk to its catalog row.
 * An official and a custom skill in same-named directories are different keys.
 */
public record IdentityKey(SourceKind sourceKind, String key) {

    public static IdentityKey of(SkillCandidate candidate) {
        return new IdentityKey(candidate.sourceKind(), candidate.identityKey());
    }

    public static IdentityKey of(SkillRecord record) {
        return new IdentityKey(record.getSourceKind(), record.getIdentityKey());
    }

    @Override
    public String toString() {
        return sourceKind.name().toLowerCase() + ":" + key;
    }
}
