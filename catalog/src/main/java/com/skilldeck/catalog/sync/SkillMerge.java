package com.skilldeck.catalog.sync;

import com.skilldeck.catalog.model.SkillRecord;
import com.skilldeck.catalog.skill.SkillCandidate;
import com.skilldeck.catalog.skill.SkillDefinition;

/**
 * The one place where a freshly parsed definition is folded into catalog state.
 *
 * <ul>
 *   <li>No existing row: a new record, enabled, with no id yet.</li>
 *   <li>Existing row: a copy of it with the definition mirror replaced.
 *       id, sourceKind, identityKey and the enabled flag come from the
 *       existing row, whatever the file says.</li>
 * </ul>
 *
 * Neither input is modified.
 */
public final class SkillMerge {

    private SkillMerge() {}

    public static SkillRecord merge(SkillRecord existing, SkillCandidate candidate, SkillDefinition definition) {
        SkillRecord observed = new SkillRecord(candidate.sourceKind(), candidate.identityKey());
        observed.setName(definition.name());
        observed.setDescription(definition.description());
        observed.setCommand(definition.command());
        observed.setVerified(definition.verified());
        observed.setHidden(definition.hidden());
        observed.setBodyText(definition.bodyText());
        observed.setFilePath(candidate.definitionFile().toAbsolutePath().normalize().toString());

        if (existing == null) {
            observed.setEnabled(true);
            return observed;
        }

        SkillRecord next = existing.copy();
        next.mirror(observed);
        return next;
    }
}
