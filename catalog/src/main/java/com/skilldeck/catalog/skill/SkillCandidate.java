package com.skilldeck.catalog.skill;

import com.skilldeck.catalog.model.SourceKind;

import java.nio.file.Path;
import java.util.Locale;

/**
 * A definition file found on disk, before parsing.
 *
 * @param definitionFile Absolute path of the SKILL.md file.
 * @param sourceKind     Which root it was found under.
 * @param relativeKey    Name of the subdirectory holding it, as found on disk.
 */
public record SkillCandidate(Path definitionFile, SourceKind sourceKind, String relativeKey) {

    /**
     * Key that matches this file to its catalog row across syncs.
     * Lower-cased so the match survives case-insensitive filesystems.
     */
    public String identityKey() {
        return identityKeyOf(relativeKey);
    }

    public static String identityKeyOf(String relativeKey) {
        return relativeKey.toLowerCase(Locale.ROOT);
    }
}
