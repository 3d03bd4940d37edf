package com.skilldeck.catalog.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable view of one catalog entry, as handed out by {@code CatalogManager}.
 * Callers never see the JPA entity.
 */
public record Skill(
        UUID       id,
        SourceKind source,
        String     identityKey,
        String     name,
        String     description,
        String     command,
        boolean    verified,
        boolean    hidden,
        boolean    enabled,
        String     bodyText,
        String     filePath,
        Instant    updatedAt
) {
    public static Skill from(SkillRecord record) {
        return new Skill(
                record.getId(),
                record.getSourceKind(),
                record.getIdentityKey(),
                record.getName(),
                record.getDescription(),
                record.getCommand(),
                record.isVerified(),
                record.isHidden(),
                record.isEnabled(),
                record.getBodyText(),
                record.getFilePath(),
                record.getUpdatedAt()
        );
    }

    public boolean isOfficial() {
        return source == SourceKind.OFFICIAL;
    }
}
