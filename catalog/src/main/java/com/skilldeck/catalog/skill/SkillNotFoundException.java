package com.skilldeck.catalog.skill;

import java.util.UUID;

public class SkillNotFoundException extends RuntimeException {

    private final UUID id;

    public SkillNotFoundException(UUID id) {
        super("No skill in the catalog with id: '" + id + "'");
        this.id = id;
    }

    public UUID getId() { return id; }
}
