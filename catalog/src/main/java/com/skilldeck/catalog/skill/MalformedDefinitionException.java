package com.skilldeck.catalog.skill;

import java.nio.file.Path;

/**
 * Thrown when a single definition file cannot be read or its header is not
 * well-formed. Sync passes skip the file and carry on; only
 * {@code addSkill} surfaces it to the caller.
 */
public class MalformedDefinitionException extends RuntimeException {

    private final transient Path path;

    public MalformedDefinitionException(Path path, String reason) {
        super("Malformed skill definition " + path + ": " + reason);
        this.path = path;
    }

    public MalformedDefinitionException(Path path, String reason, Throwable cause) {
        super("Malformed skill definition " + path + ": " + reason, cause);
        this.path = path;
    }

    public Path getPath() { return path; }
}
