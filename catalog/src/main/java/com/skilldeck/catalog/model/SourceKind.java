package com.skilldeck.catalog.model;

/**
 * Where a skill definition was discovered.
 *
 * OFFICIAL skills ship with the application and are read-only to the user;
 * CUSTOM skills live in the user-writable root and may be deleted.
 */
public enum SourceKind {
    OFFICIAL,
    CUSTOM
}
