package com.skilldeck.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Bound from {@code skilldeck.skills.*}.
 */
@ConfigurationProperties(prefix = "skilldeck.skills")
public class SkillCatalogProperties {

    // Skills shipped with the application (OFFICIAL).
    private Path bundledPath = Path.of("skills");

    // Skills the user added (CUSTOM). Created on the first import.
    private Path userPath = Path.of(System.getProperty("user.home"), ".skilldeck", "skills");

    private String definitionFileName = "SKILL.md";

    // Run the first reconciliation pass as soon as the context is up.
    private boolean syncOnStartup = true;

    public Path getBundledPath() {
        return bundledPath;
    }

    public void setBundledPath(Path bundledPath) {
        this.bundledPath = bundledPath;
    }

    public Path getUserPath() {
        return userPath;
    }

    public void setUserPath(Path userPath) {
        this.userPath = userPath;
    }

    public String getDefinitionFileName() {
        return definitionFileName;
    }

    public void setDefinitionFileName(String definitionFileName) {
        this.definitionFileName = definitionFileName;
    }

    public boolean isSyncOnStartup() {
        return syncOnStartup;
    }

    public void setSyncOnStartup(boolean syncOnStartup) {
        this.syncOnStartup = syncOnStartup;
    }
}
