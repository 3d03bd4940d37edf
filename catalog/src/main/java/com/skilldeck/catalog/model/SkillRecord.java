package com.skilldeck.catalog.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One skill in the persisted catalog.
 *
 * A row is matched to its definition file across syncs by
 * (sourceKind, identityKey), never by id or name. The id is assigned once
 * on first insert and never changes afterwards.
 *
 * Fields split into two groups:
 *   - identity + user state: id, sourceKind, identityKey, enabled
 *   - mirror of the last parsed definition: everything else
 * Only {@link #mirror(SkillRecord)} writes the second group on an existing row,
 * so a resync can never touch the first.
 *
 * DB table: skills  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "skills",
       uniqueConstraints = @UniqueConstraint(
               name = "uq_skills_source_identity",
               columnNames = {"source_kind", "identity_key"}))
public class SkillRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_kind", nullable = false, updatable = false)
    private SourceKind sourceKind;

    @Column(name = "identity_key", nullable = false, updatable = false)
    private String identityKey;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description = "";

    // Null when the definition declares no command.
    @Column(columnDefinition = "TEXT")
    private String command;

    @Column(nullable = false)
    private boolean verified = false;

    @Column(nullable = false)
    private boolean hidden = false;

    @Column(name = "body_text", nullable = false, columnDefinition = "TEXT")
    private String bodyText = "";

    // User-controlled. Defaults to true on insert; only a toggle changes it.
    @Column(name = "is_enabled", nullable = false)
    private boolean enabled = true;

    @Column(name = "file_path", nullable = false, columnDefinition = "TEXT")
    private String filePath;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Hibernate only flushes dirty entities, so this fires on real changes only.
    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected SkillRecord() {}   // required by JPA

    public SkillRecord(SourceKind sourceKind, String identityKey) {
        this.sourceKind  = Objects.requireNonNull(sourceKind, "sourceKind");
        this.identityKey = Objects.requireNonNull(identityKey, "identityKey");
    }

    /**
     * Detached copy carrying the same id and state. Used by the merge step so
     * the persisted snapshot it was handed is never mutated.
     */
    public SkillRecord copy() {
        SkillRecord c = new SkillRecord(sourceKind, identityKey);
        c.id        = id;
        c.enabled   = enabled;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.mirror(this);
        return c;
    }

    /**
     * Overwrite the definition mirror with the values of {@code source}.
     * id, sourceKind, identityKey and enabled are not touched.
     */
    public void mirror(SkillRecord source) {
        this.name        = source.name;
        this.description = source.description;
        this.command     = source.command;
        this.verified    = source.verified;
        this.hidden      = source.hidden;
        this.bodyText    = source.bodyText;
        this.filePath    = source.filePath;
    }

    /** True when the definition mirror of both records holds the same values. */
    public boolean sameMirrorAs(SkillRecord other) {
        return Objects.equals(name, other.name)
            && Objects.equals(description, other.description)
            && Objects.equals(command, other.command)
            && verified == other.verified
            && hidden == other.hidden
            && Objects.equals(bodyText, other.bodyText)
            && Objects.equals(filePath, other.filePath);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()          { return id; }
    public SourceKind getSourceKind()  { return sourceKind; }
    public String     getIdentityKey() { return identityKey; }
    public String     getName()        { return name; }
    public String     getDescription() { return description; }
    public String     getCommand()     { return command; }
    public boolean    isVerified()     { return verified; }
    public boolean    isHidden()       { return hidden; }
    public String     getBodyText()    { return bodyText; }
    public boolean    isEnabled()      { return enabled; }
    public String     getFilePath()    { return filePath; }
    public Instant    getCreatedAt()   { return createdAt; }
    public Instant    getUpdatedAt()   { return updatedAt; }

    public void setName(String name)               { this.name = name; }
    public void setDescription(String description) { this.description = description; }
    public void setCommand(String command)         { this.command = command; }
    public void setVerified(boolean verified)      { this.verified = verified; }
    public void setHidden(boolean hidden)          { this.hidden = hidden; }
    public void setBodyText(String bodyText)       { this.bodyText = bodyText; }
    public void setEnabled(boolean enabled)        { this.enabled = enabled; }
    public void setFilePath(String filePath)       { this.filePath = filePath; }

    @Override
    public String toString() {
        return "SkillRecord{id=" + id + ", " + sourceKind + "/" + identityKey
                + ", name='" + name + "', enabled=" + enabled + "}";
    }
}
