package com.skilldeck.catalog.skill;

/**
 * One parsed SKILL.md file, not yet persisted.
 *
 * @param name        Display name; never blank (falls back to the directory name).
 * @param description One-line summary, empty when the header has none.
 * @param command     Slash command that invokes the skill, or null.
 * @param verified    Whether the header marks the skill as verified.
 * @param hidden      Whether the skill should be left out of enabled listings.
 * @param bodyText    Everything after the front matter, stripped.
 */
public record SkillDefinition(
        String  name,
        String  description,
        String  command,
        boolean verified,
        boolean hidden,
        String  bodyText) {}
