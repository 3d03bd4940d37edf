package com.skilldeck.catalog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes SKILL.md files for tests.
 */
public final class SkillFixtures {

    private SkillFixtures() {}

    /** root/dirName/SKILL.md with a front-matter header built from the arguments (null = omitted). */
    public static Path writeSkill(Path root, String dirName, String name, String description, String command) {
        StringBuilder sb = new StringBuilder("---\n");
        if (name != null)        sb.append("name: ").append(name).append('\n');
        if (description != null) sb.append("description: ").append(description).append('\n');
        if (command != null)     sb.append("command: ").append(command).append('\n');
        sb.append("---\n\n");
        sb.append("This is the skill content for ").append(name != null ? name : dirName).append(".\n");
        return writeRaw(root, dirName, sb.toString());
    }

    /** root/dirName/SKILL.md with exactly {@code content}. */
    public static Path writeRaw(Path root, String dirName, String content) {
        try {
            Path dir = Files.createDirectories(root.resolve(dirName));
            Path file = dir.resolve("SKILL.md");
            Files.writeString(file, content);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** A header whose YAML does not parse. */
    public static String malformed() {
        return """
                ---
                name: [unclosed
                description: broken
                ---
                body
                """;
    }
}
