package com.skilldeck.catalog.skill;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses one SKILL.md file: a YAML front-matter header between two
 * {@code ---} lines, followed by free-form Markdown.
 *
 * <pre>
 *   ---
 *   name: Code Review
 *   description: Reviews the current diff
 *   command: /review
 *   verified: true
 *   ---
 *   Body text handed to the assistant when the skill is used.
 * </pre>
 *
 * A file without a header is accepted; every field then takes its fallback.
 * A header that is opened but never closed, is not valid YAML, or is not a
 * mapping makes the whole file malformed.
 */
@Component
public class SkillDefinitionParser {

    // Opening fence, optional header lines, closing fence, then the body.
    private static final Pattern FRONT_MATTER = Pattern.compile(
            "\\A---[ \\t]*\\r?\\n(?:(.*?)\\r?\\n)?---[ \\t]*(?:\\r?\\n|\\z)(.*)\\z",
            Pattern.DOTALL
    );

    private static final char BOM = '\uFEFF';

    private final ObjectMapper yaml = new YAMLMapper();

    /**
     * Read and parse the definition at {@code file}.
     *
     * @throws MalformedDefinitionException if the file is unreadable, empty,
     *         or carries a broken header
     */
    public SkillDefinition parse(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedDefinitionException(file, "cannot be read (" + e.getMessage() + ")", e);
        }
        if (!content.isEmpty() && content.charAt(0) == BOM) {
            content = content.substring(1);
        }
        if (content.isBlank()) {
            throw new MalformedDefinitionException(file, "file is empty");
        }

        JsonNode header = yaml.createObjectNode();
        String body = content;
        if (content.startsWith("---")) {
            Matcher m = FRONT_MATTER.matcher(content);
            if (!m.matches()) {
                throw new MalformedDefinitionException(file, "front matter is not closed");
            }
            header = readHeader(file, m.group(1));
            body   = m.group(2);
        }

        String name = text(header, "name");
        if (name == null || name.isEmpty()) {
            name = fallbackName(file);
        }
        String description = text(header, "description");
        String command     = text(header, "command");

        return new SkillDefinition(
                name,
                description == null ? "" : description,
                command == null || command.isEmpty() ? null : command,
                header.path("verified").asBoolean(false),
                header.path("hidden").asBoolean(false),
                body.strip()
        );
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JsonNode readHeader(Path file, String raw) {
        if (raw == null || raw.isBlank()) {
            return yaml.createObjectNode();
        }
        JsonNode node;
        try {
            node = yaml.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedDefinitionException(file,
                    "front matter is not valid YAML (" + e.getOriginalMessage() + ")", e);
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            return yaml.createObjectNode();
        }
        if (!node.isObject()) {
            throw new MalformedDefinitionException(file, "front matter is not a key/value mapping");
        }
        return node;
    }

    /** Scalar value of {@code key}, stripped; null when absent or not a scalar. */
    private static String text(JsonNode header, String key) {
        JsonNode node = header.get(key);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText().strip();
    }

    private static String fallbackName(Path file) {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null && dir.getFileName() != null) {
            return dir.getFileName().toString();
        }
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
