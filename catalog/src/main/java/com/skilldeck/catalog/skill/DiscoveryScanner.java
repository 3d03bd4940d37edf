package com.skilldeck.catalog.skill;

import com.skilldeck.catalog.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds skill definition files under one root directory.
 *
 * Layout:
 * <pre>
 *   root/
 *     code-review/SKILL.md     → candidate, relativeKey "code-review"
 *     pdf-tools/SKILL.md       → candidate, relativeKey "pdf-tools"
 *     shared-assets/logo.png   → skipped (no SKILL.md)
 * </pre>
 *
 * Only immediate subdirectories are looked at. A root that does not exist
 * yields nothing; that is the normal state before the user adds a skill.
 */
public class DiscoveryScanner {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryScanner.class);

    private final String definitionFileName;

    public DiscoveryScanner(String definitionFileName) {
        this.definitionFileName = definitionFileName;
    }

    /**
     * Candidates under {@code root}, in subdirectory-name order.
     *
     * The directory listing is read up front; the per-directory file checks
     * run as the stream is consumed.
     *
     * @throws UncheckedIOException if the root exists but cannot be listed
     */
    public Stream<SkillCandidate> scan(Path root, SourceKind sourceKind) {
        if (root == null || !Files.exists(root)) {
            log.debug("{} skills root {} does not exist, nothing to discover", sourceKind, root);
            return Stream.empty();
        }
        if (!Files.isDirectory(root)) {
            log.warn("{} skills root {} is not a directory, ignoring it", sourceKind, root);
            return Stream.empty();
        }

        Path absoluteRoot = root.toAbsolutePath().normalize();
        List<Path> subdirectories;
        try (Stream<Path> entries = Files.list(absoluteRoot)) {
            subdirectories = entries
                    .filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + sourceKind + " skills root " + absoluteRoot, e);
        }

        return subdirectories.stream()
                .map(dir -> new SkillCandidate(
                        dir.resolve(definitionFileName), sourceKind, dir.getFileName().toString()))
                .filter(candidate -> Files.isRegularFile(candidate.definitionFile()));
    }
}
