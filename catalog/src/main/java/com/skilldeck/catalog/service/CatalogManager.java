package com.skilldeck.catalog.service;

import com.skilldeck.catalog.model.Skill;
import com.skilldeck.catalog.model.SkillRecord;
import com.skilldeck.catalog.model.SourceKind;
import com.skilldeck.catalog.skill.MalformedDefinitionException;
import com.skilldeck.catalog.skill.SkillCandidate;
import com.skilldeck.catalog.skill.SkillDefinition;
import com.skilldeck.catalog.skill.SkillDefinitionParser;
import com.skilldeck.catalog.skill.SkillNotFoundException;
import com.skilldeck.catalog.sync.ReconciliationEngine;
import com.skilldeck.catalog.sync.SkillMerge;
import com.skilldeck.catalog.sync.SyncReport;
import com.skilldeck.catalog.sync.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Public façade of the skill catalog.
 *
 * Holds an in-memory index of the catalog and keeps it in step with the
 * store after every mutation.
 *
 * <p>Every mutating call ({@link #initialize}, {@link #resync},
 * {@link #setSkillEnabled}, {@link #addSkill}, {@link #deleteSkill}) is queued
 * on this manager's own single worker thread and returns a
 * {@link CompletableFuture}. Operations therefore run one at a time, in
 * submission order, and a resync submitted after an add sees the added skill.
 * Operations cannot be cancelled once queued.
 *
 * <p>Reads ({@link #getAllSkills}, {@link #getSkillById}, …) do no I/O and
 * never block: the index is an immutable map swapped atomically by the
 * worker thread.
 *
 * <p>A failed pass leaves the index at its previous value and marks the
 * catalog not ready until a later pass succeeds.
 */
public class CatalogManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CatalogManager.class);

    private static final Comparator<Skill> BY_NAME =
            Comparator.comparing((Skill s) -> s.name().toLowerCase(Locale.ROOT))
                    .thenComparing(s -> s.id().toString());

    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final ReconciliationEngine  engine;
    private final CatalogStore          store;
    private final SkillDefinitionParser parser;
    private final Path                  bundledRoot;
    private final Path                  userRoot;
    private final String                definitionFileName;

    private final ExecutorService queue;

    // Written only by the queue thread.
    private volatile Map<UUID, Skill> index = Map.of();
    private volatile boolean          ready = false;
    private volatile String           lastFailure;

    public CatalogManager(ReconciliationEngine engine,
                          CatalogStore store,
                          SkillDefinitionParser parser,
                          Path bundledRoot,
                          Path userRoot,
                          String definitionFileName) {
        this.engine             = engine;
        this.store              = store;
        this.parser             = parser;
        this.bundledRoot        = bundledRoot.toAbsolutePath().normalize();
        this.userRoot           = userRoot.toAbsolutePath().normalize();
        this.definitionFileName = definitionFileName;

        String threadName = "skill-catalog-" + INSTANCES.incrementAndGet();
        this.queue = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    // ------------------------------------------------------------------
    // Sync
    // ------------------------------------------------------------------

    /** First sync. Calling it again is the same as {@link #resync()}. */
    public CompletableFuture<SyncReport> initialize() {
        return resync();
    }

    /**
     * Re-run reconciliation and refresh the index. Enabled flags survive for
     * every skill whose file is still on disk.
     *
     * The future fails with {@link PersistenceFailureException} when the
     * store cannot be read or written; the index is then left untouched.
     */
    public CompletableFuture<SyncReport> resync() {
        return submit(() -> {
            SyncResult result;
            try {
                result = engine.run(bundledRoot, userRoot);
            } catch (RuntimeException e) {
                ready       = false;
                lastFailure = e.getMessage();
                log.error("Skill sync failed, catalog keeps its previous {} entries: {}",
                        index.size(), e.getMessage());
                throw e;
            }
            replaceIndex(result.catalog());
            ready       = true;
            lastFailure = null;
            return result.report();
        });
    }

    // ------------------------------------------------------------------
    // Reads (no I/O)
    // ------------------------------------------------------------------

    /** Snapshot of the whole catalog, ordered by name. */
    public List<Skill> getAllSkills() {
        return index.values().stream().sorted(BY_NAME).toList();
    }

    /** Enabled skills that are not hidden, ordered by name. */
    public List<Skill> getEnabledSkills() {
        return index.values().stream()
                .filter(Skill::enabled)
                .filter(s -> !s.hidden())
                .sorted(BY_NAME)
                .toList();
    }

    public Optional<Skill> getSkillById(UUID id) {
        return Optional.ofNullable(index.get(id));
    }

    /** Body text of the skill's definition, as of the last sync. */
    public Optional<String> getSkillContent(UUID id) {
        return getSkillById(id).map(Skill::bodyText);
    }

    /** False before the first successful sync and after a failed one. */
    public boolean isReady() {
        return ready;
    }

    public Optional<String> getLastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    public Path getUserSkillsPath() {
        return userRoot;
    }

    // ------------------------------------------------------------------
    // Mutations (queued)
    // ------------------------------------------------------------------

    /**
     * Persist a new enabled flag for one skill.
     *
     * The future fails with {@link SkillNotFoundException} for an unknown id.
     */
    public CompletableFuture<Skill> setSkillEnabled(UUID id, boolean enabled) {
        return submit(() -> {
            if (!index.containsKey(id)) {
                throw new SkillNotFoundException(id);
            }
            Skill updated = Skill.from(store.setEnabled(id, enabled));
            put(updated);
            log.info("Skill '{}' {}", updated.name(), enabled ? "enabled" : "disabled");
            return updated;
        });
    }

    /**
     * Import a SKILL.md from outside the managed roots as a custom skill.
     *
     * The file is copied to {@code <userRoot>/<slug-of-name>/SKILL.md} (with a
     * numeric suffix when that directory is taken) and inserted enabled.
     *
     * The future fails with {@link MalformedDefinitionException} if the file
     * does not parse; nothing is copied in that case.
     */
    public CompletableFuture<Skill> addSkill(Path sourceFile) {
        return submit(() -> {
            Path source = sourceFile.toAbsolutePath().normalize();
            SkillDefinition definition = parser.parse(source);

            String directoryName = allocateDirectory(definition.name());
            Path targetDir = userRoot.resolve(directoryName);
            Path target    = targetDir.resolve(definitionFileName);
            try {
                Files.createDirectories(targetDir);
                Files.copy(source, target);
            } catch (IOException e) {
                removeDirectory(targetDir);
                throw new UncheckedIOException("Could not copy " + source + " to " + target, e);
            }

            SkillCandidate candidate = new SkillCandidate(target, SourceKind.CUSTOM, directoryName);
            SkillRecord saved;
            try {
                // Re-read from the copy so fallbacks resolve against the new directory, as a resync would.
                SkillDefinition copied = parser.parse(target);
                saved = store.insert(SkillMerge.merge(null, candidate, copied));
            } catch (RuntimeException e) {
                removeDirectory(targetDir);
                throw e;
            }

            Skill added = Skill.from(saved);
            put(added);
            log.info("Added custom skill '{}' from {} as {}", added.name(), source, target);
            return added;
        });
    }

    /**
     * Delete a custom skill: its row, its directory, and its index entry.
     *
     * Completes with {@code false} (and changes nothing) when the skill is
     * official or the id is unknown.
     */
    public CompletableFuture<Boolean> deleteSkill(UUID id) {
        return submit(() -> {
            Skill skill = index.get(id);
            if (skill == null) {
                log.warn("Cannot delete skill {}: not in the catalog", id);
                return false;
            }
            if (skill.isOfficial()) {
                log.warn("Refusing to delete official skill '{}' ({})", skill.name(), id);
                return false;
            }

            if (!store.delete(id)) {
                log.warn("Row for skill '{}' ({}) was already gone, removing its files anyway", skill.name(), id);
            }
            removeBackingFiles(Path.of(skill.filePath()));
            remove(id);
            log.info("Deleted custom skill '{}' ({})", skill.name(), id);
            return true;
        });
    }

    /** Stop accepting work; waits briefly for the queued operation to finish. */
    @Override
    public void close() {
        queue.shutdown();
        try {
            if (!queue.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Skill catalog queue did not drain within 10 s, abandoning pending operations");
                queue.shutdownNow();
            }
        } catch (InterruptedException e) {
            queue.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> CompletableFuture<T> submit(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, queue);
    }

    private void replaceIndex(List<SkillRecord> catalog) {
        Map<UUID, Skill> next = new LinkedHashMap<>();
        for (SkillRecord record : catalog) {
            next.put(record.getId(), Skill.from(record));
        }
        index = Map.copyOf(next);
    }

    private void put(Skill skill) {
        Map<UUID, Skill> next = new LinkedHashMap<>(index);
        next.put(skill.id(), skill);
        index = Map.copyOf(next);
    }

    private void remove(UUID id) {
        Map<UUID, Skill> next = new LinkedHashMap<>(index);
        next.remove(id);
        index = Map.copyOf(next);
    }

    /**
     * Lower-case slug of the skill name, suffixed -2, -3, … until neither a
     * directory nor a custom row uses it.
     */
    private String allocateDirectory(String skillName) {
        String base = skillName.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (base.isEmpty()) {
            base = "skill";
        }
        String candidate = base;
        int suffix = 2;
        while (Files.exists(userRoot.resolve(candidate))
                || store.exists(SourceKind.CUSTOM, SkillCandidate.identityKeyOf(candidate))) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    /**
     * A custom skill owns its whole directory when that directory sits directly
     * under the user root; otherwise only the definition file is removed.
     */
    private void removeBackingFiles(Path definitionFile) {
        Path dir = definitionFile.getParent();
        if (dir != null && userRoot.equals(dir.getParent())) {
            removeDirectory(dir);
            return;
        }
        try {
            Files.deleteIfExists(definitionFile);
        } catch (IOException e) {
            log.warn("Could not delete {}, remove it by hand or it will come back on the next sync: {}",
                    definitionFile, e.getMessage());
        }
    }

    private void removeDirectory(Path dir) {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Could not delete {}, remove it by hand: {}", dir, e.getMessage());
        }
    }
}
