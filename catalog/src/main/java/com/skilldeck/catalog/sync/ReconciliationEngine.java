package com.skilldeck.catalog.sync;

import com.skilldeck.catalog.model.SkillRecord;
import com.skilldeck.catalog.model.SourceKind;
import com.skilldeck.catalog.service.CatalogStore;
import com.skilldeck.catalog.skill.DiscoveryScanner;
import com.skilldeck.catalog.skill.MalformedDefinitionException;
import com.skilldeck.catalog.skill.SkillCandidate;
import com.skilldeck.catalog.skill.SkillDefinition;
import com.skilldeck.catalog.skill.SkillDefinitionParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * One reconciliation pass: discover → parse → diff → apply.
 *
 * <ol>
 *   <li>Scan the bundled root (OFFICIAL) then the user root (CUSTOM).</li>
 *   <li>Parse every candidate. A malformed file is logged, counted and
 *       skipped; it never aborts the pass.</li>
 *   <li>Key each parsed file by (sourceKind, identityKey). When two files share
 *       a key, the first in scan order wins and the rest count as conflicts.</li>
 *   <li>Diff against {@link CatalogStore#listAll()}:
 *       <pre>
 *         key only on disk      → insert, enabled = true
 *         key on disk and in DB → update definition fields (skipped if unchanged)
 *         key only in DB        → delete, official or not
 *       </pre></li>
 *   <li>Apply the whole diff with one {@link CatalogStore#applyBatch} call.</li>
 * </ol>
 *
 * Running it twice with no filesystem change in between writes nothing the
 * second time.
 *
 * The engine holds no state between passes; serialising passes is the
 * caller's job (see {@code CatalogManager}).
 */
@Component
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final DiscoveryScanner      scanner;
    private final SkillDefinitionParser parser;
    private final CatalogStore          store;
    private final MeterRegistry         meterRegistry;

    public ReconciliationEngine(DiscoveryScanner scanner,
                                SkillDefinitionParser parser,
                                CatalogStore store,
                                MeterRegistry meterRegistry) {
        this.scanner       = scanner;
        this.parser        = parser;
        this.store         = store;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run one pass over both roots.
     *
     * @throws com.skilldeck.catalog.service.PersistenceFailureException if the
     *         store cannot be read or the batch does not commit
     * @throws java.io.UncheckedIOException if a root exists but cannot be listed
     */
    public SyncResult run(Path bundledRoot, Path customRoot) {
        MDC.put("syncRun", UUID.randomUUID().toString().substring(0, 8));
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failure";
        try {
            log.info("Skill sync started: bundled={} custom={}", bundledRoot, customRoot);

            // ── 1-3: discover, parse, key ────────────────────────────────────
            Map<IdentityKey, Observed> observed = new LinkedHashMap<>();
            int malformed = 0;
            int conflicts = 0;
            try (Stream<SkillCandidate> candidates = Stream.concat(
                    scanner.scan(bundledRoot, SourceKind.OFFICIAL),
                    scanner.scan(customRoot, SourceKind.CUSTOM))) {
                for (SkillCandidate candidate : (Iterable<SkillCandidate>) candidates::iterator) {
                    SkillDefinition definition;
                    try {
                        definition = parser.parse(candidate.definitionFile());
                    } catch (MalformedDefinitionException e) {
                        malformed++;
                        log.warn("Skipping skill {}: {}", candidate.definitionFile(), e.getMessage());
                        continue;
                    }
                    IdentityKey key = IdentityKey.of(candidate);
                    Observed first = observed.putIfAbsent(key, new Observed(candidate, definition));
                    if (first != null) {
                        conflicts++;
                        log.warn("Skipping skill {}: identity key {} already taken by {}",
                                candidate.definitionFile(), key, first.candidate().definitionFile());
                    }
                }
            }

            // ── 4: index persisted state ─────────────────────────────────────
            List<SkillRecord> persisted = store.listAll();
            Map<IdentityKey, SkillRecord> persistedByKey = new HashMap<>();
            for (SkillRecord record : persisted) {
                persistedByKey.putIfAbsent(IdentityKey.of(record), record);
            }

            // ── 5: partition ─────────────────────────────────────────────────
            List<SkillRecord> inserts = new ArrayList<>();
            List<SkillRecord> updates = new ArrayList<>();
            List<UUID>        deletes = new ArrayList<>();
            int unchanged = 0;

            for (Map.Entry<IdentityKey, Observed> entry : observed.entrySet()) {
                SkillRecord existing = persistedByKey.remove(entry.getKey());
                Observed seen = entry.getValue();
                SkillRecord next = SkillMerge.merge(existing, seen.candidate(), seen.definition());
                if (existing == null) {
                    inserts.add(next);
                } else if (existing.sameMirrorAs(next)) {
                    unchanged++;
                } else {
                    updates.add(next);
                }
            }
            // Whatever is left in persistedByKey has no file on disk any more.
            for (SkillRecord stale : persistedByKey.values()) {
                log.info("Skill '{}' ({}) no longer on disk, removing it", stale.getName(), IdentityKey.of(stale));
                deletes.add(stale.getId());
            }

            // ── 6: apply ─────────────────────────────────────────────────────
            SyncBatch batch = new SyncBatch(inserts, updates, deletes);
            List<SkillRecord> catalog = batch.isEmpty() ? persisted : store.applyBatch(batch);

            SyncReport report = new SyncReport(
                    inserts.size(), updates.size(), unchanged, deletes.size(), malformed, conflicts);
            recordMetrics(report);
            outcome = "success";
            log.info("Skill sync finished: {} skills (inserted={}, updated={}, unchanged={}, deleted={}, malformed={}, conflicts={})",
                    catalog.size(), report.inserted(), report.updated(), report.unchanged(),
                    report.deleted(), report.malformed(), report.conflicts());
            return new SyncResult(catalog, report);
        } finally {
            sample.stop(meterRegistry.timer("skilldeck.sync.duration", "outcome", outcome));
            MDC.remove("syncRun");
        }
    }

    private void recordMetrics(SyncReport report) {
        count("inserted",  report.inserted());
        count("updated",   report.updated());
        count("unchanged", report.unchanged());
        count("deleted",   report.deleted());
        count("malformed", report.malformed());
        count("conflict",  report.conflicts());
    }

    private void count(String result, int amount) {
        if (amount > 0) {
            meterRegistry.counter("skilldeck.sync.candidates", "result", result).increment(amount);
        }
    }

    private record Observed(SkillCandidate candidate, SkillDefinition definition) {}
}
