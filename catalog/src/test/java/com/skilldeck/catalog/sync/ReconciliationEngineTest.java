package com.skilldeck.catalog.sync;

import com.skilldeck.catalog.model.SkillRecord;
import com.skilldeck.catalog.model.SourceKind;
import com.skilldeck.catalog.service.CatalogStore;
import com.skilldeck.catalog.service.PersistenceFailureException;
import com.skilldeck.catalog.skill.DiscoveryScanner;
import com.skilldeck.catalog.skill.SkillCandidate;
import com.skilldeck.catalog.skill.SkillDefinitionParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static com.skilldeck.catalog.SkillFixtures.malformed;
import static com.skilldeck.catalog.SkillFixtures.writeRaw;
import static com.skilldeck.catalog.SkillFixtures.writeSkill;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReconciliationEngine.
 *
 * Real files and a real parser; the store is a Mockito mock so each test
 * controls the "persisted" side of the diff and inspects the batch.
 */
@ExtendWith(MockitoExtension.class)
class ReconciliationEngineTest {

    @TempDir Path tmp;
    @Mock CatalogStore store;

    Path bundled;
    Path custom;
    SimpleMeterRegistry meters;
    ReconciliationEngine engine;

    @BeforeEach
    void setUp() {
        bundled = tmp.resolve("bundled-skills");
        custom  = tmp.resolve("user-skills");
        meters  = new SimpleMeterRegistry();
        engine  = new ReconciliationEngine(
                new DiscoveryScanner("SKILL.md"), new SkillDefinitionParser(), store, meters);
    }

    // ------------------------------------------------------------------
    // Inserts
    // ------------------------------------------------------------------

    @Test
    void run_firstSync_insertsEveryDefinitionEnabled() {
        writeSkill(bundled, "test-skill-1", "Test Skill One", "First test skill", "/test1");
        writeSkill(custom, "custom-skill", "Custom Skill", "A user-added custom skill", null);
        when(store.listAll()).thenReturn(List.of());
        when(store.applyBatch(any())).thenAnswer(inv -> ((SyncBatch) inv.getArgument(0)).inserts());

        SyncResult result = engine.run(bundled, custom);

        SyncBatch batch = capturedBatch();
        assertThat(batch.inserts()).hasSize(2);
        assertThat(batch.updates()).isEmpty();
        assertThat(batch.deletes()).isEmpty();
        assertThat(batch.inserts()).allSatisfy(r -> assertThat(r.isEnabled()).isTrue());

        SkillRecord official = byName(batch.inserts(), "Test Skill One");
        assertThat(official.getSourceKind()).isEqualTo(SourceKind.OFFICIAL);
        assertThat(official.getIdentityKey()).isEqualTo("test-skill-1");
        assertThat(official.getCommand()).isEqualTo("/test1");
        assertThat(byName(batch.inserts(), "Custom Skill").getSourceKind()).isEqualTo(SourceKind.CUSTOM);

        assertThat(result.report().inserted()).isEqualTo(2);
        assertThat(result.catalog()).hasSize(2);
    }

    @Test
    void run_missingRoots_isAnEmptySyncNotAnError() {
        when(store.listAll()).thenReturn(List.of());

        SyncResult result = engine.run(bundled, custom);

        assertThat(result.catalog()).isEmpty();
        assertThat(result.report()).isEqualTo(new SyncReport(0, 0, 0, 0, 0, 0));
        verify(store, never()).applyBatch(any());
    }

    // ------------------------------------------------------------------
    // Updates
    // ------------------------------------------------------------------

    @Test
    void run_changedDefinition_updatesMirrorButKeepsIdAndEnabled() {
        Path file = writeSkill(bundled, "toggle-skill", "Toggle Skill v2", "Now better", null);
        SkillRecord existing = persisted(SourceKind.OFFICIAL, "toggle-skill", "Toggle Skill", file);
        existing.setEnabled(false);
        when(store.listAll()).thenReturn(List.of(existing));
        when(store.applyBatch(any())).thenReturn(List.of(existing));

        SyncResult result = engine.run(bundled, custom);

        SyncBatch batch = capturedBatch();
        assertThat(batch.inserts()).isEmpty();
        assertThat(batch.deletes()).isEmpty();
        assertThat(batch.updates()).singleElement().satisfies(u -> {
            assertThat(u.getId()).isEqualTo(existing.getId());
            assertThat(u.isEnabled()).isFalse();
            assertThat(u.getName()).isEqualTo("Toggle Skill v2");
            assertThat(u.getDescription()).isEqualTo("Now better");
        });
        assertThat(result.report().updated()).isEqualTo(1);
    }

    @Test
    void run_nothingChangedOnDisk_writesNothing() {
        Path file = writeSkill(bundled, "stable", "Stable", "Same as before", "/stable");
        SkillRecord existing = persisted(SourceKind.OFFICIAL, "stable", "Stable", file);
        existing.setDescription("Same as before");
        existing.setCommand("/stable");
        existing.setBodyText("This is the skill content for Stable.");
        when(store.listAll()).thenReturn(List.of(existing));

        SyncResult result = engine.run(bundled, custom);

        verify(store, never()).applyBatch(any());
        assertThat(result.report().unchanged()).isEqualTo(1);
        assertThat(result.catalog()).containsExactly(existing);
    }

    // ------------------------------------------------------------------
    // Deletes
    // ------------------------------------------------------------------

    @Test
    void run_fileGone_deletesRowEvenWhenOfficial() {
        SkillRecord officialGone = persisted(SourceKind.OFFICIAL, "retired", "Retired",
                bundled.resolve("retired/SKILL.md"));
        SkillRecord customGone = persisted(SourceKind.CUSTOM, "mine", "Mine",
                custom.resolve("mine/SKILL.md"));
        when(store.listAll()).thenReturn(List.of(officialGone, customGone));
        when(store.applyBatch(any())).thenReturn(List.of());

        SyncResult result = engine.run(bundled, custom);

        assertThat(capturedBatch().deletes())
                .containsExactlyInAnyOrder(officialGone.getId(), customGone.getId());
        assertThat(result.report().deleted()).isEqualTo(2);
        assertThat(result.catalog()).isEmpty();
    }

    @Test
    void run_sameDirectoryNameInBothRoots_areDifferentSkills() {
        Path officialFile = writeSkill(bundled, "shared", "Shared Official", null, null);
        writeSkill(custom, "shared", "Shared Custom", null, null);
        SkillRecord existing = persisted(SourceKind.OFFICIAL, "shared", "Shared Official", officialFile);
        existing.setBodyText("This is the skill content for Shared Official.");
        when(store.listAll()).thenReturn(List.of(existing));
        when(store.applyBatch(any())).thenReturn(List.of());

        engine.run(bundled, custom);

        SyncBatch batch = capturedBatch();
        assertThat(batch.deletes()).isEmpty();
        assertThat(batch.updates()).isEmpty();
        assertThat(batch.inserts()).singleElement().satisfies(r -> {
            assertThat(r.getSourceKind()).isEqualTo(SourceKind.CUSTOM);
            assertThat(r.getName()).isEqualTo("Shared Custom");
        });
    }

    // ------------------------------------------------------------------
    // Partial failure
    // ------------------------------------------------------------------

    @Test
    void run_oneMalformedFile_skipsItAndKeepsGoing() {
        writeRaw(bundled, "broken", malformed());
        writeSkill(bundled, "good", "Good Skill", "Parses fine", null);
        when(store.listAll()).thenReturn(List.of());
        when(store.applyBatch(any())).thenAnswer(inv -> ((SyncBatch) inv.getArgument(0)).inserts());

        SyncResult result = engine.run(bundled, custom);

        assertThat(capturedBatch().inserts()).extracting(SkillRecord::getName).containsExactly("Good Skill");
        assertThat(result.report().malformed()).isEqualTo(1);
        assertThat(meters.counter("skilldeck.sync.candidates", "result", "malformed").count()).isEqualTo(1.0);
    }

    @Test
    void run_malformedFileWhoseRowExists_removesTheRow() {
        // A file that no longer parses is treated like a missing file.
        Path file = writeRaw(bundled, "was-good", malformed());
        SkillRecord existing = persisted(SourceKind.OFFICIAL, "was-good", "Was Good", file);
        when(store.listAll()).thenReturn(List.of(existing));
        when(store.applyBatch(any())).thenReturn(List.of());

        engine.run(bundled, custom);

        assertThat(capturedBatch().deletes()).containsExactly(existing.getId());
    }

    @Test
    void run_identityKeyCollision_keepsFirstInScanOrder() {
        writeSkill(custom, "Report", "Upper Report", null, null);
        writeSkill(custom, "report", "Lower Report", null, null);
        when(store.listAll()).thenReturn(List.of());
        when(store.applyBatch(any())).thenAnswer(inv -> ((SyncBatch) inv.getArgument(0)).inserts());

        SyncResult result = engine.run(bundled, custom);

        assertThat(capturedBatch().inserts()).singleElement().satisfies(r -> {
            assertThat(r.getName()).isEqualTo("Upper Report");
            assertThat(r.getIdentityKey()).isEqualTo("report");
        });
        assertThat(result.report().conflicts()).isEqualTo(1);
    }

    @Test
    void run_storeFails_propagatesPersistenceFailure() {
        writeSkill(bundled, "any", "Any", null, null);
        when(store.listAll()).thenReturn(List.of());
        when(store.applyBatch(any())).thenThrow(new PersistenceFailureException("disk full", null));

        assertThatThrownBy(() -> engine.run(bundled, custom))
                .isInstanceOf(PersistenceFailureException.class)
                .hasMessageContaining("disk full");
        assertThat(meters.timer("skilldeck.sync.duration", "outcome", "failure").count()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private SyncBatch capturedBatch() {
        ArgumentCaptor<SyncBatch> captor = ArgumentCaptor.forClass(SyncBatch.class);
        verify(store).applyBatch(captor.capture());
        return captor.getValue();
    }

    private static SkillRecord persisted(SourceKind kind, String key, String name, Path file) {
        SkillRecord record = new SkillRecord(kind, SkillCandidate.identityKeyOf(key));
        ReflectionTestUtils.setField(record, "id", UUID.randomUUID());
        record.setName(name);
        record.setDescription("");
        record.setBodyText("");
        record.setFilePath(file.toAbsolutePath().normalize().toString());
        return record;
    }

    private static SkillRecord byName(List<SkillRecord> records, String name) {
        return records.stream()
                .filter(r -> r.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
