package com.skilldeck.catalog.service;

import com.skilldeck.catalog.model.SkillRecord;
import com.skilldeck.catalog.model.SourceKind;
import com.skilldeck.catalog.repository.SkillRecordRepository;
import com.skilldeck.catalog.skill.SkillNotFoundException;
import com.skilldeck.catalog.sync.SyncBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Persistence boundary for the skill catalog.
 *
 * Every method runs in its own transaction. Transactions are opened with a
 * {@link TransactionTemplate} rather than {@code @Transactional} so that
 * commit-time failures are caught here and surface as
 * {@link PersistenceFailureException}, not as raw Spring exceptions.
 *
 * Records returned from this class are detached.
 */
@Service
public class CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(CatalogStore.class);

    private final SkillRecordRepository repo;
    private final TransactionTemplate   tx;
    private final TransactionTemplate   readTx;

    public CatalogStore(SkillRecordRepository repo, PlatformTransactionManager txManager) {
        this.repo   = repo;
        this.tx     = new TransactionTemplate(txManager);
        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public List<SkillRecord> listAll() {
        return inTransaction(readTx, "list skills", status -> repo.findAll());
    }

    public boolean exists(SourceKind sourceKind, String identityKey) {
        return inTransaction(readTx, "look up skill " + identityKey,
                status -> repo.findBySourceKindAndIdentityKey(sourceKind, identityKey).isPresent());
    }

    // ------------------------------------------------------------------
    // Reconciliation
    // ------------------------------------------------------------------

    /**
     * Apply one reconciliation pass atomically and return the resulting catalog.
     *
     * Updates are matched by id and only replace the definition mirror
     * (see {@link SkillRecord#mirror}); sourceKind, identityKey and the enabled
     * flag of an existing row are never written here.
     *
     * @throws PersistenceFailureException if anything fails; nothing is committed
     */
    public List<SkillRecord> applyBatch(SyncBatch batch) {
        return inTransaction(tx, "apply sync batch", status -> {
            if (!batch.deletes().isEmpty()) {
                repo.deleteAllById(batch.deletes());
            }
            for (SkillRecord update : batch.updates()) {
                SkillRecord managed = repo.findById(update.getId())
                        .orElseThrow(() -> new DataRetrievalFailureException(
                                "Skill " + update.getId() + " disappeared during sync"));
                managed.mirror(update);
            }
            repo.saveAll(batch.inserts());
            repo.flush();
            return repo.findAll();
        });
    }

    // ------------------------------------------------------------------
    // Single-record mutations
    // ------------------------------------------------------------------

    public SkillRecord insert(SkillRecord record) {
        return inTransaction(tx, "insert skill " + record.getIdentityKey(),
                status -> repo.saveAndFlush(record));
    }

    /**
     * Persist a new enabled flag.
     *
     * @throws SkillNotFoundException if no row has this id
     */
    public SkillRecord setEnabled(UUID id, boolean enabled) {
        return inTransaction(tx, "toggle skill " + id, status -> {
            SkillRecord managed = repo.findById(id).orElseThrow(() -> new SkillNotFoundException(id));
            managed.setEnabled(enabled);
            return repo.saveAndFlush(managed);
        });
    }

    /** Delete the row with this id; returns false if it was already gone. */
    public boolean delete(UUID id) {
        return inTransaction(tx, "delete skill " + id, status -> {
            if (!repo.existsById(id)) {
                return false;
            }
            repo.deleteById(id);
            return true;
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> T inTransaction(TransactionTemplate template, String what, TransactionCallback<T> work) {
        try {
            return template.execute(work);
        } catch (DataAccessException | TransactionException e) {
            log.error("Catalog transaction failed ({}): {}", what, e.getMessage());
            throw new PersistenceFailureException("Could not " + what + ": " + e.getMessage(), e);
        }
    }
}
