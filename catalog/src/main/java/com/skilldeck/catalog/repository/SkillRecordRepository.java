package com.skilldeck.catalog.repository;

import com.skilldeck.catalog.model.SkillRecord;
import com.skilldeck.catalog.model.SourceKind;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD operations for the skills table.
 *
 * Spring Data JPA generates the implementation at startup.
 * Callers go through {@code CatalogStore}, which owns the transactions.
 */
public interface SkillRecordRepository extends JpaRepository<SkillRecord, UUID> {

    Optional<SkillRecord> findBySourceKindAndIdentityKey(SourceKind sourceKind, String identityKey);
}
