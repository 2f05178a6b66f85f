package com.residencepark.visitorparking.repository;

import com.residencepark.visitorparking.entity.Visitor;
import com.residencepark.visitorparking.entity.VisitorStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Visitor records.
 *
 * Uses Spring Data JPA derived queries; the unique constraints on
 * identity_number / license_plate and the index on unit_number keep
 * the duplicate pre-check and unit lookups cheap.
 */
@Repository
public interface VisitorRepository extends JpaRepository<Visitor, Long> {

    // ── Uniqueness pre-check ───────────────────────────────────────────────────

    /**
     * Finds a record holding either normalized value. Callers must pass
     * already upper-cased values.
     */
    Optional<Visitor> findFirstByIdentityNumberOrLicensePlate(String identityNumber, String licensePlate);

    boolean existsByIdentityNumber(String identityNumber);

    boolean existsByLicensePlate(String licensePlate);

    // ── Listing ────────────────────────────────────────────────────────────────

    /** All records, most recently registered first. */
    List<Visitor> findAllByOrderByCreatedAtDescIdDesc();

    /** Bounded newest-first list used by the assistant's list tool. */
    List<Visitor> findTop20ByOrderByCreatedAtDescIdDesc();

    // ── Assistant lookups ──────────────────────────────────────────────────────

    long countByStatus(VisitorStatus status);

    /** First record (by id) whose name contains the fragment, ignoring case. */
    Optional<Visitor> findFirstByNameContainingIgnoreCaseOrderByIdAsc(String nameFragment);

    List<Visitor> findByUnitNumberOrderByCreatedAtDesc(String unitNumber);

    @Query("SELECT DISTINCT v.unitNumber FROM Visitor v ORDER BY v.unitNumber")
    List<String> findDistinctUnitNumbers();

    // ── Status change / removal ────────────────────────────────────────────────

    /**
     * Acquires a PESSIMISTIC_WRITE (SELECT FOR UPDATE) lock on the visitor row.
     * Used by VisitorService.updateStatus so concurrent status changes and a
     * concurrent delete of the same record are serialized on the row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Visitor v WHERE v.id = :id")
    Optional<Visitor> findByIdForUpdate(@Param("id") Long id);

    /**
     * Sets status and lastUpdated in place, never inserting.
     *
     * @return number of rows updated, 0 if the record no longer exists
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Visitor v SET v.status = :status, v.lastUpdated = :now WHERE v.id = :id")
    int updateStatusById(@Param("id") Long id,
                         @Param("status") VisitorStatus status,
                         @Param("now") LocalDateTime now);

    /** @return number of rows deleted, 0 if nothing matched */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Visitor v WHERE v.id = :id")
    int deleteVisitorById(@Param("id") Long id);
}
