package com.residencepark.visitorparking.service;

import com.residencepark.visitorparking.dto.VisitorFilter;
import com.residencepark.visitorparking.entity.Visitor;
import com.residencepark.visitorparking.entity.VisitorStatus;
import com.residencepark.visitorparking.exception.BackendUnavailableException;
import com.residencepark.visitorparking.exception.DuplicateVisitorException;
import com.residencepark.visitorparking.exception.ValidationException;
import com.residencepark.visitorparking.exception.VisitorNotFoundException;
import com.residencepark.visitorparking.repository.VisitorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Visitor lifecycle manager.
 *
 * Owns every invariant of a visitor record:
 *  - identity number and license plate are upper-cased and globally unique
 *  - status moves only between ACTIVE and LEFT (created ACTIVE)
 *  - createdAt is set once; lastUpdated on every status change
 *  - delete removes the record permanently
 *
 * Concurrency:
 *  - register takes no lock. The duplicate pre-check only exists to name the
 *    colliding field; the unique constraints on the visitors table decide races,
 *    and a race lost at insert time is reported as the same
 *    DuplicateVisitorException. Nothing is retried.
 *  - updateStatus locks the row (SELECT FOR UPDATE) and writes with an UPDATE
 *    statement, so a record deleted concurrently is reported as not found and
 *    never re-inserted. Concurrent updates to the same status see each other:
 *    only the first reports a change.
 *  - delete is a single DELETE statement; of two concurrent deletes only one
 *    succeeds, the other gets VisitorNotFoundException.
 *
 * Errors: store exceptions raised inside these methods never leave as a Spring
 * DataAccessException. Integrity violations on insert become
 * DuplicateVisitorException, everything else BackendUnavailableException.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisitorService {

    private final VisitorRepository visitorRepository;
    private final UnitDirectoryService unitDirectoryService;

    // ────────────────────────────────────────────────────────────────────────
    // Mutations
    // ────────────────────────────────────────────────────────────────────────

    /**
     * Registers a visitor with status ACTIVE.
     *
     * @return the persisted record, carrying its generated id
     * @throws ValidationException        if any field is blank
     * @throws DuplicateVisitorException  if the identity number or plate is taken
     * @throws BackendUnavailableException if the store cannot be reached
     */
    public Visitor register(String name, String identityNumber, String licensePlate, String unitNumber) {
        String cleanName  = requireText(name, "Name");
        String identity   = normalize(requireText(identityNumber, "Identity number"));
        String plate      = normalize(requireText(licensePlate, "License plate"));
        String unit       = normalize(requireText(unitNumber, "Unit number"));

        log.info("Registering visitor — plate: {}, unit: {}", plate, unit);

        Optional<Visitor> existing = inStore("checking for duplicates",
                () -> visitorRepository.findFirstByIdentityNumberOrLicensePlate(identity, plate));
        if (existing.isPresent()) {
            DuplicateVisitorException.Field field = collidingField(existing.get(), identity);
            log.warn("Registration rejected — {} already registered (visitor #{})",
                    field.label(), existing.get().getId());
            throw new DuplicateVisitorException(field);
        }

        Visitor visitor = Visitor.builder()
                .name(cleanName)
                .identityNumber(identity)
                .licensePlate(plate)
                .unitNumber(unit)
                .status(VisitorStatus.ACTIVE)
                .createdAt(LocalDateTime.now())
                .build();

        Visitor saved;
        try {
            saved = visitorRepository.saveAndFlush(visitor);
        } catch (DataIntegrityViolationException e) {
            // Pre-check passed but a concurrent registration won the unique index
            DuplicateVisitorException.Field field = resolveLostRace(identity, plate, e);
            log.warn("Registration lost uniqueness race on {} — plate: {}", field.label(), plate);
            throw new DuplicateVisitorException(field, e);
        } catch (DataAccessException e) {
            throw unavailable("registering visitor", e);
        }

        unitDirectoryService.evictUnitNumbers();
        log.info("Visitor #{} registered — plate: {}, unit: {}", saved.getId(), plate, unit);
        return saved;
    }

    /**
     * Sets the status of a visitor, parsing the status case-insensitively.
     *
     * @throws ValidationException      if the status is not "active" or "left"
     * @throws VisitorNotFoundException if the id does not resolve
     * @see #updateStatus(String, VisitorStatus)
     */
    @Transactional
    public boolean updateStatus(String visitorId, String newStatus) {
        VisitorStatus status = VisitorStatus.parse(newStatus)
                .orElseThrow(() -> new ValidationException(
                        "Invalid status '" + newStatus + "'. Must be 'active' or 'left'"));
        return updateStatus(visitorId, status);
    }

    /**
     * Sets the status of a visitor and stamps lastUpdated.
     *
     * Setting the status a record already has is accepted and still stamps
     * lastUpdated, but reports no change.
     *
     * @return true if the status changed, false if it already had that value
     * @throws VisitorNotFoundException if the id does not resolve, including a
     *                                  record deleted while this call runs
     */
    @Transactional
    public boolean updateStatus(String visitorId, VisitorStatus newStatus) {
        if (newStatus == null) {
            throw new ValidationException("Status is required");
        }
        Long id = parseId(visitorId);

        // Row lock held until commit: a concurrent update or delete waits here
        Visitor locked = inStore("locking visitor",
                () -> visitorRepository.findByIdForUpdate(id))
                .orElseThrow(() -> new VisitorNotFoundException(visitorId));
        VisitorStatus previous = locked.getStatus();

        int updated = inStore("updating visitor status",
                () -> visitorRepository.updateStatusById(id, newStatus, LocalDateTime.now()));
        if (updated == 0) {
            log.warn("Visitor #{} disappeared before its status could be set", id);
            throw new VisitorNotFoundException(visitorId);
        }

        boolean changed = previous != newStatus;
        if (changed) {
            log.info("Visitor #{} status {} → {}", id, previous, newStatus);
        } else {
            log.info("Visitor #{} already {} — no change", id, newStatus);
        }
        return changed;
    }

    /**
     * Deletes a visitor record permanently.
     *
     * @throws VisitorNotFoundException if the id does not resolve or the record
     *                                  was already deleted
     */
    public void delete(String visitorId) {
        Long id = parseId(visitorId);
        int removed = inStore("deleting visitor", () -> visitorRepository.deleteVisitorById(id));
        if (removed == 0) {
            throw new VisitorNotFoundException(visitorId);
        }
        unitDirectoryService.evictUnitNumbers();
        log.info("Visitor #{} deleted", id);
    }

    // ────────────────────────────────────────────────────────────────────────
    // Reads
    // ────────────────────────────────────────────────────────────────────────

    /** All visitors, most recently registered first. Empty list when there are none. */
    public List<Visitor> listAll() {
        return inStore("listing visitors", visitorRepository::findAllByOrderByCreatedAtDescIdDesc);
    }

    /** The 20 most recently registered visitors. */
    public List<Visitor> listRecent() {
        return inStore("listing recent visitors", visitorRepository::findTop20ByOrderByCreatedAtDescIdDesc);
    }

    /**
     * @throws VisitorNotFoundException if the id is malformed or unknown
     */
    public Visitor getVisitor(String visitorId) {
        Long id = parseId(visitorId);
        return inStore("loading visitor", () -> visitorRepository.findById(id))
                .orElseThrow(() -> new VisitorNotFoundException(visitorId));
    }

    /** First visitor whose name contains the fragment, ignoring case. */
    public Optional<Visitor> findByName(String nameFragment) {
        if (nameFragment == null || nameFragment.isBlank()) {
            return Optional.empty();
        }
        log.debug("Searching visitor by name fragment '{}'", nameFragment);
        return inStore("searching visitor by name",
                () -> visitorRepository.findFirstByNameContainingIgnoreCaseOrderByIdAsc(nameFragment.trim()));
    }

    /** Visitors whose unit number equals the given one exactly (after upper-casing). */
    public List<Visitor> findByUnit(String unitNumber) {
        if (unitNumber == null || unitNumber.isBlank()) {
            return List.of();
        }
        String unit = normalize(unitNumber);
        log.debug("Looking up visitors for unit {}", unit);
        return inStore("looking up visitors by unit", () -> visitorRepository.findByUnitNumberOrderByCreatedAtDesc(unit));
    }

    /**
     * Visitors matching every non-null criterion of the filter, newest first.
     *
     * @throws ValidationException if registeredFrom is after registeredTo
     */
    public List<Visitor> filterVisitors(VisitorFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return listAll();
        }
        LocalDate from = filter.getRegisteredFrom();
        LocalDate to   = filter.getRegisteredTo();
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("'from' (" + from + ") must not be after 'to' (" + to + ")");
        }

        String text = filter.getQuery() != null && !filter.getQuery().isBlank()
                ? filter.getQuery().trim().toLowerCase(Locale.ROOT) : null;
        String unit = filter.getUnitNumber() != null && !filter.getUnitNumber().isBlank()
                ? normalize(filter.getUnitNumber()) : null;

        List<Visitor> matches = listAll().stream()
                .filter(v -> text == null || containsIgnoreCase(v, text))
                .filter(v -> filter.getStatus() == null || filter.getStatus() == v.getStatus())
                .filter(v -> unit == null || unit.equals(v.getUnitNumber()))
                .filter(v -> from == null || !v.getCreatedAt().toLocalDate().isBefore(from))
                .filter(v -> to == null || !v.getCreatedAt().toLocalDate().isAfter(to))
                .toList();

        log.debug("Filter matched {} visitor(s)", matches.size());
        return matches;
    }

    public List<String> listUnitNumbers() {
        return inStore("listing unit numbers", unitDirectoryService::getUnitNumbers);
    }

    public long countByStatus(VisitorStatus status) {
        return inStore("counting visitors", () -> visitorRepository.countByStatus(status));
    }

    public long countAll() {
        return inStore("counting visitors", visitorRepository::count);
    }

    // ────────────────────────────────────────────────────────────────────────
    // Helpers
    // ────────────────────────────────────────────────────────────────────────

    private DuplicateVisitorException.Field collidingField(Visitor existing, String identity) {
        if (identity.equals(existing.getIdentityNumber())) {
            return DuplicateVisitorException.Field.IDENTITY_NUMBER;
        }
        // The matched record collided on plate; another one may still hold the identity number
        boolean identityTaken = inStore("checking for duplicates",
                () -> visitorRepository.existsByIdentityNumber(identity));
        return identityTaken
                ? DuplicateVisitorException.Field.IDENTITY_NUMBER
                : DuplicateVisitorException.Field.LICENSE_PLATE;
    }

    /**
     * Works out which unique field a failed insert collided on: first by looking
     * the values up again, then from the violated constraint's name.
     */
    private DuplicateVisitorException.Field resolveLostRace(String identity, String plate,
                                                           DataIntegrityViolationException e) {
        try {
            if (visitorRepository.existsByIdentityNumber(identity)) {
                return DuplicateVisitorException.Field.IDENTITY_NUMBER;
            }
            if (visitorRepository.existsByLicensePlate(plate)) {
                return DuplicateVisitorException.Field.LICENSE_PLATE;
            }
        } catch (DataAccessException lookupFailure) {
            log.warn("Could not re-query after integrity violation: {}", lookupFailure.getMessage());
        }
        String detail = String.valueOf(e.getMostSpecificCause().getMessage()).toLowerCase(Locale.ROOT);
        return detail.contains(Visitor.UK_LICENSE_PLATE)
                ? DuplicateVisitorException.Field.LICENSE_PLATE
                : DuplicateVisitorException.Field.IDENTITY_NUMBER;
    }

    private static boolean containsIgnoreCase(Visitor v, String lowerText) {
        return v.getName().toLowerCase(Locale.ROOT).contains(lowerText)
                || v.getIdentityNumber().toLowerCase(Locale.ROOT).contains(lowerText)
                || v.getLicensePlate().toLowerCase(Locale.ROOT).contains(lowerText);
    }

    /** Malformed ids resolve to nothing, so they are reported as not found. */
    private static Long parseId(String visitorId) {
        if (visitorId == null || visitorId.isBlank()) {
            throw new VisitorNotFoundException(String.valueOf(visitorId));
        }
        try {
            long id = Long.parseLong(visitorId.trim());
            if (id <= 0) {
                throw new VisitorNotFoundException(visitorId);
            }
            return id;
        } catch (NumberFormatException e) {
            throw new VisitorNotFoundException(visitorId);
        }
    }

    private static String requireText(String value, String fieldLabel) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(fieldLabel + " is required");
        }
        return value.trim();
    }

    private static String normalize(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }

    private <T> T inStore(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw unavailable(operation, e);
        }
    }

    private BackendUnavailableException unavailable(String operation, DataAccessException e) {
        log.error("Record store failure while {}: {}", operation, e.getMessage());
        return new BackendUnavailableException("Visitor store unavailable while " + operation, e);
    }
}
