package org.socionics.ipdb;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Imports entities with their typings, one record at a time.
 *
 * <p>A record is validated in full (name, external reference, every
 * assignment against the catalog) before anything is written for it. A record
 * whose external reference already exists only gets the typings the rater
 * has not recorded for it yet, or is skipped when none are missing, so an
 * import can be run again after a partial failure. A failing record is
 * reported and the import continues with the next one.</p>
 */
public final class EntityImporter {

    private static final Logger logger = LoggerFactory.getLogger(EntityImporter.class);

    private final PersonalityStore store;

    public EntityImporter(PersonalityStore store) {
        this.store = store;
    }

    /**
     * @param records records to import, consumed once
     * @param raterId user the typings are attributed to
     * @throws ValidationException if {@code raterId} is empty
     */
    public ImportReport importRecords(Iterable<ImportRecord> records, String raterId) {
        if (raterId == null || raterId.isBlank()) {
            throw new ValidationException("Rater id must not be empty");
        }
        ImportReport report = new ImportReport();
        if (records == null) {
            return report;
        }

        for (ImportRecord record : records) {
            String label = label(record);
            try {
                importOne(record, raterId, report);
            } catch (ValidationException | NotFoundException | StorageException e) {
                logger.warn("Import of {} failed: {}", label, e.getMessage());
                report.recordFailure(label, e.getMessage());
            }
        }
        logger.info("Import finished: {}", report);
        return report;
    }

    private void importOne(ImportRecord record, String raterId, ImportReport report) {
        if (record == null) {
            throw new ValidationException("Import record is null");
        }
        NewEntity data = record.getEntity();
        if (data.getName() == null || data.getName().isBlank()) {
            throw new ValidationException("Entity name must not be empty");
        }
        if (data.getExternalSource() == null || data.getExternalId() == null) {
            throw new ValidationException("Import records need an external source and id");
        }
        validateAssignments(record.getAssignments());

        Optional<Entity> existing = store.findEntityByExternalId(data.getExternalSource(), data.getExternalId());
        if (existing.isPresent()) {
            Entity entity = existing.get();
            List<ImportRecord.Assignment> missing = missingAssignments(entity.getId(), raterId, record.getAssignments());
            if (missing.isEmpty()) {
                logger.debug("Skipping {}: already imported as {}", label(record), entity.getId());
                report.recordSkipped();
                return;
            }
            logger.info("Completing {}: {} typings missing on {}", label(record), missing.size(), entity.getId());
            addRatings(entity, raterId, missing);
            report.recordCompleted(missing.size());
            return;
        }

        Entity entity = store.createEntity(data);
        addRatings(entity, raterId, record.getAssignments());
        report.recordImported(record.getAssignments().size());
    }

    private void addRatings(Entity entity, String raterId, List<ImportRecord.Assignment> assignments) {
        for (ImportRecord.Assignment a : assignments) {
            store.addRating(new NewRating(entity.getId(), raterId, a.getSystem(), a.getTypeCode(),
                    a.getConfidence(), "Imported from " + entity.getExternalSource()));
        }
    }

    /**
     * Assignments of a record with no matching rating by {@code raterId} yet.
     * Repeated assignments are matched one rating each.
     */
    private List<ImportRecord.Assignment> missingAssignments(String entityId, String raterId,
                                                            List<ImportRecord.Assignment> assignments) {
        Map<String, Integer> present = new HashMap<>();
        for (Rating r : store.listRatings(entityId)) {
            if (raterId.equals(r.getUserId())) {
                present.merge(key(r.getSystem(), r.getTypeCode()), 1, Integer::sum);
            }
        }
        List<ImportRecord.Assignment> missing = new ArrayList<>();
        for (ImportRecord.Assignment a : assignments) {
            String key = key(a.getSystem(), a.getTypeCode());
            int left = present.getOrDefault(key, 0);
            if (left > 0) {
                present.put(key, left - 1);
            } else {
                missing.add(a);
            }
        }
        return missing;
    }

    private static String key(String system, String typeCode) {
        return system.trim().toLowerCase(Locale.ROOT) + '\u0000' + typeCode.trim().toLowerCase(Locale.ROOT);
    }

    private void validateAssignments(List<ImportRecord.Assignment> assignments) {
        List<TypingSystem> catalog = store.listTypingSystems();
        for (ImportRecord.Assignment a : assignments) {
            TypingSystem system = catalog.stream()
                    .filter(s -> a.getSystem() != null && s.getName().equalsIgnoreCase(a.getSystem().trim()))
                    .findFirst()
                    .orElseThrow(() -> new ValidationException("Unknown typing system: " + a.getSystem()));
            if (system.findType(a.getTypeCode()).isEmpty()) {
                throw new ValidationException("Unknown " + system.getName() + " type: " + a.getTypeCode());
            }
            double c = a.getConfidence();
            if (!Double.isFinite(c) || c < 0.0 || c > 1.0) {
                throw new ValidationException("Confidence must be within [0, 1], got " + c);
            }
        }
    }

    private static String label(ImportRecord record) {
        if (record == null) return "<null>";
        return record.getExternalSource() + ":" + record.getExternalId();
    }
}
