package org.socionics.ipdb;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link EntityImporter#importRecords(Iterable, String)}.
 */
public final class ImportReport {

    private int imported;
    private int skipped;
    private int completed;
    private int ratingsAdded;
    private final List<Failure> failures = new ArrayList<>();

    void recordImported(int ratings) {
        imported++;
        ratingsAdded += ratings;
    }

    void recordCompleted(int ratings) {
        completed++;
        ratingsAdded += ratings;
    }

    void recordSkipped() {
        skipped++;
    }

    void recordFailure(String externalId, String message) {
        failures.add(new Failure(externalId, message));
    }

    /**
     * @return records that created a new entity
     */
    public int getImported() { return imported; }

    /**
     * @return records whose entity existed but lacked some of their typings
     */
    public int getCompleted() { return completed; }

    /**
     * @return records whose entity and typings were already present
     */
    public int getSkipped() { return skipped; }

    public int getRatingsAdded() { return ratingsAdded; }

    public int getFailed() { return failures.size(); }

    public List<Failure> getFailures() { return Collections.unmodifiableList(failures); }

    @Override
    public String toString() {
        return "ImportReport{imported=" + imported + ", completed=" + completed + ", skipped=" + skipped +
               ", failed=" + failures.size() + ", ratings=" + ratingsAdded + "}";
    }

    /**
     * A record that could not be imported.
     */
    public static final class Failure {
        private final String externalId;
        private final String message;

        Failure(String externalId, String message) {
            this.externalId = externalId;
            this.message = message;
        }

        public String getExternalId() { return externalId; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return externalId + ": " + message;
        }
    }
}
