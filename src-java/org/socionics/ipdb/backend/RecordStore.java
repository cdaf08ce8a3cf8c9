package org.socionics.ipdb.backend;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.socionics.ipdb.Comment;
import org.socionics.ipdb.EditHistoryRecord;
import org.socionics.ipdb.Entity;
import org.socionics.ipdb.EntityQuery;
import org.socionics.ipdb.Rating;
import org.socionics.ipdb.StoreStats;
import org.socionics.ipdb.TypingSystem;
import org.socionics.ipdb.User;

/**
 * Backend-neutral record operations.
 *
 * <p>One implementation per backend family: {@link JdbcRecordStore} for the
 * native databases and {@code FallbackRecordStore} for the snapshot store.
 * Both implement the same filter, sort and pagination semantics.</p>
 *
 * <p>Record stores trust their input: identifiers, timestamps and validation
 * are the facade's job. Entities returned by the find and list methods carry
 * their rating count and type assignments.</p>
 */
public interface RecordStore {

    // =========================================================================
    // Entities
    // =========================================================================

    void insertEntity(Entity entity);

    Optional<Entity> findEntity(String id);

    Optional<Entity> findEntityByExternalId(String externalSource, String externalId);

    boolean entityExists(String id);

    List<Entity> listEntities(EntityQuery query);

    /**
     * Diff the payload against the stored row and, if anything changed, write
     * the new values together with one history record per changed field.
     *
     * @param id entity id
     * @param fields update payload, already validated
     * @param userId acting user, may be null
     * @param at timestamp for the change
     * @return the changes written, empty if none
     * @throws org.socionics.ipdb.NotFoundException if the entity does not exist
     */
    List<FieldChange> updateEntity(String id, Map<String, ?> fields, String userId, Instant at);

    // =========================================================================
    // Users
    // =========================================================================

    void insertUser(User user);

    Optional<User> findUser(String id);

    Optional<User> findUserByUsername(String username);

    // =========================================================================
    // Ratings, comments, history
    // =========================================================================

    void insertRating(Rating rating);

    /** Newest first. */
    List<Rating> listRatings(String entityId);

    void insertComment(Comment comment);

    /** Newest first, with user display names. */
    List<Comment> listComments(String entityId);

    /** Newest first, with user display names. */
    List<EditHistoryRecord> listEditHistory(String entityId);

    // =========================================================================
    // Reference catalog
    // =========================================================================

    /** In catalog order. */
    List<TypingSystem> listTypingSystems();

    void insertTypingSystem(TypingSystem system);

    StoreStats stats();

    // =========================================================================
    // Embeddings
    // =========================================================================

    /**
     * Store or replace the raw vector of an entity.
     */
    void saveEmbedding(String entityId, float[] vector, Instant at);

    Optional<float[]> findEmbedding(String entityId);

    /**
     * All persisted vectors keyed by entity id, ordered by entity id.
     */
    Map<String, float[]> loadEmbeddings();
}
