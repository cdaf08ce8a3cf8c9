package org.socionics.ipdb.fallback;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.socionics.ipdb.Comment;
import org.socionics.ipdb.EditHistoryRecord;
import org.socionics.ipdb.Entity;
import org.socionics.ipdb.EntityQuery;
import org.socionics.ipdb.EntitySort;
import org.socionics.ipdb.NotFoundException;
import org.socionics.ipdb.Rating;
import org.socionics.ipdb.StorageException;
import org.socionics.ipdb.StoreStats;
import org.socionics.ipdb.TypeAssignment;
import org.socionics.ipdb.TypingSystem;
import org.socionics.ipdb.User;
import org.socionics.ipdb.backend.EntityChanges;
import org.socionics.ipdb.backend.EntityQueryCompiler;
import org.socionics.ipdb.backend.FieldChange;
import org.socionics.ipdb.backend.RecordStore;

/**
 * {@link RecordStore} held entirely in memory and persisted as one snapshot.
 *
 * <p>The dataset is loaded once at construction. Every mutation updates the
 * in-memory state, then rewrites the whole snapshot; if the write fails the
 * in-memory change is undone so memory and disk never diverge. Queries are
 * linear scans with the same filter and ordering rules as the SQL backends.</p>
 *
 * <p>All access is serialized by one lock. Concurrent use of the same
 * snapshot file by several processes is not supported.</p>
 */
public final class FallbackRecordStore implements RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(FallbackRecordStore.class);

    private final SnapshotFile file;
    private final ReentrantLock lock = new ReentrantLock();

    private final TreeMap<String, Entity> entities = new TreeMap<>();
    private final TreeMap<String, User> users = new TreeMap<>();
    private final List<Rating> ratings = new ArrayList<>();
    private final Map<String, List<Rating>> ratingsByEntity = new HashMap<>();
    private final List<Comment> comments = new ArrayList<>();
    private final List<EditHistoryRecord> history = new ArrayList<>();
    private final List<TypingSystem> typingSystems = new ArrayList<>();
    private final TreeMap<String, Embedded> embeddings = new TreeMap<>();

    private static final class Embedded {
        final float[] vector;
        final long updatedAt;

        Embedded(float[] vector, long updatedAt) {
            this.vector = vector;
            this.updatedAt = updatedAt;
        }
    }

    public FallbackRecordStore(SnapshotFile file) {
        this.file = file;
        try {
            restore(file.load());
        } catch (RuntimeException e) {
            clear();
            file.discard(e.toString());
        }
        logger.debug("Fallback store loaded from {}: {} entities, {} ratings",
                file.path(), entities.size(), ratings.size());
    }

    // =========================================================================
    // Entities
    // =========================================================================

    @Override
    public void insertEntity(Entity entity) {
        locked(() -> {
            mutate("insertEntity", entity.getId(),
                    () -> entities.put(entity.getId(), entity),
                    () -> entities.remove(entity.getId()));
            return null;
        });
    }

    @Override
    public Optional<Entity> findEntity(String id) {
        return locked(() -> Optional.ofNullable(entities.get(id)).map(this::withRatings));
    }

    @Override
    public Optional<Entity> findEntityByExternalId(String externalSource, String externalId) {
        return locked(() -> entities.values().stream()
                .filter(e -> externalSource.equals(e.getExternalSource()) && externalId.equals(e.getExternalId()))
                .min(Comparator.comparing(Entity::getCreatedAt).thenComparing(Entity::getId))
                .map(this::withRatings));
    }

    @Override
    public boolean entityExists(String id) {
        return locked(() -> entities.containsKey(id));
    }

    @Override
    public List<Entity> listEntities(EntityQuery query) {
        return locked(() -> {
            String needle = query.getSearch() == null ? null : EntityQueryCompiler.foldCase(query.getSearch());
            return entities.values().stream()
                    .filter(e -> needle == null
                            || contains(e.getName(), needle)
                            || contains(e.getDescription(), needle)
                            || contains(e.getNotes(), needle))
                    .filter(e -> query.getCategory() == null || query.getCategory().equals(e.getCategory()))
                    .map(this::withRatings)
                    .sorted(comparator(query.getSort()))
                    .skip(query.getOffset())
                    .limit(query.getLimit())
                    .collect(Collectors.toList());
        });
    }

    @Override
    public List<FieldChange> updateEntity(String id, Map<String, ?> fields, String userId, Instant at) {
        return locked(() -> {
            Entity current = entities.get(id);
            if (current == null) {
                throw new NotFoundException("entity", id);
            }
            List<FieldChange> changes = EntityChanges.diff(current, fields);
            if (changes.isEmpty()) {
                return changes;
            }
            Entity updated = EntityChanges.apply(current, changes, userId, at);
            List<EditHistoryRecord> records = new ArrayList<>();
            for (FieldChange change : changes) {
                records.add(new EditHistoryRecord(UUID.randomUUID().toString(), id, userId, null,
                        change.getField(), change.getOldValue(), change.getNewValue(),
                        EditHistoryRecord.UPDATE, at));
            }
            mutate("updateEntity", id,
                    () -> {
                        entities.put(id, updated);
                        history.addAll(records);
                    },
                    () -> {
                        entities.put(id, current);
                        history.subList(history.size() - records.size(), history.size()).clear();
                    });
            return changes;
        });
    }

    static Comparator<Entity> comparator(EntitySort sort) {
        Comparator<Entity> byName = Comparator.comparing(Entity::getName);
        Comparator<Entity> byId = Comparator.comparing(Entity::getId);
        switch (sort) {
            case NAME_DESC:
                return byName.reversed().thenComparing(byId);
            case CATEGORY:
                return Comparator.comparing(Entity::getCategory, Comparator.nullsLast(Comparator.<String>naturalOrder()))
                        .thenComparing(byName).thenComparing(byId);
            case RATINGS:
                return Comparator.comparingInt(Entity::getRatingCount).reversed()
                        .thenComparing(byName).thenComparing(byId);
            case RECENT:
                return Comparator.comparing(Entity::getUpdatedAt).reversed()
                        .thenComparing(byName).thenComparing(byId);
            case NAME:
            default:
                return byName.thenComparing(byId);
        }
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && EntityQueryCompiler.foldCase(haystack).contains(needle);
    }

    private Entity withRatings(Entity entity) {
        Map<String, List<Rating>> byType = new LinkedHashMap<>();
        int count = 0;
        for (Rating r : ratingsByEntity.getOrDefault(entity.getId(), List.of())) {
            count++;
            byType.computeIfAbsent(r.getSystem() + '\u0000' + r.getTypeCode(), k -> new ArrayList<>()).add(r);
        }
        List<TypeAssignment> assignments = new ArrayList<>();
        for (List<Rating> group : byType.values()) {
            double sum = 0;
            for (Rating r : group) {
                sum += r.getConfidence();
            }
            Rating first = group.get(0);
            assignments.add(new TypeAssignment(first.getSystem(), first.getTypeCode(),
                    group.size(), sum / group.size()));
        }
        assignments.sort(TypeAssignment.ORDER);
        return entity.withRatings(count, assignments);
    }

    // =========================================================================
    // Users
    // =========================================================================

    @Override
    public void insertUser(User user) {
        locked(() -> {
            mutate("insertUser", null,
                    () -> users.put(user.getId(), user),
                    () -> users.remove(user.getId()));
            return null;
        });
    }

    @Override
    public Optional<User> findUser(String id) {
        return locked(() -> Optional.ofNullable(users.get(id)));
    }

    @Override
    public Optional<User> findUserByUsername(String username) {
        return locked(() -> users.values().stream()
                .filter(u -> u.getUsername().equals(username))
                .findFirst());
    }

    private String displayName(String userId) {
        User user = userId == null ? null : users.get(userId);
        return user == null ? null : user.getDisplayName();
    }

    // =========================================================================
    // Ratings, comments, history
    // =========================================================================

    @Override
    public void insertRating(Rating rating) {
        locked(() -> {
            mutate("insertRating", rating.getEntityId(),
                    () -> addRating(rating),
                    () -> {
                        ratings.remove(ratings.size() - 1);
                        List<Rating> forEntity = ratingsByEntity.get(rating.getEntityId());
                        forEntity.remove(forEntity.size() - 1);
                        if (forEntity.isEmpty()) {
                            ratingsByEntity.remove(rating.getEntityId());
                        }
                    });
            return null;
        });
    }

    @Override
    public List<Rating> listRatings(String entityId) {
        return locked(() -> ratingsByEntity.getOrDefault(entityId, List.of()).stream()
                .sorted(Comparator.comparing(Rating::getCreatedAt).thenComparing(Rating::getId).reversed())
                .collect(Collectors.toList()));
    }

    @Override
    public void insertComment(Comment comment) {
        locked(() -> {
            mutate("insertComment", comment.getEntityId(),
                    () -> comments.add(comment),
                    () -> comments.remove(comments.size() - 1));
            return null;
        });
    }

    @Override
    public List<Comment> listComments(String entityId) {
        return locked(() -> comments.stream()
                .filter(c -> c.getEntityId().equals(entityId))
                .sorted(Comparator.comparing(Comment::getCreatedAt).thenComparing(Comment::getId).reversed())
                .map(c -> c.withUserDisplayName(displayName(c.getUserId())))
                .collect(Collectors.toList()));
    }

    @Override
    public List<EditHistoryRecord> listEditHistory(String entityId) {
        return locked(() -> history.stream()
                .filter(h -> h.getEntityId().equals(entityId))
                .sorted(Comparator.comparing(EditHistoryRecord::getCreatedAt).reversed()
                        .thenComparing(EditHistoryRecord::getFieldName))
                .map(h -> h.withUserDisplayName(displayName(h.getUserId())))
                .collect(Collectors.toList()));
    }

    // =========================================================================
    // Reference catalog
    // =========================================================================

    @Override
    public List<TypingSystem> listTypingSystems() {
        return locked(() -> List.copyOf(typingSystems));
    }

    @Override
    public void insertTypingSystem(TypingSystem system) {
        locked(() -> {
            mutate("insertTypingSystem", null,
                    () -> typingSystems.add(system),
                    () -> typingSystems.remove(typingSystems.size() - 1));
            return null;
        });
    }

    @Override
    public StoreStats stats() {
        return locked(() -> {
            long typeCount = 0;
            for (TypingSystem system : typingSystems) {
                typeCount += system.getTypes().size();
            }
            return new StoreStats(entities.size(), users.size(), typeCount, ratings.size(), comments.size());
        });
    }

    // =========================================================================
    // Embeddings
    // =========================================================================

    @Override
    public void saveEmbedding(String entityId, float[] vector, Instant at) {
        Embedded next = new Embedded(vector.clone(), at.toEpochMilli());
        locked(() -> {
            Embedded previous = embeddings.get(entityId);
            mutate("saveEmbedding", entityId,
                    () -> embeddings.put(entityId, next),
                    () -> {
                        if (previous == null) {
                            embeddings.remove(entityId);
                        } else {
                            embeddings.put(entityId, previous);
                        }
                    });
            return null;
        });
    }

    @Override
    public Optional<float[]> findEmbedding(String entityId) {
        return locked(() -> Optional.ofNullable(embeddings.get(entityId)).map(e -> e.vector.clone()));
    }

    @Override
    public Map<String, float[]> loadEmbeddings() {
        return locked(() -> {
            Map<String, float[]> result = new LinkedHashMap<>();
            embeddings.forEach((id, e) -> result.put(id, e.vector.clone()));
            return result;
        });
    }

    // =========================================================================
    // Snapshot
    // =========================================================================

    /**
     * Current dataset in snapshot form.
     */
    Snapshot capture() {
        Snapshot s = Snapshot.empty();
        entities.values().forEach(e -> s.entities.add(Snapshot.EntityRow.of(e)));
        users.values().forEach(u -> s.users.add(Snapshot.UserRow.of(u)));
        ratings.forEach(r -> s.ratings.add(Snapshot.RatingRow.of(r)));
        comments.forEach(c -> s.comments.add(Snapshot.CommentRow.of(c)));
        history.forEach(h -> s.editHistory.add(Snapshot.HistoryRow.of(h)));
        typingSystems.forEach(t -> s.typingSystems.add(Snapshot.TypingSystemRow.of(t)));
        embeddings.forEach((id, e) -> {
            Snapshot.EmbeddingRow row = new Snapshot.EmbeddingRow();
            row.entityId = id;
            row.vector = e.vector;
            row.updatedAt = e.updatedAt;
            s.embeddings.add(row);
        });
        return s;
    }

    private void restore(Snapshot s) {
        if (s.entities != null) s.entities.forEach(r -> entities.put(requireKey(r.id, "entity"), r.toEntity()));
        if (s.users != null) s.users.forEach(r -> users.put(requireKey(r.id, "user"), r.toUser()));
        if (s.ratings != null) {
            s.ratings.forEach(r -> {
                requireKey(r.entityId, "rating");
                addRating(r.toRating());
            });
        }
        if (s.comments != null) {
            s.comments.forEach(r -> {
                requireKey(r.entityId, "comment");
                comments.add(r.toComment());
            });
        }
        if (s.editHistory != null) {
            s.editHistory.forEach(r -> {
                requireKey(r.entityId, "edit history");
                history.add(r.toRecord());
            });
        }
        if (s.typingSystems != null) s.typingSystems.forEach(r -> typingSystems.add(r.toSystem()));
        if (s.embeddings != null) {
            s.embeddings.forEach(r -> {
                if (r.vector == null) {
                    throw new IllegalStateException("embedding row without vector: " + r.entityId);
                }
                embeddings.put(requireKey(r.entityId, "embedding"), new Embedded(r.vector, r.updatedAt));
            });
        }
    }

    private void addRating(Rating rating) {
        ratings.add(rating);
        ratingsByEntity.computeIfAbsent(rating.getEntityId(), k -> new ArrayList<>()).add(rating);
    }

    private static String requireKey(String key, String row) {
        if (key == null) {
            throw new IllegalStateException(row + " row without id");
        }
        return key;
    }

    private void clear() {
        entities.clear();
        users.clear();
        ratings.clear();
        ratingsByEntity.clear();
        comments.clear();
        history.clear();
        typingSystems.clear();
        embeddings.clear();
    }

    public SnapshotFile file() {
        return file;
    }

    // =========================================================================
    // Locking and persistence
    // =========================================================================

    private <T> T locked(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply a change in memory and persist it; undo the change if the
     * snapshot cannot be written. Caller holds the lock.
     */
    private void mutate(String operation, String entityId, Runnable apply, Runnable undo) {
        apply.run();
        try {
            file.write(capture());
        } catch (IOException e) {
            undo.run();
            throw new StorageException(operation, entityId, e);
        }
    }
}
