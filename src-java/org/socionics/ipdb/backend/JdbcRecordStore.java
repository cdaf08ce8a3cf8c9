package org.socionics.ipdb.backend;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.socionics.ipdb.Comment;
import org.socionics.ipdb.EditHistoryRecord;
import org.socionics.ipdb.Entity;
import org.socionics.ipdb.EntityKind;
import org.socionics.ipdb.EntityQuery;
import org.socionics.ipdb.ExperienceLevel;
import org.socionics.ipdb.NotFoundException;
import org.socionics.ipdb.Rating;
import org.socionics.ipdb.StorageException;
import org.socionics.ipdb.StoreStats;
import org.socionics.ipdb.TypeAssignment;
import org.socionics.ipdb.TypeCode;
import org.socionics.ipdb.TypingSystem;
import org.socionics.ipdb.User;
import org.socionics.ipdb.UserRole;

/**
 * {@link RecordStore} over a single JDBC connection to DuckDB or SQLite.
 *
 * <p>Access to the connection is serialized by one lock. Multi-statement
 * writes (entity update with history, embedding replace, catalog insert) run
 * in a transaction. Every {@link SQLException} is rethrown as a
 * {@link StorageException} naming the operation.</p>
 */
public final class JdbcRecordStore implements RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcRecordStore.class);

    private final Connection connection;
    private final SqlDialect dialect;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean closed = false;

    @FunctionalInterface
    interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    public JdbcRecordStore(Connection connection, SqlDialect dialect) {
        this.connection = connection;
        this.dialect = dialect;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    // =========================================================================
    // Entities
    // =========================================================================

    @Override
    public void insertEntity(Entity e) {
        execute("insertEntity", e.getId(), c -> {
            update(c, "INSERT INTO entities (id, name, description, entity_type, category, source, " +
                      "personality_notes, external_id, external_source, metadata, created_at, updated_at, " +
                      "last_edited_by) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    e.getId(), e.getName(), e.getDescription(), e.getKind().getCode(), e.getCategory(),
                    e.getSource(), e.getNotes(), e.getExternalId(), e.getExternalSource(),
                    JsonCodec.writeMetadata(e.getMetadata()), millis(e.getCreatedAt()),
                    millis(e.getUpdatedAt()), e.getLastEditedBy());
            return null;
        });
    }

    @Override
    public Optional<Entity> findEntity(String id) {
        return execute("findEntity", id, c -> {
            List<Entity> rows = queryEntities(c, EntityQueryCompiler.ENTITY_SELECT + " WHERE e.id = ?", List.of(id));
            return withAssignments(c, rows).stream().findFirst();
        });
    }

    @Override
    public Optional<Entity> findEntityByExternalId(String externalSource, String externalId) {
        return execute("findEntityByExternalId", null, c -> {
            List<Entity> rows = queryEntities(c, EntityQueryCompiler.ENTITY_SELECT +
                    " WHERE e.external_source = ? AND e.external_id = ? ORDER BY e.created_at ASC, e.id ASC",
                    List.of(externalSource, externalId));
            return withAssignments(c, rows).stream().findFirst();
        });
    }

    @Override
    public boolean entityExists(String id) {
        return execute("entityExists", id, c -> exists(c, "SELECT 1 FROM entities WHERE id = ?", id));
    }

    @Override
    public List<Entity> listEntities(EntityQuery query) {
        EntityQueryCompiler.CompiledQuery compiled = EntityQueryCompiler.compile(query);
        logger.debug("listEntities: {}", compiled);
        return execute("listEntities", null, c ->
                withAssignments(c, queryEntities(c, compiled.getSql(), compiled.getParams())));
    }

    @Override
    public List<FieldChange> updateEntity(String id, Map<String, ?> fields, String userId, Instant at) {
        return transaction("updateEntity", id, c -> {
            List<Entity> rows = queryEntities(c, EntityQueryCompiler.ENTITY_SELECT + " WHERE e.id = ?", List.of(id));
            if (rows.isEmpty()) {
                throw new NotFoundException("entity", id);
            }
            List<FieldChange> changes = EntityChanges.diff(rows.get(0), fields);
            if (changes.isEmpty()) {
                return changes;
            }

            StringBuilder sql = new StringBuilder("UPDATE entities SET ");
            List<Object> params = new ArrayList<>();
            for (FieldChange change : changes) {
                sql.append(EntityChanges.column(change.getField())).append(" = ?, ");
                params.add(change.getNewValue());
            }
            sql.append("updated_at = ?, last_edited_by = ? WHERE id = ?");
            params.add(millis(at));
            params.add(userId);
            params.add(id);
            update(c, sql.toString(), params.toArray());

            for (FieldChange change : changes) {
                update(c, "INSERT INTO edit_history (id, entity_id, user_id, field_name, old_value, new_value, " +
                          "change_type, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                        UUID.randomUUID().toString(), id, userId, change.getField(),
                        change.getOldValue(), change.getNewValue(), EditHistoryRecord.UPDATE, millis(at));
            }
            return changes;
        });
    }

    private List<Entity> queryEntities(Connection c, String sql, List<Object> params) throws SQLException {
        List<Entity> result = new ArrayList<>();
        try (PreparedStatement ps = prepare(c, sql, params.toArray());
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(Entity.builder()
                        .id(rs.getString("id"))
                        .name(rs.getString("name"))
                        .description(rs.getString("description"))
                        .kind(EntityKind.fromCode(rs.getString("entity_type")))
                        .category(rs.getString("category"))
                        .source(rs.getString("source"))
                        .notes(rs.getString("personality_notes"))
                        .externalId(rs.getString("external_id"))
                        .externalSource(rs.getString("external_source"))
                        .metadata(JsonCodec.readMetadata(rs.getString("metadata")))
                        .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                        .updatedAt(Instant.ofEpochMilli(rs.getLong("updated_at")))
                        .lastEditedBy(rs.getString("last_edited_by"))
                        .ratingCount((int) rs.getLong("rating_count"))
                        .build());
            }
        }
        return result;
    }

    /**
     * Attach type assignments with one grouped query for the whole page.
     */
    private List<Entity> withAssignments(Connection c, List<Entity> entities) throws SQLException {
        if (entities.isEmpty()) {
            return entities;
        }
        List<Object> ids = new ArrayList<>();
        for (Entity e : entities) {
            ids.add(e.getId());
        }
        String placeholders = String.join(", ", Collections.nCopies(ids.size(), "?"));
        Map<String, List<TypeAssignment>> byEntity = new HashMap<>();
        try (PreparedStatement ps = prepare(c,
                "SELECT entity_id, personality_system, personality_type, COUNT(*) AS votes, " +
                "AVG(confidence) AS mean_confidence FROM ratings WHERE entity_id IN (" + placeholders + ") " +
                "GROUP BY entity_id, personality_system, personality_type", ids.toArray());
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                byEntity.computeIfAbsent(rs.getString("entity_id"), k -> new ArrayList<>())
                        .add(new TypeAssignment(rs.getString("personality_system"),
                                rs.getString("personality_type"),
                                (int) rs.getLong("votes"),
                                rs.getDouble("mean_confidence")));
            }
        }
        List<Entity> result = new ArrayList<>(entities.size());
        for (Entity e : entities) {
            List<TypeAssignment> assignments = byEntity.getOrDefault(e.getId(), new ArrayList<>());
            assignments.sort(TypeAssignment.ORDER);
            result.add(e.withRatings(e.getRatingCount(), assignments));
        }
        return result;
    }

    // =========================================================================
    // Users
    // =========================================================================

    @Override
    public void insertUser(User u) {
        execute("insertUser", null, c -> {
            update(c, "INSERT INTO users (id, username, display_name, role, experience_level, created_at) " +
                      "VALUES (?, ?, ?, ?, ?, ?)",
                    u.getId(), u.getUsername(), u.getDisplayName(), u.getRole().getCode(),
                    u.getExperienceLevel().getCode(), millis(u.getCreatedAt()));
            return null;
        });
    }

    @Override
    public Optional<User> findUser(String id) {
        return execute("findUser", null, c -> queryUser(c, "id", id));
    }

    @Override
    public Optional<User> findUserByUsername(String username) {
        return execute("findUserByUsername", null, c -> queryUser(c, "username", username));
    }

    private Optional<User> queryUser(Connection c, String column, String value) throws SQLException {
        try (PreparedStatement ps = prepare(c, "SELECT id, username, display_name, role, experience_level, " +
                                               "created_at FROM users WHERE " + column + " = ?", value);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new User(rs.getString("id"), rs.getString("username"),
                    rs.getString("display_name"), UserRole.fromCode(rs.getString("role")),
                    ExperienceLevel.fromCode(rs.getString("experience_level")),
                    Instant.ofEpochMilli(rs.getLong("created_at"))));
        }
    }

    // =========================================================================
    // Ratings, comments, history
    // =========================================================================

    @Override
    public void insertRating(Rating r) {
        execute("insertRating", r.getEntityId(), c -> {
            update(c, "INSERT INTO ratings (id, entity_id, user_id, personality_system, personality_type, " +
                      "confidence, reasoning, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    r.getId(), r.getEntityId(), r.getUserId(), r.getSystem(), r.getTypeCode(),
                    r.getConfidence(), r.getReasoning(), millis(r.getCreatedAt()));
            return null;
        });
    }

    @Override
    public List<Rating> listRatings(String entityId) {
        return execute("listRatings", entityId, c -> {
            List<Rating> result = new ArrayList<>();
            try (PreparedStatement ps = prepare(c, "SELECT id, entity_id, user_id, personality_system, " +
                    "personality_type, confidence, reasoning, created_at FROM ratings WHERE entity_id = ? " +
                    "ORDER BY created_at DESC, id DESC", entityId);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new Rating(rs.getString("id"), rs.getString("entity_id"), rs.getString("user_id"),
                            rs.getString("personality_system"), rs.getString("personality_type"),
                            rs.getDouble("confidence"), rs.getString("reasoning"),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                }
            }
            return result;
        });
    }

    @Override
    public void insertComment(Comment cm) {
        execute("insertComment", cm.getEntityId(), c -> {
            update(c, "INSERT INTO comments (id, entity_id, user_id, content, created_at) VALUES (?, ?, ?, ?, ?)",
                    cm.getId(), cm.getEntityId(), cm.getUserId(), cm.getContent(), millis(cm.getCreatedAt()));
            return null;
        });
    }

    @Override
    public List<Comment> listComments(String entityId) {
        return execute("listComments", entityId, c -> {
            List<Comment> result = new ArrayList<>();
            try (PreparedStatement ps = prepare(c, "SELECT c.id, c.entity_id, c.user_id, u.display_name, " +
                    "c.content, c.created_at FROM comments c LEFT JOIN users u ON u.id = c.user_id " +
                    "WHERE c.entity_id = ? ORDER BY c.created_at DESC, c.id DESC", entityId);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new Comment(rs.getString("id"), rs.getString("entity_id"), rs.getString("user_id"),
                            rs.getString("display_name"), rs.getString("content"),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                }
            }
            return result;
        });
    }

    @Override
    public List<EditHistoryRecord> listEditHistory(String entityId) {
        return execute("listEditHistory", entityId, c -> {
            List<EditHistoryRecord> result = new ArrayList<>();
            try (PreparedStatement ps = prepare(c, "SELECT h.id, h.entity_id, h.user_id, u.display_name, " +
                    "h.field_name, h.old_value, h.new_value, h.change_type, h.created_at FROM edit_history h " +
                    "LEFT JOIN users u ON u.id = h.user_id WHERE h.entity_id = ? " +
                    "ORDER BY h.created_at DESC, h.field_name ASC", entityId);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new EditHistoryRecord(rs.getString("id"), rs.getString("entity_id"),
                            rs.getString("user_id"), rs.getString("display_name"), rs.getString("field_name"),
                            rs.getString("old_value"), rs.getString("new_value"), rs.getString("change_type"),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                }
            }
            return result;
        });
    }

    // =========================================================================
    // Reference catalog
    // =========================================================================

    @Override
    public List<TypingSystem> listTypingSystems() {
        return execute("listTypingSystems", null, c -> {
            Map<String, List<TypeCode>> codes = new HashMap<>();
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery(
                         "SELECT system_name, code, name FROM type_codes ORDER BY system_name, sort_order")) {
                while (rs.next()) {
                    codes.computeIfAbsent(rs.getString("system_name"), k -> new ArrayList<>())
                            .add(new TypeCode(rs.getString("code"), rs.getString("name")));
                }
            }
            List<TypingSystem> systems = new ArrayList<>();
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery(
                         "SELECT name, display_name, description FROM typing_systems ORDER BY sort_order, name")) {
                while (rs.next()) {
                    String name = rs.getString("name");
                    systems.add(new TypingSystem(name, rs.getString("display_name"),
                            rs.getString("description"), codes.getOrDefault(name, List.of())));
                }
            }
            return systems;
        });
    }

    @Override
    public void insertTypingSystem(TypingSystem system) {
        transaction("insertTypingSystem", null, c -> {
            int order;
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM typing_systems")) {
                rs.next();
                order = (int) rs.getLong(1);
            }
            update(c, "INSERT INTO typing_systems (name, display_name, description, sort_order) VALUES (?, ?, ?, ?)",
                    system.getName(), system.getDisplayName(), system.getDescription(), order);
            int position = 0;
            for (TypeCode type : system.getTypes()) {
                update(c, "INSERT INTO type_codes (system_name, code, name, sort_order) VALUES (?, ?, ?, ?)",
                        system.getName(), type.getCode(), type.getName(), position++);
            }
            return null;
        });
    }

    @Override
    public StoreStats stats() {
        return execute("stats", null, c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT " +
                         "(SELECT COUNT(*) FROM entities), (SELECT COUNT(*) FROM users), " +
                         "(SELECT COUNT(*) FROM type_codes), (SELECT COUNT(*) FROM ratings), " +
                         "(SELECT COUNT(*) FROM comments)")) {
                rs.next();
                return new StoreStats(rs.getLong(1), rs.getLong(2), rs.getLong(3), rs.getLong(4), rs.getLong(5));
            }
        });
    }

    // =========================================================================
    // Embeddings
    // =========================================================================

    @Override
    public void saveEmbedding(String entityId, float[] vector, Instant at) {
        String json = JsonCodec.writeVector(vector);
        transaction("saveEmbedding", entityId, c -> {
            int updated = update(c, "UPDATE embeddings SET dimensions = ?, vector_json = ?, updated_at = ? " +
                                    "WHERE entity_id = ?", vector.length, json, millis(at), entityId);
            if (updated == 0) {
                update(c, "INSERT INTO embeddings (entity_id, dimensions, vector_json, updated_at) " +
                          "VALUES (?, ?, ?, ?)", entityId, vector.length, json, millis(at));
            }
            return null;
        });
    }

    @Override
    public Optional<float[]> findEmbedding(String entityId) {
        return execute("findEmbedding", entityId, c -> {
            try (PreparedStatement ps = prepare(c, "SELECT vector_json FROM embeddings WHERE entity_id = ?", entityId);
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(JsonCodec.readVector(rs.getString(1))) : Optional.empty();
            }
        });
    }

    @Override
    public Map<String, float[]> loadEmbeddings() {
        return execute("loadEmbeddings", null, c -> {
            Map<String, float[]> result = new LinkedHashMap<>();
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT entity_id, vector_json FROM embeddings ORDER BY entity_id")) {
                while (rs.next()) {
                    result.put(rs.getString(1), JsonCodec.readVector(rs.getString(2)));
                }
            }
            return result;
        });
    }

    // =========================================================================
    // Schema support
    // =========================================================================

    /**
     * Run DDL statements in order. Used by {@link SchemaManager}.
     */
    void executeDdl(List<String> statements) {
        execute("ensureSchema", null, c -> {
            try (Statement st = c.createStatement()) {
                for (String ddl : statements) {
                    logger.debug("DDL: {}", ddl);
                    st.execute(ddl);
                }
            }
            return null;
        });
    }

    void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            connection.close();
        } catch (SQLException e) {
            throw new StorageException("close", e);
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    // JDBC plumbing
    // =========================================================================

    private <T> T execute(String operation, String entityId, SqlWork<T> work) {
        lock.lock();
        try {
            checkOpen();
            return work.run(connection);
        } catch (SQLException e) {
            throw new StorageException(operation, entityId, e);
        } finally {
            lock.unlock();
        }
    }

    private <T> T transaction(String operation, String entityId, SqlWork<T> work) {
        lock.lock();
        try {
            checkOpen();
            connection.setAutoCommit(false);
            try {
                T result = work.run(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(operation, e);
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException(operation, entityId, e);
        } finally {
            lock.unlock();
        }
    }

    private void rollbackQuietly(String operation, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            // Report the original failure
            cause.addSuppressed(e);
            logger.warn("Rollback of {} failed: {}", operation, e.getMessage());
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Record store is closed");
        }
    }

    private static PreparedStatement prepare(Connection c, String sql, Object... params) throws SQLException {
        PreparedStatement ps = c.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                Object p = params[i];
                if (p == null) {
                    ps.setNull(i + 1, Types.VARCHAR);
                } else {
                    ps.setObject(i + 1, p);
                }
            }
            return ps;
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }

    private static int update(Connection c, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = prepare(c, sql, params)) {
            return ps.executeUpdate();
        }
    }

    private static boolean exists(Connection c, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = prepare(c, sql, params);
             ResultSet rs = ps.executeQuery()) {
            return rs.next();
        }
    }

    private static Long millis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }
}
