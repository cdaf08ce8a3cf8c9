package org.socionics.ipdb.backend;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.socionics.ipdb.StorageException;
import org.socionics.ipdb.TypingSystem;

/**
 * Creates the relation set and seeds the typing-system catalog.
 *
 * <p>Safe to run on every startup: all DDL is {@code IF NOT EXISTS} and
 * seed systems are only inserted when missing by name. A backend rejecting DDL outright is
 * fatal and propagates as {@link StorageException}.</p>
 *
 * <p>The fallback store has no relations to create; only the catalog seeding
 * applies to it.</p>
 */
public final class SchemaManager {

    private static final Logger logger = LoggerFactory.getLogger(SchemaManager.class);

    /** Classpath resource holding the seed catalog. */
    static final String SEED_RESOURCE = "typing-systems.json";

    private SchemaManager() {}

    public static void ensureSchema(BackendHandle handle) {
        if (handle instanceof JdbcBackendHandle) {
            JdbcBackendHandle jdbc = (JdbcBackendHandle) handle;
            List<String> ddl = ddl(jdbc.dialect());
            jdbc.recordStore().executeDdl(ddl);
            logger.debug("Schema ensured on {} ({} statements)", handle.describe(), ddl.size());
        }
        seedCatalog(handle.recordStore());
    }

    /**
     * DDL for a dialect, tables first, then indexes.
     */
    static List<String> ddl(SqlDialect dialect) {
        return List.of(
            "CREATE TABLE IF NOT EXISTS entities (" +
                dialect.entityIdColumn() + ", " +
                "name VARCHAR NOT NULL, " +
                "description VARCHAR, " +
                "entity_type VARCHAR NOT NULL, " +
                "category VARCHAR, " +
                "source VARCHAR, " +
                "personality_notes VARCHAR, " +
                "external_id VARCHAR, " +
                "external_source VARCHAR, " +
                "metadata VARCHAR, " +
                "created_at BIGINT NOT NULL, " +
                "updated_at BIGINT NOT NULL, " +
                "last_edited_by VARCHAR)",

            "CREATE TABLE IF NOT EXISTS users (" +
                "id VARCHAR PRIMARY KEY, " +
                "username VARCHAR NOT NULL UNIQUE, " +
                "display_name VARCHAR, " +
                "role VARCHAR NOT NULL, " +
                "experience_level VARCHAR NOT NULL, " +
                "created_at BIGINT NOT NULL)",

            "CREATE TABLE IF NOT EXISTS ratings (" +
                "id VARCHAR PRIMARY KEY, " +
                "entity_id VARCHAR NOT NULL, " +
                "user_id VARCHAR, " +
                "personality_system VARCHAR NOT NULL, " +
                "personality_type VARCHAR NOT NULL, " +
                "confidence DOUBLE NOT NULL, " +
                "reasoning VARCHAR, " +
                "created_at BIGINT NOT NULL)",

            "CREATE TABLE IF NOT EXISTS comments (" +
                "id VARCHAR PRIMARY KEY, " +
                "entity_id VARCHAR NOT NULL, " +
                "user_id VARCHAR, " +
                "content VARCHAR NOT NULL, " +
                "created_at BIGINT NOT NULL)",

            "CREATE TABLE IF NOT EXISTS edit_history (" +
                "id VARCHAR PRIMARY KEY, " +
                "entity_id VARCHAR NOT NULL, " +
                "user_id VARCHAR, " +
                "field_name VARCHAR NOT NULL, " +
                "old_value VARCHAR, " +
                "new_value VARCHAR, " +
                "change_type VARCHAR NOT NULL DEFAULT 'update', " +
                "created_at BIGINT NOT NULL)",

            "CREATE TABLE IF NOT EXISTS typing_systems (" +
                "name VARCHAR PRIMARY KEY, " +
                "display_name VARCHAR, " +
                "description VARCHAR, " +
                "sort_order INTEGER NOT NULL)",

            "CREATE TABLE IF NOT EXISTS type_codes (" +
                "system_name VARCHAR NOT NULL, " +
                "code VARCHAR NOT NULL, " +
                "name VARCHAR, " +
                "sort_order INTEGER NOT NULL, " +
                "PRIMARY KEY (system_name, code))",

            "CREATE TABLE IF NOT EXISTS embeddings (" +
                "entity_id VARCHAR PRIMARY KEY, " +
                "dimensions INTEGER NOT NULL, " +
                "vector_json VARCHAR NOT NULL, " +
                "updated_at BIGINT NOT NULL)",

            "CREATE INDEX IF NOT EXISTS idx_entities_name ON entities(name)",
            "CREATE INDEX IF NOT EXISTS idx_entities_category ON entities(category)",
            "CREATE INDEX IF NOT EXISTS idx_entities_external ON entities(external_source, external_id)",
            "CREATE INDEX IF NOT EXISTS idx_ratings_entity ON ratings(entity_id)",
            "CREATE INDEX IF NOT EXISTS idx_comments_entity ON comments(entity_id)",
            "CREATE INDEX IF NOT EXISTS idx_edit_history_entity ON edit_history(entity_id)"
        );
    }

    /**
     * Insert every seed system not yet in the catalog, matched by name.
     *
     * @return number of systems inserted
     */
    static int seedCatalog(RecordStore store) {
        Set<String> present = new HashSet<>();
        for (TypingSystem system : store.listTypingSystems()) {
            present.add(system.getName());
        }
        int inserted = 0;
        for (TypingSystem system : loadSeedCatalog()) {
            if (!present.contains(system.getName())) {
                store.insertTypingSystem(system);
                inserted++;
            }
        }
        if (inserted > 0) {
            logger.info("Seeded typing-system catalog: {} systems", inserted);
        }
        return inserted;
    }

    /**
     * The bundled catalog: socionics, mbti and enneagram.
     */
    public static List<TypingSystem> loadSeedCatalog() {
        try (InputStream in = SchemaManager.class.getResourceAsStream(SEED_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + SEED_RESOURCE);
            }
            return JsonCodec.readTypingSystems(in);
        } catch (IOException e) {
            throw new StorageException("seedCatalog", e);
        }
    }
}
