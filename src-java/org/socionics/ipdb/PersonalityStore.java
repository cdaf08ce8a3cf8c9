package org.socionics.ipdb;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.socionics.ipdb.backend.BackendCandidate;
import org.socionics.ipdb.backend.BackendHandle;
import org.socionics.ipdb.backend.BackendKind;
import org.socionics.ipdb.backend.BackendProber;
import org.socionics.ipdb.backend.EntityChanges;
import org.socionics.ipdb.backend.FieldChange;
import org.socionics.ipdb.backend.JdbcBackendCandidate;
import org.socionics.ipdb.backend.JsonCodec;
import org.socionics.ipdb.backend.SchemaManager;
import org.socionics.ipdb.backend.SqlDialect;
import org.socionics.ipdb.fallback.FallbackBackend;

/**
 * PersonalityStore - persistence for the personality database.
 *
 * <p>The single entry point for entities, ratings, comments, users, edit
 * history and entity embeddings. On {@link #initialize()} the store picks the
 * first available backend (DuckDB, then SQLite, then a JSON snapshot file),
 * ensures the schema and loads persisted embeddings into the vector index.</p>
 *
 * <h2>Basic Usage:</h2>
 * <pre>{@code
 * PersonalityStore store = PersonalityStore.builder()
 *     .dataDir(Path.of("data"))
 *     .dimensions(384)
 *     .build();
 * store.initialize();
 *
 * Entity ada = store.createEntity(NewEntity.builder("Ada Lovelace")
 *     .kind(EntityKind.PERSON)
 *     .build());
 * store.addRating(new NewRating(ada.getId(), raterId, "mbti", "INTJ", 0.8));
 * store.addEmbedding(ada.getId(), embedding);
 *
 * List<SimilarityResult> similar = store.vectorSearch(query, 10);
 * store.close();
 * }</pre>
 *
 * <h2>Thread Safety:</h2>
 * <p>All operations are thread-safe. Relational calls are serialized by the
 * backend's record store; the vector index allows concurrent searches and
 * exclusive writes.</p>
 *
 * <p>Validation happens before any write, so invalid input never leaves
 * partial state behind. Backend failures surface as {@link StorageException}.</p>
 *
 * @see StoreConfig
 * @see AsyncPersonalityStore
 */
public class PersonalityStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PersonalityStore.class);

    private final StoreConfig config;
    private final BackendProber prober;
    private final MonotonicClock clock;

    private volatile StoreState state = StoreState.UNINITIALIZED;
    private volatile StoreContext context;

    PersonalityStore(StoreConfig config) {
        this(config, defaultProber(config));
    }

    PersonalityStore(StoreConfig config, BackendProber prober) {
        this.config = config;
        this.prober = prober;
        this.clock = new MonotonicClock(config.getClock());
    }

    private static BackendProber defaultProber(StoreConfig config) {
        List<BackendCandidate> candidates = new ArrayList<>();
        for (BackendKind kind : config.getBackends()) {
            if (kind == BackendKind.FALLBACK) continue;
            candidates.add(new JdbcBackendCandidate(SqlDialect.forKind(kind), config.fileFor(kind)));
        }
        return new BackendProber(candidates,
                () -> FallbackBackend.open(config.fileFor(BackendKind.FALLBACK)));
    }

    // ==========================================================================
    // Lifecycle
    // ==========================================================================

    /**
     * Select a backend, ensure the schema and load the vector index.
     *
     * <p>Idempotent: calling it on an operational store does nothing.</p>
     *
     * @throws NotInitializedException if the store was closed
     * @throws StorageException if the selected backend rejects the schema
     */
    public synchronized void initialize() {
        if (state == StoreState.OPERATIONAL) {
            return;
        }
        if (state == StoreState.CLOSED) {
            throw new NotInitializedException("Store is closed; create a new instance");
        }

        state = StoreState.PROBING;
        BackendHandle handle = prober.selectBackend();
        try {
            SchemaManager.ensureSchema(handle);
            state = StoreState.SCHEMA_READY;

            EntityVectorIndex vectors = EntityVectorIndex.build(config, config.getCapacity(),
                    handle.recordStore().loadEmbeddings(), true);
            context = new StoreContext(handle, vectors, handle.recordStore().listTypingSystems());
            state = StoreState.OPERATIONAL;
            logger.info("Personality store operational on {} backend ({} embeddings indexed)",
                    handle.kind(), vectors.size());
        } catch (RuntimeException e) {
            handle.close();
            state = StoreState.UNINITIALIZED;
            throw e;
        }
    }

    /**
     * Release the backend. Afterwards every operation fails with
     * {@link NotInitializedException}. Idempotent.
     */
    @Override
    public synchronized void close() {
        if (state == StoreState.CLOSED) {
            return;
        }
        StoreContext ctx = context;
        context = null;
        state = StoreState.CLOSED;
        if (ctx != null) {
            ctx.close();
            logger.info("Personality store on {} backend closed", ctx.handle.kind());
        }
    }

    public StoreState getState() {
        return state;
    }

    public StoreConfig getConfig() {
        return config;
    }

    /**
     * The backend selected by {@link #initialize()}.
     */
    public BackendKind getBackendKind() {
        return context().handle.kind();
    }

    private StoreContext context() {
        StoreContext ctx = context;
        if (ctx == null) {
            throw new NotInitializedException(state == StoreState.CLOSED
                    ? "Store is closed"
                    : "Store is not initialized; call initialize() first");
        }
        return ctx;
    }

    // ==========================================================================
    // Entities
    // ==========================================================================

    /**
     * Create an entity. An id is assigned unless the payload carries one.
     *
     * @return the stored entity
     * @throws ValidationException if the name is empty, the id is taken or only
     *                             half of the external reference is given
     */
    public Entity createEntity(NewEntity data) {
        StoreContext ctx = context();
        if (data == null) {
            throw new ValidationException("Entity data is required");
        }
        if (isBlank(data.getName())) {
            throw new ValidationException("Entity name must not be empty");
        }
        if (isBlank(data.getExternalSource()) != isBlank(data.getExternalId())) {
            throw new ValidationException("External source and external id must be given together");
        }

        String id = data.getId();
        if (id == null) {
            id = UUID.randomUUID().toString();
        } else if (id.isBlank()) {
            throw new ValidationException("Entity id must not be blank");
        } else if (ctx.records.entityExists(id)) {
            throw new ValidationException("Entity id already exists: " + id);
        }

        Instant now = clock.next();
        Entity entity = Entity.builder()
                .id(id)
                .name(data.getName())
                .description(data.getDescription())
                .kind(data.getKind())
                .category(data.getCategory())
                .source(data.getSource())
                .notes(data.getNotes())
                .externalSource(blankToNull(data.getExternalSource()))
                .externalId(blankToNull(data.getExternalId()))
                .metadata(JsonCodec.normalizeMetadata(data.getMetadata()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        ctx.records.insertEntity(entity);
        logger.debug("Created entity {} ({})", id, entity.getName());
        return ctx.records.findEntity(id).orElse(entity);
    }

    /**
     * @throws NotFoundException if no entity has this id
     */
    public Entity getEntity(String id) {
        StoreContext ctx = context();
        requireId(id, "Entity id");
        return ctx.records.findEntity(id).orElseThrow(() -> new NotFoundException("entity", id));
    }

    /**
     * Look up an entity by the reference of the source it was imported from.
     */
    public Optional<Entity> findEntityByExternalId(String externalSource, String externalId) {
        StoreContext ctx = context();
        requireId(externalSource, "External source");
        requireId(externalId, "External id");
        return ctx.records.findEntityByExternalId(externalSource, externalId);
    }

    /**
     * List entities matching a query, each with its rating count and type
     * assignments.
     *
     * @param query filter, sort and page; null lists the first page by name
     */
    public List<Entity> listEntities(EntityQuery query) {
        StoreContext ctx = context();
        return ctx.records.listEntities(query == null ? EntityQuery.all() : query);
    }

    /**
     * Apply changes to the mutable fields (name, description, category,
     * source, notes). Every changed field gets an edit-history record; other
     * keys are ignored.
     *
     * @param fields new values by field name
     * @param actingUserId user making the change, may be null
     * @return the refreshed entity
     * @throws NotFoundException if no entity has this id
     * @throws ValidationException if the new name is empty
     */
    public Entity updateEntity(String id, Map<String, ?> fields, String actingUserId) {
        StoreContext ctx = context();
        requireId(id, "Entity id");
        if (fields == null) {
            throw new ValidationException("Update fields are required");
        }
        EntityChanges.validate(fields);

        List<FieldChange> changes = ctx.records.updateEntity(id, fields, actingUserId, clock.next());
        if (!changes.isEmpty()) {
            logger.debug("Updated entity {}: {} field(s) changed", id, changes.size());
        }
        return getEntity(id);
    }

    // ==========================================================================
    // Users
    // ==========================================================================

    /**
     * Register a user. Display name defaults to the username, role to
     * annotator and experience to novice.
     *
     * @throws ValidationException if the username is empty or taken
     */
    public User createUser(NewUser data) {
        StoreContext ctx = context();
        if (data == null || isBlank(data.getUsername())) {
            throw new ValidationException("Username must not be empty");
        }
        String username = data.getUsername().trim();
        if (ctx.records.findUserByUsername(username).isPresent()) {
            throw new ValidationException("Username already taken: " + username);
        }
        User user = new User(
                UUID.randomUUID().toString(),
                username,
                isBlank(data.getDisplayName()) ? username : data.getDisplayName(),
                data.getRole() == null ? UserRole.ANNOTATOR : data.getRole(),
                data.getExperienceLevel() == null ? ExperienceLevel.NOVICE : data.getExperienceLevel(),
                clock.next());
        ctx.records.insertUser(user);
        return user;
    }

    /**
     * @throws NotFoundException if no user has this id
     */
    public User getUser(String id) {
        StoreContext ctx = context();
        requireId(id, "User id");
        return ctx.records.findUser(id).orElseThrow(() -> new NotFoundException("user", id));
    }

    // ==========================================================================
    // Typing systems
    // ==========================================================================

    public List<TypingSystem> listTypingSystems() {
        return context().catalog;
    }

    /**
     * Add a typing system to the catalog.
     *
     * @throws ValidationException if the name exists, the type set is empty or
     *                             contains duplicate codes
     */
    public void registerTypingSystem(TypingSystem system) {
        StoreContext ctx = context();
        if (system == null || isBlank(system.getName())) {
            throw new ValidationException("Typing system name must not be empty");
        }
        if (system.getTypes().isEmpty()) {
            throw new ValidationException("Typing system " + system.getName() + " has no types");
        }
        Set<String> codes = new HashSet<>();
        for (TypeCode type : system.getTypes()) {
            if (isBlank(type.getCode()) || !codes.add(type.getCode().toLowerCase(Locale.ROOT))) {
                throw new ValidationException("Typing system " + system.getName()
                        + " has a blank or duplicate type code: " + type.getCode());
            }
        }
        synchronized (ctx) {
            if (findSystem(ctx, system.getName()).isPresent()) {
                throw new ValidationException("Typing system already exists: " + system.getName());
            }
            ctx.records.insertTypingSystem(system);
            ctx.catalog = List.copyOf(ctx.records.listTypingSystems());
        }
        logger.info("Registered typing system {} ({} types)", system.getName(), system.getTypes().size());
    }

    private static Optional<TypingSystem> findSystem(StoreContext ctx, String name) {
        if (name == null) return Optional.empty();
        String trimmed = name.trim();
        for (TypingSystem system : ctx.catalog) {
            if (system.getName().equalsIgnoreCase(trimmed)) {
                return Optional.of(system);
            }
        }
        return Optional.empty();
    }

    // ==========================================================================
    // Ratings and comments
    // ==========================================================================

    /**
     * Record a typing judgment. System and type code are matched ignoring
     * case and stored in catalog spelling.
     *
     * @return the new rating's id
     * @throws ValidationException on an unknown system or type, or a
     *                             confidence outside [0, 1]
     * @throws NotFoundException if the entity does not exist
     */
    public String addRating(NewRating data) {
        StoreContext ctx = context();
        if (data == null) {
            throw new ValidationException("Rating data is required");
        }
        requireId(data.getEntityId(), "Entity id");
        requireId(data.getUserId(), "Rater id");
        double confidence = data.getConfidence();
        if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("Confidence must be within [0, 1], got " + confidence);
        }
        TypingSystem system = findSystem(ctx, data.getSystem())
                .orElseThrow(() -> new ValidationException("Unknown typing system: " + data.getSystem()));
        TypeCode type = system.findType(data.getTypeCode())
                .orElseThrow(() -> new ValidationException(
                        "Unknown " + system.getName() + " type: " + data.getTypeCode()));
        requireEntity(ctx, data.getEntityId());

        Rating rating = new Rating(UUID.randomUUID().toString(), data.getEntityId(), data.getUserId(),
                system.getName(), type.getCode(), confidence, data.getReasoning(), clock.next());
        ctx.records.insertRating(rating);
        logger.debug("Rated entity {} as {} {} ({})", rating.getEntityId(), rating.getSystem(),
                rating.getTypeCode(), confidence);
        return rating.getId();
    }

    /**
     * Ratings of an entity, newest first. Empty for an unknown entity.
     */
    public List<Rating> listRatings(String entityId) {
        StoreContext ctx = context();
        requireId(entityId, "Entity id");
        return ctx.records.listRatings(entityId);
    }

    /**
     * @return the new comment's id
     * @throws ValidationException if the content is empty
     * @throws NotFoundException if the entity does not exist
     */
    public String addComment(String entityId, String userId, String content) {
        StoreContext ctx = context();
        requireId(entityId, "Entity id");
        requireId(userId, "User id");
        if (isBlank(content)) {
            throw new ValidationException("Comment must not be empty");
        }
        requireEntity(ctx, entityId);

        Comment comment = new Comment(UUID.randomUUID().toString(), entityId, userId, null,
                content, clock.next());
        ctx.records.insertComment(comment);
        return comment.getId();
    }

    /**
     * Comments on an entity, newest first. Empty for an unknown entity.
     */
    public List<Comment> listComments(String entityId) {
        StoreContext ctx = context();
        requireId(entityId, "Entity id");
        return ctx.records.listComments(entityId);
    }

    /**
     * Field changes of an entity, newest first. Empty for an unknown entity.
     */
    public List<EditHistoryRecord> listEditHistory(String entityId) {
        StoreContext ctx = context();
        requireId(entityId, "Entity id");
        return ctx.records.listEditHistory(entityId);
    }

    public StoreStats stats() {
        return context().records.stats();
    }

    // ==========================================================================
    // Embeddings
    // ==========================================================================

    /**
     * Store an entity's embedding, replacing any previous one. The replaced
     * vector is never returned by searches again.
     *
     * @throws DimensionMismatchException if the vector has the wrong length
     * @throws ValidationException if the vector is zero or not finite
     * @throws NotFoundException if the entity does not exist
     * @throws CapacityExceededException if the index is full
     */
    public void addEmbedding(String entityId, float[] vector) {
        StoreContext ctx = context();
        requireId(entityId, "Entity id");
        validateVector(vector, "Embedding");
        requireEntity(ctx, entityId);

        ctx.vectorLock.writeLock().lock();
        try {
            ctx.vectors.checkCapacity(entityId);
            ctx.records.saveEmbedding(entityId, vector, clock.next());
            ctx.vectors.put(entityId, vector);
        } finally {
            ctx.vectorLock.writeLock().unlock();
        }
        logger.debug("Indexed embedding of entity {}", entityId);
    }

    /**
     * The persisted embedding of an entity, as it was given.
     */
    public Optional<float[]> getEmbedding(String entityId) {
        StoreContext ctx = context();
        requireId(entityId, "Entity id");
        return ctx.records.findEmbedding(entityId);
    }

    /**
     * The k entities nearest to a query vector, by descending similarity with
     * ties broken by entity id. Empty if the index is empty or k is 0 or less.
     *
     * @throws DimensionMismatchException if the query has the wrong length
     */
    public List<SimilarityResult> vectorSearch(float[] query, int k) {
        StoreContext ctx = context();
        validateVector(query, "Query");
        ctx.vectorLock.readLock().lock();
        try {
            return ctx.vectors.search(query, k, null);
        } finally {
            ctx.vectorLock.readLock().unlock();
        }
    }

    /**
     * Like {@link #vectorSearch(float[], int)}, dropping results with a
     * similarity below {@code minSimilarity}.
     */
    public List<SimilarityResult> vectorSearch(float[] query, int k, double minSimilarity) {
        List<SimilarityResult> results = new ArrayList<>(vectorSearch(query, k));
        results.removeIf(r -> r.getSimilarity() < minSimilarity);
        return results;
    }

    /**
     * The k entities nearest to an entity's own embedding, excluding itself.
     *
     * @throws NotFoundException if the entity has no embedding
     */
    public List<SimilarityResult> findSimilarEntities(String entityId, int k) {
        StoreContext ctx = context();
        requireId(entityId, "Entity id");
        float[] vector = ctx.records.findEmbedding(entityId)
                .orElseThrow(() -> new NotFoundException("embedding", entityId));
        ctx.vectorLock.readLock().lock();
        try {
            return ctx.vectors.search(vector, k, entityId);
        } finally {
            ctx.vectorLock.readLock().unlock();
        }
    }

    /**
     * Rebuild the vector index from persisted vectors, dropping tombstones.
     *
     * @param newCapacity maximum number of indexed entities after the rebuild
     * @throws CapacityExceededException if the persisted vectors don't fit
     */
    public VectorIndexStats rebuildVectorIndex(int newCapacity) {
        StoreContext ctx = context();
        if (newCapacity <= 0) {
            throw new ValidationException("Capacity must be positive, got " + newCapacity);
        }
        ctx.vectorLock.writeLock().lock();
        try {
            EntityVectorIndex rebuilt = EntityVectorIndex.build(config, newCapacity,
                    ctx.records.loadEmbeddings(), false);
            EntityVectorIndex old = ctx.vectors;
            ctx.vectors = rebuilt;
            old.close();
            VectorIndexStats stats = rebuilt.stats();
            logger.info("Rebuilt vector index: {}", stats);
            return stats;
        } finally {
            ctx.vectorLock.writeLock().unlock();
        }
    }

    public VectorIndexStats vectorIndexStats() {
        StoreContext ctx = context();
        ctx.vectorLock.readLock().lock();
        try {
            return ctx.vectors.stats();
        } finally {
            ctx.vectorLock.readLock().unlock();
        }
    }

    // ==========================================================================
    // Import
    // ==========================================================================

    /**
     * Import entities with their type assignments, skipping records already
     * imported from the same source.
     *
     * @param raterId user the assignments are attributed to
     */
    public ImportReport importRecords(Iterable<ImportRecord> records, String raterId) {
        context();
        return new EntityImporter(this).importRecords(records, raterId);
    }

    // ==========================================================================
    // Validation helpers
    // ==========================================================================

    private void validateVector(float[] vector, String what) {
        if (vector == null) {
            throw new ValidationException(what + " vector is required");
        }
        if (vector.length != config.getDimensions()) {
            throw new DimensionMismatchException(config.getDimensions(), vector.length);
        }
        if (!EntityVectorIndex.isUsable(vector)) {
            throw new ValidationException(what + " vector must be finite and not all zeros");
        }
    }

    private static void requireEntity(StoreContext ctx, String entityId) {
        if (!ctx.records.entityExists(entityId)) {
            throw new NotFoundException("entity", entityId);
        }
    }

    private static void requireId(String id, String what) {
        if (isBlank(id)) {
            throw new ValidationException(what + " must not be empty");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s;
    }

    // ==========================================================================
    // Builder
    // ==========================================================================

    /**
     * Create a new builder for constructing a PersonalityStore.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating PersonalityStore instances.
     */
    public static class Builder {
        private Path dataDir;
        private List<BackendKind> backends = List.of(BackendKind.ANALYTICAL, BackendKind.LIGHTWEIGHT);
        private int dimensions = StoreConfig.DEFAULT_DIMENSIONS;
        private int capacity = StoreConfig.DEFAULT_CAPACITY;
        private int m = StoreConfig.DEFAULT_M;
        private int efConstruction = StoreConfig.DEFAULT_EF_CONSTRUCTION;
        private int efSearch = StoreConfig.DEFAULT_EF_SEARCH;
        private int exactSearchThreshold = StoreConfig.DEFAULT_EXACT_SEARCH_THRESHOLD;
        private String analyticalFile = StoreConfig.DEFAULT_ANALYTICAL_FILE;
        private String lightweightFile = StoreConfig.DEFAULT_LIGHTWEIGHT_FILE;
        private String fallbackFile = StoreConfig.DEFAULT_FALLBACK_FILE;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /** Directory holding the database or snapshot files. Required. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /**
         * Native backends to probe, in order. The fallback store is always
         * tried last; an empty list selects it directly.
         */
        public Builder backends(List<BackendKind> backends) {
            this.backends = backends;
            return this;
        }

        /** Embedding dimensions (e.g., 384 for MiniLM sentence embeddings). */
        public Builder dimensions(int dimensions) {
            this.dimensions = dimensions;
            return this;
        }

        /** Maximum number of entities with an embedding. */
        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        /** Max neighbors per node. Higher improves recall but increases memory and build time. */
        public Builder m(int m) {
            this.m = m;
            return this;
        }

        /** Beam width during index construction. Higher improves quality but slows builds. */
        public Builder efConstruction(int efConstruction) {
            this.efConstruction = efConstruction;
            return this;
        }

        /** Beam width during search. Higher improves recall but increases latency. */
        public Builder efSearch(int efSearch) {
            this.efSearch = efSearch;
            return this;
        }

        /** Indexes with at most this many live vectors are searched exhaustively. */
        public Builder exactSearchThreshold(int exactSearchThreshold) {
            this.exactSearchThreshold = exactSearchThreshold;
            return this;
        }

        /** DuckDB database file name inside the data directory. */
        public Builder analyticalFile(String analyticalFile) {
            this.analyticalFile = analyticalFile;
            return this;
        }

        /** SQLite database file name inside the data directory. */
        public Builder lightweightFile(String lightweightFile) {
            this.lightweightFile = lightweightFile;
            return this;
        }

        /** Snapshot file name inside the data directory. */
        public Builder fallbackFile(String fallbackFile) {
            this.fallbackFile = fallbackFile;
            return this;
        }

        /** Time source for record timestamps. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Build the PersonalityStore. Call {@link PersonalityStore#initialize()}
         * before using it.
         * @return the configured store
         * @throws IllegalArgumentException if a setting is missing or out of range
         */
        public PersonalityStore build() {
            return new PersonalityStore(buildConfig());
        }

        StoreConfig buildConfig() {
            if (dataDir == null) {
                throw new IllegalArgumentException("dataDir must be set");
            }
            if (dimensions <= 0) {
                throw new IllegalArgumentException("dimensions must be positive, got " + dimensions);
            }
            if (capacity <= 0) {
                throw new IllegalArgumentException("capacity must be positive, got " + capacity);
            }
            if (m < 2) {
                throw new IllegalArgumentException("m must be at least 2, got " + m);
            }
            if (efConstruction <= 0 || efSearch <= 0) {
                throw new IllegalArgumentException("efConstruction and efSearch must be positive");
            }
            if (exactSearchThreshold < 0) {
                throw new IllegalArgumentException("exactSearchThreshold must not be negative");
            }
            Objects.requireNonNull(backends, "backends");
            Objects.requireNonNull(clock, "clock");
            requireFileName(analyticalFile, "analyticalFile");
            requireFileName(lightweightFile, "lightweightFile");
            requireFileName(fallbackFile, "fallbackFile");
            return new StoreConfig(dataDir, backends, dimensions, capacity, m, efConstruction,
                    efSearch, exactSearchThreshold, analyticalFile, lightweightFile, fallbackFile, clock);
        }

        private static void requireFileName(String name, String setting) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException(setting + " must not be empty");
            }
        }
    }
}
