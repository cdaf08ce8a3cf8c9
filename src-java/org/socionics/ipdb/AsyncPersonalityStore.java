package org.socionics.ipdb;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Non-blocking view of a {@link PersonalityStore}.
 *
 * <p>Every operation runs on the given executor and completes the returned
 * future with the result, or exceptionally with the same exception the
 * blocking call would throw (wrapped in a
 * {@link java.util.concurrent.CompletionException} by {@code join()}).
 * There is no cancellation: cancelling a future does not stop the work.</p>
 */
public final class AsyncPersonalityStore {

    private final PersonalityStore store;
    private final Executor executor;

    public AsyncPersonalityStore(PersonalityStore store, Executor executor) {
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * The blocking store behind this view.
     */
    public PersonalityStore blocking() {
        return store;
    }

    public CompletableFuture<Void> initialize() {
        return run(store::initialize);
    }

    public CompletableFuture<Entity> createEntity(NewEntity data) {
        return supply(() -> store.createEntity(data));
    }

    public CompletableFuture<Entity> getEntity(String id) {
        return supply(() -> store.getEntity(id));
    }

    public CompletableFuture<Optional<Entity>> findEntityByExternalId(String externalSource, String externalId) {
        return supply(() -> store.findEntityByExternalId(externalSource, externalId));
    }

    public CompletableFuture<List<Entity>> listEntities(EntityQuery query) {
        return supply(() -> store.listEntities(query));
    }

    public CompletableFuture<Entity> updateEntity(String id, Map<String, ?> fields, String actingUserId) {
        return supply(() -> store.updateEntity(id, fields, actingUserId));
    }

    public CompletableFuture<User> createUser(NewUser data) {
        return supply(() -> store.createUser(data));
    }

    public CompletableFuture<User> getUser(String id) {
        return supply(() -> store.getUser(id));
    }

    public CompletableFuture<List<TypingSystem>> listTypingSystems() {
        return supply(store::listTypingSystems);
    }

    public CompletableFuture<Void> registerTypingSystem(TypingSystem system) {
        return run(() -> store.registerTypingSystem(system));
    }

    public CompletableFuture<String> addRating(NewRating data) {
        return supply(() -> store.addRating(data));
    }

    public CompletableFuture<List<Rating>> listRatings(String entityId) {
        return supply(() -> store.listRatings(entityId));
    }

    public CompletableFuture<String> addComment(String entityId, String userId, String content) {
        return supply(() -> store.addComment(entityId, userId, content));
    }

    public CompletableFuture<List<Comment>> listComments(String entityId) {
        return supply(() -> store.listComments(entityId));
    }

    public CompletableFuture<List<EditHistoryRecord>> listEditHistory(String entityId) {
        return supply(() -> store.listEditHistory(entityId));
    }

    public CompletableFuture<StoreStats> stats() {
        return supply(store::stats);
    }

    public CompletableFuture<Void> addEmbedding(String entityId, float[] vector) {
        return run(() -> store.addEmbedding(entityId, vector));
    }

    public CompletableFuture<Optional<float[]>> getEmbedding(String entityId) {
        return supply(() -> store.getEmbedding(entityId));
    }

    public CompletableFuture<List<SimilarityResult>> vectorSearch(float[] query, int k) {
        return supply(() -> store.vectorSearch(query, k));
    }

    public CompletableFuture<List<SimilarityResult>> vectorSearch(float[] query, int k, double minSimilarity) {
        return supply(() -> store.vectorSearch(query, k, minSimilarity));
    }

    public CompletableFuture<List<SimilarityResult>> findSimilarEntities(String entityId, int k) {
        return supply(() -> store.findSimilarEntities(entityId, k));
    }

    public CompletableFuture<VectorIndexStats> rebuildVectorIndex(int newCapacity) {
        return supply(() -> store.rebuildVectorIndex(newCapacity));
    }

    public CompletableFuture<VectorIndexStats> vectorIndexStats() {
        return supply(store::vectorIndexStats);
    }

    public CompletableFuture<ImportReport> importRecords(Iterable<ImportRecord> records, String raterId) {
        return supply(() -> store.importRecords(records, raterId));
    }

    public CompletableFuture<Void> close() {
        return run(store::close);
    }

    private <T> CompletableFuture<T> supply(Supplier<T> operation) {
        return CompletableFuture.supplyAsync(operation, executor);
    }

    private CompletableFuture<Void> run(Runnable operation) {
        return CompletableFuture.runAsync(operation, executor);
    }
}
