/**
 * Persistence for a personality typing database.
 *
 * <p>{@link org.socionics.ipdb.PersonalityStore} is the entry point: it owns
 * backend selection, the schema, the relational records and the entity
 * vector index. {@link org.socionics.ipdb.AsyncPersonalityStore} offers the
 * same operations as {@link java.util.concurrent.CompletableFuture}s.</p>
 *
 * <p>All exceptions thrown by the API extend
 * {@link org.socionics.ipdb.IpdbException} and are unchecked.</p>
 */
package org.socionics.ipdb;
