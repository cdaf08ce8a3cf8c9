/**
 * Fallback storage used when no native database can be loaded.
 *
 * <p>The dataset lives in memory and is written as one JSON snapshot after
 * every mutation. It implements the same {@link org.socionics.ipdb.backend.RecordStore}
 * contract as the SQL backends, so the facade cannot tell them apart.</p>
 */
package org.socionics.ipdb.fallback;
