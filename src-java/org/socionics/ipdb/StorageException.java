package org.socionics.ipdb;

/**
 * Wraps a backend failure (a driver rejecting a statement, an IO error writing
 * the snapshot) with the operation that failed and, where known, the entity.
 */
public class StorageException extends IpdbException {

    private final String operation;
    private final String entityId;

    public StorageException(String operation, String entityId, Throwable cause) {
        super(operation + " failed" + (entityId != null ? " for entity " + entityId : "")
                + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.entityId = entityId;
    }

    public StorageException(String operation, Throwable cause) {
        this(operation, null, cause);
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return the entity involved, or null
     */
    public String getEntityId() {
        return entityId;
    }
}
