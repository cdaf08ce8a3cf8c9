package org.socionics.ipdb;

/**
 * Thrown when a referenced entity, user or embedding does not exist.
 */
public class NotFoundException extends IpdbException {

    private final String kind;
    private final String id;

    /**
     * @param kind what was looked up ("entity", "user", "embedding")
     * @param id the identifier that was not found
     */
    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
