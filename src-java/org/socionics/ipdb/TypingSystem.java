package org.socionics.ipdb;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A personality classification scheme and its valid type codes.
 */
public final class TypingSystem {

    private final String name;
    private final String displayName;
    private final String description;
    private final List<TypeCode> types;

    /**
     * @param name lower-case system key, e.g. {@code "socionics"}
     * @param displayName human readable name
     * @param description optional description
     * @param types type codes in catalog order
     */
    public TypingSystem(String name, String displayName, String description, List<TypeCode> types) {
        this.name = Objects.requireNonNull(name, "name");
        this.displayName = displayName;
        this.description = description;
        this.types = List.copyOf(types);
    }

    public String getName() { return name; }
    public String getDisplayName() { return displayName; }
    public String getDescription() { return description; }
    public List<TypeCode> getTypes() { return types; }

    /**
     * Look up a type code, ignoring case.
     *
     * @param code code as typed by a rater
     * @return the catalog entry with its canonical spelling
     */
    public Optional<TypeCode> findType(String code) {
        if (code == null) return Optional.empty();
        String trimmed = code.trim();
        for (TypeCode type : types) {
            if (type.getCode().equalsIgnoreCase(trimmed)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypingSystem that = (TypingSystem) o;
        return name.equals(that.name)
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(description, that.description)
                && types.equals(that.types);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, types);
    }

    @Override
    public String toString() {
        return "TypingSystem{name='" + name + "', types=" + types + "}";
    }
}
