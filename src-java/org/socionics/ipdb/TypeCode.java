package org.socionics.ipdb;

import java.util.Objects;

/**
 * A type within a typing system, e.g. {@code ILE} ("Intuitive-Logical Extravert").
 */
public final class TypeCode {

    private final String code;
    private final String name;

    public TypeCode(String code, String name) {
        this.code = Objects.requireNonNull(code, "code");
        this.name = name;
    }

    public String getCode() { return code; }

    /**
     * @return descriptive name, or null
     */
    public String getName() { return name; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeCode that = (TypeCode) o;
        return code.equals(that.code) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, name);
    }

    @Override
    public String toString() {
        return code;
    }
}
