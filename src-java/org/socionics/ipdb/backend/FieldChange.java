package org.socionics.ipdb.backend;

import java.util.Objects;

/**
 * One mutable entity field whose value changes in an update.
 */
public final class FieldChange {

    private final String field;
    private final String oldValue;
    private final String newValue;

    public FieldChange(String field, String oldValue, String newValue) {
        this.field = field;
        this.oldValue = oldValue;
        this.newValue = newValue;
    }

    public String getField() { return field; }
    public String getOldValue() { return oldValue; }
    public String getNewValue() { return newValue; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldChange that = (FieldChange) o;
        return field.equals(that.field)
                && Objects.equals(oldValue, that.oldValue)
                && Objects.equals(newValue, that.newValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, oldValue, newValue);
    }

    @Override
    public String toString() {
        return field + ": '" + oldValue + "' -> '" + newValue + "'";
    }
}
