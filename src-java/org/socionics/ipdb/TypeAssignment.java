package org.socionics.ipdb;

import java.util.Comparator;
import java.util.Objects;

/**
 * Aggregate of all ratings that gave an entity the same type in one system.
 */
public final class TypeAssignment {

    /** System ascending, votes descending, type code ascending. */
    public static final Comparator<TypeAssignment> ORDER =
            Comparator.comparing(TypeAssignment::getSystem)
                    .thenComparing(Comparator.comparingInt(TypeAssignment::getVotes).reversed())
                    .thenComparing(TypeAssignment::getTypeCode);

    private final String system;
    private final String typeCode;
    private final int votes;
    private final double meanConfidence;

    public TypeAssignment(String system, String typeCode, int votes, double meanConfidence) {
        this.system = system;
        this.typeCode = typeCode;
        this.votes = votes;
        this.meanConfidence = meanConfidence;
    }

    public String getSystem() { return system; }
    public String getTypeCode() { return typeCode; }

    /**
     * @return number of ratings with this type
     */
    public int getVotes() { return votes; }

    /**
     * @return average confidence of those ratings
     */
    public double getMeanConfidence() { return meanConfidence; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeAssignment that = (TypeAssignment) o;
        // Averages are computed by different engines; compare to float precision
        return votes == that.votes
                && system.equals(that.system)
                && typeCode.equals(that.typeCode)
                && Math.abs(meanConfidence - that.meanConfidence) < 1e-9;
    }

    @Override
    public int hashCode() {
        return Objects.hash(system, typeCode, votes);
    }

    @Override
    public String toString() {
        return system + ":" + typeCode + "x" + votes;
    }
}
