package com.lshann.common;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable fixed-length float vector.
 *
 * <p>Equality is by value: two points with the same components are the same point
 * for deletion and lookup purposes.</p>
 */
public final class DataPoint {

    private final float[] values;

    private DataPoint(float[] values) {
        this.values = values;
    }

    /** Copies {@code values}; later changes to the array do not affect the point. */
    public static DataPoint of(float... values) {
        Objects.requireNonNull(values, "values");
        return new DataPoint(values.clone());
    }

    public int dimension() {
        return values.length;
    }

    public float get(int i) {
        return values[i];
    }

    /** Returns a defensive copy of the components. */
    public float[] toArray() {
        return values.clone();
    }

    /** Value comparison against a raw vector without copying it. */
    public boolean sameAs(float[] other) {
        return Arrays.equals(values, other);
    }

    /** Euclidean norm. */
    public double norm() {
        return VectorMath.norm(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataPoint)) return false;
        return Arrays.equals(values, ((DataPoint) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "DataPoint" + Arrays.toString(values);
    }
}
