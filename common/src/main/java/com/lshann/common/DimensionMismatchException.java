package com.lshann.common;

/**
 * Thrown when a vector's length doesn't match the configured dimension.
 */
public class DimensionMismatchException extends LshException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(ErrorKind.DIMENSION_MISMATCH,
                "Vector dimension mismatch. Expected: " + expected + ", got: " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }

    /**
     * Validates a raw vector against a dimension.
     *
     * @throws DimensionMismatchException if {@code vector} is null or has the wrong length
     */
    public static void check(float[] vector, int expected) {
        if (vector == null) {
            throw new DimensionMismatchException(expected, 0);
        }
        if (vector.length != expected) {
            throw new DimensionMismatchException(expected, vector.length);
        }
    }
}
