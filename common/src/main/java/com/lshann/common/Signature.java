package com.lshann.common;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * Hash output of one vector under one hasher: one integer per projection.
 * Used as the bucket key within a table.
 */
public final class Signature {

    private final int[] components;
    private final int hash;

    private Signature(int[] components) {
        this.components = components;
        this.hash = Arrays.hashCode(components);
    }

    public static Signature of(int... components) {
        Objects.requireNonNull(components, "components");
        return new Signature(components.clone());
    }

    /** Decodes the big-endian layout written by {@link #writeTo(ByteBuffer)}. */
    public static Signature read(ByteBuffer buf, int length) {
        int[] c = new int[length];
        for (int i = 0; i < length; i++) {
            c[i] = buf.getInt();
        }
        return new Signature(c);
    }

    public int length() {
        return components.length;
    }

    public int get(int i) {
        return components[i];
    }

    public int[] toArray() {
        return components.clone();
    }

    public void writeTo(ByteBuffer buf) {
        for (int c : components) {
            buf.putInt(c);
        }
    }

    /** Number of bytes {@link #writeTo(ByteBuffer)} produces. */
    public int byteSize() {
        return components.length * Integer.BYTES;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signature)) return false;
        Signature other = (Signature) o;
        return hash == other.hash && Arrays.equals(components, other.components);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "Signature" + Arrays.toString(components);
    }
}
