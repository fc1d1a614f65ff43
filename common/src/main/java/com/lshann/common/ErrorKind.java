package com.lshann.common;

/**
 * Failure categories surfaced by the index and its collaborators.
 */
public enum ErrorKind {
    /** Bad construction arguments: zero dimension, non-positive bucket width, malformed MIPS bounds. */
    INVALID_PARAMETER,
    /** A vector whose length differs from the configured dimension. */
    DIMENSION_MISMATCH,
    /** No bucket exists for a signature in a table. Absorbed inside the query path. */
    BUCKET_NOT_FOUND,
    /** A storage operation failed unexpectedly. */
    BACKEND_FAULT,
    /** An operation was attempted before a hash family was selected. */
    UNBOUND
}
