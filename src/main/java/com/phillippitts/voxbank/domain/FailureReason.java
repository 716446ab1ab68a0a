package com.phillippitts.voxbank.domain;

/**
 * Why a synthesis request produced no buffer.
 */
public enum FailureReason {
    /** No word could be resolved to a clip. */
    NO_CONTENT,
    /** A clip was malformed during assembly. */
    CONCATENATION,
    /** The effects chain failed. */
    FILTER,
    /** The word bank could not be read or written. */
    STORAGE,
    /** The caller cancelled the request. */
    CANCELLED,
    INTERNAL
}
