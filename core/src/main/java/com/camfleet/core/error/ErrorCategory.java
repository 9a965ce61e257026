package com.camfleet.core.error;

/**
 * Error taxonomy shared by the device control server and the console.
 */
public enum ErrorCategory {
    /** Missing or invalid bearer token. */
    AUTH,
    /** Malformed or missing body or field. */
    VALIDATION,
    /** Unknown route or resource. */
    NOT_FOUND,
    /** Mutation sent too soon after the previous one. */
    RATE_LIMIT,
    /** Capture/encode collaborator operation failed. */
    UPSTREAM,
    /** A bounded call exceeded its deadline. */
    TIMEOUT,
    /** Response serialization failed. */
    ENCODING,
    /** Deliberately unfinished endpoint. */
    NOT_IMPLEMENTED,
    INTERNAL
}
