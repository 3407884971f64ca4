package com.poolradar.resolver;

/**
 * Failure categories of a {@link PoolResult}.
 */
public enum PoolErrorCode {
    /** A source answered definitively that the pool does not exist. */
    NOT_FOUND,
    /** The indexed service did not answer within the request timeout on the last attempt. */
    UPSTREAM_TIMEOUT,
    /** Transport, protocol or shape failure from a source. */
    UPSTREAM_ERROR,
    /** No source serves the chain, or the lookup was interrupted. */
    UNAVAILABLE,
    /** Malformed address, unsupported chain, unknown fee tier or identical tokens. */
    INVALID_REQUEST
}
