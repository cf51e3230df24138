package com.nft.marketplace.nft_marketplace.exception;

/**
 * Failure categories reported by registry, marketplace and funds operations.
 */
public enum ErrorCode {

    /** Empty or oversized name, zero price, low bid, non-positive duration. */
    INVALID_INPUT,

    /** Duplicate collection name, listing or auction already active for a token. */
    CONFLICT,

    /** Unknown collection or token id. */
    NOT_FOUND,

    /** Caller is not the required owner, seller or operator. */
    UNAUTHORIZED,

    /** Operation not valid in the token's current listing/auction state or time window. */
    INVALID_STATE
}
