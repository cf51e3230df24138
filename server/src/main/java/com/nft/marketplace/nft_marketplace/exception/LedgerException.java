package com.nft.marketplace.nft_marketplace.exception;

/**
 * Thrown when an operation is rejected. The message is stable and meant for
 * programmatic matching, e.g. {@code "NFT not listed for sale"}.
 *
 * A rejected operation never leaves partial state behind.
 */
public class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    public LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public static LedgerException invalidInput(String message) {
        return new LedgerException(ErrorCode.INVALID_INPUT, message);
    }

    public static LedgerException conflict(String message) {
        return new LedgerException(ErrorCode.CONFLICT, message);
    }

    public static LedgerException notFound(String message) {
        return new LedgerException(ErrorCode.NOT_FOUND, message);
    }

    public static LedgerException unauthorized(String message) {
        return new LedgerException(ErrorCode.UNAUTHORIZED, message);
    }

    public static LedgerException invalidState(String message) {
        return new LedgerException(ErrorCode.INVALID_STATE, message);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
