package com.mintstream.exception;

/**
 * Raised when a feed session cannot be opened or is lost (abrupt close, transport error,
 * heartbeat timeout). Always recoverable by the reconnect loop until its retry ceiling.
 */
public class FeedConnectionException extends BaseException {

    public FeedConnectionException(String message) {
        super(ErrorCode.FEED_CONNECTION_ERROR, message);
    }

    public FeedConnectionException(String message, Throwable cause) {
        super(ErrorCode.FEED_CONNECTION_ERROR, message, cause);
    }
}
