package com.mintstream.exception;

public class EventStoreException extends BaseException {

    public EventStoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_ERROR, message, cause);
    }
}
