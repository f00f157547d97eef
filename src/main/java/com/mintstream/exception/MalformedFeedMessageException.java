package com.mintstream.exception;

import java.util.Map;

public class MalformedFeedMessageException extends BaseException {

    public MalformedFeedMessageException(String message, String payload) {
        super(ErrorCode.MALFORMED_MESSAGE, message, Map.of("payload", abbreviate(payload)));
    }

    public MalformedFeedMessageException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_MESSAGE, message, cause);
    }

    private static String abbreviate(String payload) {
        if (payload == null) {
            return "";
        }
        return payload.length() <= 200 ? payload : payload.substring(0, 200) + "...";
    }
}
