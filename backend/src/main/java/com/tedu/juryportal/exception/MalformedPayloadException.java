package com.tedu.juryportal.exception;

/**
 * A stored or submitted payload that cannot be interpreted. Reported to the
 * caller as a 400 with a descriptive message.
 */
public class MalformedPayloadException extends BusinessException {

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
