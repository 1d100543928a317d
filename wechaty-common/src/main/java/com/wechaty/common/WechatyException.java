package com.wechaty.common;

/**
 * Base unchecked exception for the Wechaty runtime.
 */
public class WechatyException extends RuntimeException {

    public WechatyException(String message) {
        super(message);
    }

    public WechatyException(String message, Throwable cause) {
        super(message, cause);
    }
}
