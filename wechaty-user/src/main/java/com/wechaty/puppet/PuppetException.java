package com.wechaty.puppet;

import com.wechaty.common.WechatyException;
import lombok.Getter;

/**
 * Raised when the puppet cannot supply a payload.
 */
@Getter
public class PuppetException extends WechatyException {

    private final String payloadId;

    public PuppetException(String message, String payloadId) {
        super(message);
        this.payloadId = payloadId;
    }
}
