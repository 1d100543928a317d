package com.wechaty.plugin.events;

import com.wechaty.plugin.WechatyPluginException;
import lombok.Getter;

/**
 * Raised when the arguments of an emitted event do not match the kind's
 * contract. No plugin has been invoked when this is thrown.
 */
@Getter
public class EventContractViolationException extends WechatyPluginException {

    /** Kind as it was emitted, which may not be a known kind. */
    private final String kind;

    public EventContractViolationException(String kind, String message) {
        super("invalid arguments for event <" + kind + ">: " + message);
        this.kind = kind;
    }
}
