package com.wechaty.user;

import com.wechaty.puppet.Puppet;

import java.util.Objects;

/**
 * Base for user objects: an id bound to the puppet that owns its payload.
 * The payload is fetched on {@link #ready()} and cached afterwards.
 *
 * @param <P> payload type
 */
public abstract class Accessory<P> {

    private final Puppet puppet;
    private final String id;
    private volatile P payload;

    protected Accessory(Puppet puppet, String id) {
        this.puppet = Objects.requireNonNull(puppet, "puppet");
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    public Puppet getPuppet() {
        return puppet;
    }

    /**
     * Load the payload from the puppet if it has not been loaded yet.
     */
    public void ready() {
        if (payload == null) {
            payload = loadPayload();
        }
    }

    public boolean isReady() {
        return payload != null;
    }

    /** Payload, loading it on first use. */
    protected P payload() {
        ready();
        return payload;
    }

    protected abstract P loadPayload();

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return id.equals(((Accessory<?>) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), id);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "<" + id + ">";
    }
}
