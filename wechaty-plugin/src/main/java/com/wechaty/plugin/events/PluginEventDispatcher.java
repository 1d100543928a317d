package com.wechaty.plugin.events;

import com.wechaty.plugin.PluginHandlerException;
import com.wechaty.plugin.WechatyPlugin;
import com.wechaty.plugin.registry.PluginRegistry;
import com.wechaty.plugin.registry.PluginRegistry.Registration;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fans events out to the running plugins of a registry.
 *
 * <p>
 * Plugins are invoked one at a time in dispatch order; a handler returns
 * before the next plugin sees the event, so a plugin can rely on the plugins
 * registered before it having handled the event already. There is no timeout:
 * a handler that never returns stalls the event.
 * </p>
 *
 * <p>
 * Each plugin's status is checked again right before it is invoked. A plugin
 * stopped while an event is being dispatched may or may not receive that event.
 * </p>
 */
@Slf4j
public class PluginEventDispatcher {

    /**
     * What happens when a plugin's handler throws.
     */
    public enum FailurePolicy {
        /** Propagate the failure; later plugins do not see the event. */
        FAIL_FAST,
        /** Log the failure and continue with the next plugin. */
        ISOLATE
    }

    /**
     * A handler failure recorded under {@link FailurePolicy#ISOLATE}.
     */
    public record PluginFailure(String pluginName, Exception error) {
    }

    /**
     * Outcome of one dispatch.
     *
     * @param delivered names of the plugins whose handler completed, in order
     * @param failures  handler failures, only ever non-empty when isolating
     */
    public record DispatchReport(EventKind kind, List<String> delivered, List<PluginFailure> failures) {

        public boolean hasFailures() {
            return !failures.isEmpty();
        }
    }

    private final PluginRegistry registry;
    private final FailurePolicy failurePolicy;

    public PluginEventDispatcher(PluginRegistry registry) {
        this(registry, FailurePolicy.FAIL_FAST);
    }

    public PluginEventDispatcher(PluginRegistry registry, FailurePolicy failurePolicy) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    /**
     * Validate an untyped puppet event and dispatch it.
     *
     * @throws EventContractViolationException if the arguments do not match the
     *                                         kind; no plugin is invoked
     */
    public DispatchReport emit(String kind, Object... args) {
        return dispatch(EventContracts.parse(kind, args));
    }

    /**
     * Deliver an event to every running plugin in dispatch order.
     *
     * @throws PluginHandlerException when a handler throws a checked exception
     *                                under {@link FailurePolicy#FAIL_FAST};
     *                                unchecked exceptions propagate as they are
     */
    public DispatchReport dispatch(PluginEvent event) {
        Objects.requireNonNull(event, "event");
        EventKind kind = event.kind();
        List<Registration> active = registry.activeRegistrations();
        log.debug("[events] emitting {} to {} plugin(s)", kind.key(), active.size());

        List<String> delivered = new ArrayList<>();
        List<PluginFailure> failures = new ArrayList<>();
        for (Registration registration : active) {
            String name = registration.name();
            WechatyPlugin plugin = registration.plugin();
            if (!registry.isRunning(name)) {
                log.debug("[events] plugin <{}> stopped during dispatch of {}, skipping", name, kind.key());
                continue;
            }
            log.debug("[events] emit {} to plugin <{}>", kind.key(), name);
            try {
                event.deliverTo(plugin);
                delivered.add(name);
            } catch (Exception e) {
                if (failurePolicy == FailurePolicy.ISOLATE) {
                    log.error("[events] {} handler of plugin <{}> failed: {}", kind.key(), name, e.getMessage(), e);
                    failures.add(new PluginFailure(name, e));
                    continue;
                }
                if (e instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw new PluginHandlerException(name, kind, e);
            }
        }
        return new DispatchReport(kind, List.copyOf(delivered), List.copyOf(failures));
    }
}
