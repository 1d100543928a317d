package com.wechaty.plugin;

import com.wechaty.plugin.runtime.WechatyRuntime;
import com.wechaty.puppet.PuppetTypes.EventErrorPayload;
import com.wechaty.puppet.PuppetTypes.EventHeartbeatPayload;
import com.wechaty.puppet.PuppetTypes.EventReadyPayload;
import com.wechaty.puppet.ScanStatus;
import com.wechaty.user.Contact;
import com.wechaty.user.Friendship;
import com.wechaty.user.Message;
import com.wechaty.user.Room;
import com.wechaty.user.RoomInvitation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Base class for bot plugins.
 *
 * <p>
 * Every event handler is a no-op by default; a plugin overrides the ones it
 * cares about. Handlers run on the thread that emitted the event and must
 * return before the next plugin in dispatch order sees the same event.
 * </p>
 *
 * <p>
 * The plugin is owned by the application: the manager binds it to the bot once
 * and may stop and restart it any number of times, but never discards it.
 * </p>
 */
public abstract class WechatyPlugin {

    private final WechatyPluginOptions options;
    private final PluginOutput output = new PluginOutput();
    private volatile WechatyRuntime bot;

    protected WechatyPlugin() {
        this(null);
    }

    protected WechatyPlugin(WechatyPluginOptions options) {
        this.options = options != null ? options : new WechatyPluginOptions();
    }

    // =========================================================================
    // Identity
    // =========================================================================

    /**
     * Registry name of the plugin. Falls back to the class name when no name
     * was configured; the fallback is stored in the options on first access.
     */
    public String getName() {
        String name = options.getName();
        if (name == null || name.isBlank()) {
            name = getClass().getSimpleName();
            if (name.isEmpty()) {
                // anonymous classes
                name = getClass().getName();
            }
            options.setName(name);
        }
        return name;
    }

    public Map<String, Object> getMetadata() {
        Map<String, Object> metadata = options.getMetadata();
        return metadata != null ? metadata : Map.of();
    }

    public WechatyPluginOptions getOptions() {
        return options;
    }

    /**
     * Names of the plugins this plugin expects to be registered before it.
     * Informational only.
     */
    public List<String> dependencyPlugins() {
        return List.of();
    }

    // =========================================================================
    // Runtime binding
    // =========================================================================

    /**
     * Bind the plugin to the bot. Binding the same bot again is a no-op.
     *
     * @throws IllegalStateException if the plugin is bound to another bot
     */
    public synchronized void bind(WechatyRuntime runtime) {
        if (bot == null) {
            bot = runtime;
            return;
        }
        if (bot != runtime) {
            throw new IllegalStateException(
                    "plugin <" + getName() + "> is already bound to bot <" + bot.name() + ">");
        }
    }

    public boolean isBound() {
        return bot != null;
    }

    /**
     * The bot this plugin is bound to.
     *
     * @throws IllegalStateException before the manager has started the plugin
     */
    protected WechatyRuntime bot() {
        WechatyRuntime current = bot;
        if (current == null) {
            throw new IllegalStateException("plugin <" + getName() + "> is not bound to a bot");
        }
        return current;
    }

    // =========================================================================
    // Output
    // =========================================================================

    /** Buffer for results the plugin wants a monitor to pick up. */
    protected PluginOutput output() {
        return output;
    }

    /**
     * Everything written to the output since the previous call. Subsequent
     * calls return an empty map until the plugin writes again.
     */
    public Map<String, Object> drainOutput() {
        return output.take();
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Called once, after binding, when the manager starts.
     */
    public void initPlugin(WechatyRuntime bot) throws Exception {
    }

    // =========================================================================
    // Event handlers
    // =========================================================================

    public void onError(EventErrorPayload payload) throws Exception {
    }

    public void onHeartbeat(EventHeartbeatPayload payload) throws Exception {
    }

    public void onReady(EventReadyPayload payload) throws Exception {
    }

    public void onFriendship(Friendship friendship) throws Exception {
    }

    public void onLogin(Contact contact) throws Exception {
    }

    public void onLogout(Contact contact) throws Exception {
    }

    public void onMessage(Message message) throws Exception {
    }

    public void onRoomInvite(RoomInvitation roomInvitation) throws Exception {
    }

    public void onRoomJoin(Room room, List<Contact> invitees, Contact inviter, Instant date) throws Exception {
    }

    public void onRoomLeave(Room room, List<Contact> leavers, Contact remover, Instant date) throws Exception {
    }

    public void onRoomTopic(Room room, String newTopic, String oldTopic, Contact changer, Instant date)
            throws Exception {
    }

    /**
     * @param data extra data attached to the status, may be null
     */
    public void onScan(String qrCode, ScanStatus status, String data) throws Exception {
    }

    @Override
    public String toString() {
        return "WechatyPlugin<" + getName() + ">";
    }
}
