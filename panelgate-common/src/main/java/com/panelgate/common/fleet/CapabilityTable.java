package com.panelgate.common.fleet;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fleet command event to capability slug mapping.
 * <p>
 * The kiosk-side command dispatcher ships the same table; both sides must agree on
 * which events are gated. The set of gated events is exactly the key set.
 */
public final class CapabilityTable {

    private static final Map<String, String> EVENT_TO_CAPABILITY;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("fleet_reboot_kiosk", "reboot_kiosk");
        m.put("fleet_clear_cutter_stuck", "clear_cutter_stuck");
        m.put("fleet_restart_process", "restart_restart_all_process");
        m.put("fleet_reset_device", "reset_all_cameras_device");
        m.put("fleet_switch_process_list", "switch_processes");
        EVENT_TO_CAPABILITY = Map.copyOf(m);
    }

    private CapabilityTable() {
    }

    /**
     * Capability slug required for an event, or empty if the event is not gated.
     */
    public static Optional<String> requiredCapability(String event) {
        if (event == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(EVENT_TO_CAPABILITY.get(event));
    }

    public static boolean isGated(String event) {
        return event != null && EVENT_TO_CAPABILITY.containsKey(event);
    }

    public static Set<String> gatedEvents() {
        return EVENT_TO_CAPABILITY.keySet();
    }

    public static Map<String, String> asMap() {
        return EVENT_TO_CAPABILITY;
    }
}
