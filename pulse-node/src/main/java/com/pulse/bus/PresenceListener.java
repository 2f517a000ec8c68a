package com.pulse.bus;

import java.util.Map;

public interface PresenceListener {

    default void onSync(Map<String, PresenceEntry> state) {
    }

    default void onJoin(String key, PresenceEntry entry) {
    }

    default void onLeave(String key, PresenceEntry entry) {
    }
}
