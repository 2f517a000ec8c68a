package com.pulse.bus;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 프로세스 내부 pub/sub 버스. 같은 JVM의 여러 방 세션이 토픽을 공유한다.
 * 콜백은 발행한 스레드에서 동기적으로 호출된다.
 */
public class InMemoryRealtimeBus implements RealtimeBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRealtimeBus.class);

    private final Map<String, Topic> topics = new ConcurrentHashMap<>();

    @Override
    public BusChannel channel(String topic) {
        return new LocalChannel(topic);
    }

    @Override
    public void publish(String topic, String event, JsonNode payload) {
        deliver(topic, null, event, payload);
    }

    int topicCount() {
        return topics.size();
    }

    private Topic topic(String name) {
        return topics.computeIfAbsent(name, Topic::new);
    }

    private void deliver(String topicName, LocalChannel sender, String event, JsonNode payload) {
        Topic topic = topics.get(topicName);
        if (topic == null) {
            log.debug("No subscribers on {} for event {}", topicName, event);
            return;
        }
        for (LocalChannel subscriber : topic.subscribers) {
            if (subscriber != sender) {
                subscriber.dispatch(event, payload);
            }
        }
    }

    private static final class Topic {
        private final String name;
        private final Set<LocalChannel> subscribers = new CopyOnWriteArraySet<>();
        // presence 키 -> 메타데이터, 키 -> 해당 항목을 track한 채널
        private final Map<String, PresenceEntry> presence = new LinkedHashMap<>();
        private final Map<String, LocalChannel> presenceOwners = new LinkedHashMap<>();

        private Topic(String name) {
            this.name = name;
        }

        private synchronized boolean isIdle() {
            return subscribers.isEmpty() && presence.isEmpty();
        }

        private synchronized Map<String, PresenceEntry> snapshot() {
            return Collections.unmodifiableMap(new LinkedHashMap<>(presence));
        }
    }

    private final class LocalChannel implements BusChannel {

        private final String topicName;
        private final Map<String, List<Consumer<JsonNode>>> handlers = new ConcurrentHashMap<>();
        private final List<PresenceListener> presenceListeners = new CopyOnWriteArrayList<>();
        private volatile boolean subscribed;
        private volatile boolean closed;
        private volatile String trackedKey;

        private LocalChannel(String topicName) {
            this.topicName = topicName;
        }

        @Override
        public String getTopic() {
            return topicName;
        }

        @Override
        public void subscribe(Duration timeout) {
            if (closed) {
                throw new BusException("Channel already closed: " + topicName);
            }
            if (subscribed) {
                return;
            }
            Topic topic = topics.compute(topicName, (name, existing) -> {
                Topic target = existing == null ? new Topic(name) : existing;
                target.subscribers.add(this);
                return target;
            });
            subscribed = true;
            Map<String, PresenceEntry> state = topic.snapshot();
            for (PresenceListener listener : presenceListeners) {
                listener.onSync(state);
            }
            log.debug("Subscribed to {}", topicName);
        }

        @Override
        public boolean isSubscribed() {
            return subscribed;
        }

        @Override
        public void on(String event, Consumer<JsonNode> handler) {
            handlers.computeIfAbsent(event, key -> new CopyOnWriteArrayList<>()).add(handler);
        }

        @Override
        public void onPresence(PresenceListener listener) {
            presenceListeners.add(listener);
        }

        @Override
        public void send(String event, JsonNode payload) {
            if (closed) {
                throw new BusException("Channel already closed: " + topicName);
            }
            deliver(topicName, this, event, payload);
        }

        @Override
        public void track(PresenceEntry entry) {
            if (!subscribed) {
                throw new BusException("Cannot track presence before subscribing to " + topicName);
            }
            Topic topic = topic(topicName);
            String key = entry.getUserId();
            synchronized (topic) {
                topic.presence.put(key, entry);
                topic.presenceOwners.put(key, this);
            }
            trackedKey = key;
            Map<String, PresenceEntry> state = topic.snapshot();
            for (LocalChannel subscriber : topic.subscribers) {
                subscriber.firePresence(listener -> {
                    listener.onJoin(key, entry);
                    listener.onSync(state);
                });
            }
        }

        @Override
        public void untrack() {
            String key = trackedKey;
            if (key == null) {
                return;
            }
            trackedKey = null;
            Topic topic = topic(topicName);
            PresenceEntry removed = null;
            synchronized (topic) {
                if (topic.presenceOwners.get(key) == this) {
                    topic.presenceOwners.remove(key);
                    removed = topic.presence.remove(key);
                }
            }
            if (removed == null) {
                return;
            }
            PresenceEntry left = removed;
            Map<String, PresenceEntry> state = topic.snapshot();
            for (LocalChannel subscriber : topic.subscribers) {
                subscriber.firePresence(listener -> {
                    listener.onLeave(key, left);
                    listener.onSync(state);
                });
            }
        }

        @Override
        public Map<String, PresenceEntry> presenceState() {
            if (!subscribed) {
                return Collections.emptyMap();
            }
            return topic(topicName).snapshot();
        }

        @Override
        public void unsubscribe() {
            if (closed) {
                return;
            }
            untrack();
            closed = true;
            subscribed = false;
            // 구독자와 presence가 모두 없어진 토픽은 지운다.
            topics.computeIfPresent(topicName, (name, topic) -> {
                topic.subscribers.remove(this);
                return topic.isIdle() ? null : topic;
            });
            log.debug("Unsubscribed from {}", topicName);
        }

        private void dispatch(String event, JsonNode payload) {
            List<Consumer<JsonNode>> eventHandlers = handlers.get(event);
            if (eventHandlers == null) {
                return;
            }
            for (Consumer<JsonNode> handler : eventHandlers) {
                try {
                    handler.accept(payload);
                } catch (RuntimeException ex) {
                    log.error("Handler for {} on {} failed", event, topicName, ex);
                }
            }
        }

        private void firePresence(Consumer<PresenceListener> action) {
            for (PresenceListener listener : presenceListeners) {
                try {
                    action.accept(listener);
                } catch (RuntimeException ex) {
                    log.error("Presence listener on {} failed", topicName, ex);
                }
            }
        }
    }
}
