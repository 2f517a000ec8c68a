package com.pulse.signaling;

import com.pulse.bus.BusChannel;
import com.pulse.bus.RealtimeBus;
import com.pulse.bus.Topics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 수신자별 개인 토픽 채널을 지연 생성해 재사용하는 풀.
 * 최대 개수를 넘거나 유휴 시간이 지나면 가장 오래 쓰지 않은 채널부터 닫는다.
 */
public class OutboundChannelPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OutboundChannelPool.class);

    private final RealtimeBus bus;
    private final Duration subscribeTimeout;
    private final Duration idleTtl;
    private final int maxChannels;
    private final Clock clock;
    private final Consumer<String> closeHook;

    // 접근 순서 LinkedHashMap: 맨 앞이 가장 오래 사용하지 않은 채널
    private final LinkedHashMap<String, PooledChannel> channels = new LinkedHashMap<>(16, 0.75f, true);
    private boolean closed;

    public OutboundChannelPool(RealtimeBus bus, Duration subscribeTimeout, Duration idleTtl, int maxChannels,
            Clock clock, Consumer<String> closeHook) {
        if (maxChannels < 1) {
            throw new IllegalArgumentException("maxChannels must be positive");
        }
        this.bus = bus;
        this.subscribeTimeout = subscribeTimeout;
        this.idleTtl = idleTtl;
        this.maxChannels = maxChannels;
        this.clock = clock;
        this.closeHook = closeHook;
    }

    /**
     * 수신자의 개인 토픽 채널을 반환한다. 없으면 새로 구독한다.
     */
    public synchronized BusChannel acquire(String recipientId) {
        if (closed) {
            throw new SignalingException("Outbound channel pool is closed");
        }
        Instant now = clock.instant();
        evictIdle(now);
        PooledChannel pooled = channels.get(recipientId);
        if (pooled == null) {
            BusChannel channel = bus.channel(Topics.inbox(recipientId));
            channel.subscribe(subscribeTimeout);
            pooled = new PooledChannel(channel);
            channels.put(recipientId, pooled);
            log.debug("Opened outbound channel to {} ({} pooled)", recipientId, channels.size());
            evictOverflow();
        }
        pooled.lastUsed = now;
        return pooled.channel;
    }

    public synchronized int size() {
        return channels.size();
    }

    public synchronized boolean contains(String recipientId) {
        return channels.containsKey(recipientId);
    }

    /**
     * 특정 수신자 채널을 닫는다. 전송 실패 후 다음 전송에서 새 채널을 쓰게 할 때 사용한다.
     */
    public synchronized void release(String recipientId) {
        PooledChannel pooled = channels.remove(recipientId);
        if (pooled != null) {
            dispose(recipientId, pooled);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<Map.Entry<String, PooledChannel>> all = new ArrayList<>(channels.entrySet());
        channels.clear();
        for (Map.Entry<String, PooledChannel> entry : all) {
            dispose(entry.getKey(), entry.getValue());
        }
    }

    private void evictIdle(Instant now) {
        Iterator<Map.Entry<String, PooledChannel>> it = channels.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, PooledChannel> entry = it.next();
            if (Duration.between(entry.getValue().lastUsed, now).compareTo(idleTtl) > 0) {
                it.remove();
                dispose(entry.getKey(), entry.getValue());
            }
        }
    }

    private void evictOverflow() {
        Iterator<Map.Entry<String, PooledChannel>> it = channels.entrySet().iterator();
        while (channels.size() > maxChannels && it.hasNext()) {
            Map.Entry<String, PooledChannel> eldest = it.next();
            it.remove();
            dispose(eldest.getKey(), eldest.getValue());
        }
    }

    private void dispose(String recipientId, PooledChannel pooled) {
        try {
            pooled.channel.unsubscribe();
        } catch (RuntimeException ex) {
            log.warn("Failed to close outbound channel to {}: {}", recipientId, ex.getMessage());
        }
        if (closeHook != null) {
            closeHook.accept(recipientId);
        }
        log.debug("Closed outbound channel to {}", recipientId);
    }

    private static final class PooledChannel {
        private final BusChannel channel;
        private Instant lastUsed;

        private PooledChannel(BusChannel channel) {
            this.channel = channel;
        }
    }
}
