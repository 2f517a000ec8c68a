package com.pulse.signaling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pulse.bus.BusChannel;
import com.pulse.bus.InMemoryRealtimeBus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class OutboundChannelPoolTest {

    private final InMemoryRealtimeBus bus = new InMemoryRealtimeBus();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final List<String> released = new CopyOnWriteArrayList<>();

    @Test
    void reusesChannelForSameRecipient() {
        OutboundChannelPool pool = newPool(Duration.ofMinutes(5), 4);

        BusChannel first = pool.acquire("bob");
        BusChannel second = pool.acquire("bob");

        assertThat(second).isSameAs(first);
        assertThat(pool.size()).isEqualTo(1);
    }

    @Test
    void evictsChannelsIdleLongerThanTtl() {
        OutboundChannelPool pool = newPool(Duration.ofMinutes(5), 4);
        BusChannel stale = pool.acquire("bob");

        clock.advance(Duration.ofMinutes(6));
        pool.acquire("carol");

        assertThat(pool.contains("bob")).isFalse();
        assertThat(pool.contains("carol")).isTrue();
        assertThat(stale.isSubscribed()).isFalse();
        assertThat(released).containsExactly("bob");
    }

    @Test
    void evictsLeastRecentlyUsedWhenFull() {
        OutboundChannelPool pool = newPool(Duration.ofMinutes(5), 2);
        pool.acquire("bob");
        pool.acquire("carol");
        clock.advance(Duration.ofSeconds(1));
        pool.acquire("bob");

        pool.acquire("dave");

        assertThat(pool.contains("carol")).isFalse();
        assertThat(pool.contains("bob")).isTrue();
        assertThat(pool.contains("dave")).isTrue();
        assertThat(released).containsExactly("carol");
    }

    @Test
    void closeReleasesEverythingAndRejectsFurtherUse() {
        OutboundChannelPool pool = newPool(Duration.ofMinutes(5), 4);
        pool.acquire("bob");
        pool.acquire("carol");

        pool.close();

        assertThat(pool.size()).isZero();
        assertThat(released).containsExactlyInAnyOrder("bob", "carol");
        assertThatThrownBy(() -> pool.acquire("dave")).isInstanceOf(SignalingException.class);
    }

    private OutboundChannelPool newPool(Duration idleTtl, int maxChannels) {
        return new OutboundChannelPool(bus, Duration.ofSeconds(1), idleTtl, maxChannels, clock, released::add);
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
