package com.netcracker.core.provisioning.state;

import com.netcracker.core.provisioning.exception.StateConflictException;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceState;
import com.netcracker.core.provisioning.model.StateSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InMemoryStateStoreTest {

    @Test
    void rejectsStaleSnapshots() {
        InMemoryStateStore store = new InMemoryStateStore();
        StateSnapshot first = store.load().put(bucket("bucket-1"));
        store.save(first);

        assertThatThrownBy(() -> store.save(first)).isInstanceOf(StateConflictException.class);
        assertThatThrownBy(() -> store.save(first.withSerial(0))).isInstanceOf(StateConflictException.class);
        assertThat(store.load()).isEqualTo(first);
    }

    @Test
    void rejectsSnapshotsOfAnotherLineage() {
        InMemoryStateStore store = new InMemoryStateStore();
        store.save(store.load().put(bucket("bucket-1")));

        StateSnapshot foreign = StateSnapshot.empty().put(bucket("bucket-2")).withSerial(10);

        assertThatThrownBy(() -> store.save(foreign)).isInstanceOf(StateConflictException.class);
    }

    @Test
    void lockIsExclusiveUntilReleasedOrExpired() {
        Clock clock = mock(Clock.class);
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        when(clock.instant()).thenReturn(start);
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
        InMemoryStateStore store = new InMemoryStateStore(StateSnapshot.empty(), clock);

        LockHandle first = store.lock(Duration.ofMinutes(1));
        assertThatThrownBy(() -> store.lock(Duration.ofMinutes(1))).isInstanceOf(StateConflictException.class);

        first.close();
        LockHandle second = store.lock(Duration.ofMinutes(1));

        when(clock.instant()).thenReturn(start.plus(Duration.ofMinutes(2)));
        LockHandle third = store.lock(Duration.ofMinutes(1));
        assertThat(third.getId()).isNotEqualTo(second.getId());
    }

    private static ResourceState bucket(String id) {
        return new ResourceState(ResourceAddress.parse("bucket.logs"), id, Map.of("acl", "private"), Map.of(), Set.of());
    }
}
