package com.netcracker.core.provisioning.state;

import com.netcracker.core.provisioning.exception.StateConflictException;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceState;
import com.netcracker.core.provisioning.model.StateSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileStateStoreTest {
    private static final ResourceAddress VPC = ResourceAddress.parse("vpc.main");
    private static final ResourceAddress SUBNET = ResourceAddress.parse("subnet.a[0]");

    @TempDir
    Path dir;

    @Test
    void missingFileLoadsAsEmptyState() {
        FileStateStore store = new FileStateStore(dir.resolve("state.json"), new StateSnapshotSerializer());

        assertThat(store.load().isEmpty()).isTrue();
        assertThat(store.load().getSerial()).isZero();
    }

    @Test
    void savedStateIsReadBackByAnotherStore() {
        Path file = dir.resolve("nested/state.json");
        FileStateStore store = new FileStateStore(file, new StateSnapshotSerializer());
        StateSnapshot snapshot = store.load()
                .put(new ResourceState(VPC, "vpc-1", Map.of("cidr", "10.0.0.0/16"), Map.of("arn", "arn:vpc:vpc-1"), Set.of()))
                .put(new ResourceState(SUBNET, "subnet-1", Map.of("vpc_id", "vpc-1", "ports", java.util.List.of(80, 443)),
                        Map.of(), Set.of(VPC)));

        store.save(snapshot);

        StateSnapshot loaded = new FileStateStore(file, new StateSnapshotSerializer()).load();
        assertThat(loaded).isEqualTo(snapshot);
        assertThat(loaded.get(SUBNET).orElseThrow().dependencies()).containsExactly(VPC);
        try (var files = Files.list(file.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("state.json");
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    @Test
    void rejectsStaleSave() {
        FileStateStore store = new FileStateStore(dir.resolve("state.json"), new StateSnapshotSerializer());
        StateSnapshot first = store.load().put(new ResourceState(VPC, "vpc-1", Map.of(), Map.of(), Set.of()));
        store.save(first);
        store.save(first.remove(VPC, "vpc-1"));

        assertThatThrownBy(() -> store.save(first)).isInstanceOf(StateConflictException.class);
    }

    @Test
    void lockFileKeepsOtherHoldersOutUntilReleased() {
        Path file = dir.resolve("state.json");
        FileStateStore store = new FileStateStore(file, new StateSnapshotSerializer());
        FileStateStore other = new FileStateStore(file, new StateSnapshotSerializer());

        LockHandle lock = store.lock(Duration.ofMinutes(5));

        assertThat(dir.resolve("state.json.lock")).exists();
        assertThatThrownBy(() -> other.lock(Duration.ofMinutes(5)))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("is locked by");

        lock.close();
        assertThat(dir.resolve("state.json.lock")).doesNotExist();
        other.lock(Duration.ofMinutes(5)).close();
    }

    @Test
    void expiredLockIsTakenOver() {
        Path file = dir.resolve("state.json");
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        FileStateStore crashed = new FileStateStore(file, new StateSnapshotSerializer(), Clock.fixed(start, ZoneOffset.UTC));
        FileStateStore later = new FileStateStore(file, new StateSnapshotSerializer(),
                Clock.fixed(start.plus(Duration.ofMinutes(10)), ZoneOffset.UTC));

        LockHandle stale = crashed.lock(Duration.ofMinutes(5));
        LockHandle fresh = later.lock(Duration.ofMinutes(5));

        assertThat(fresh.getId()).isNotEqualTo(stale.getId());
        stale.close();
        assertThat(dir.resolve("state.json.lock")).exists();
        fresh.close();
        assertThat(dir.resolve("state.json.lock")).doesNotExist();
    }

    @Test
    void unreadableStateFails() throws IOException {
        Path file = dir.resolve("state.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new FileStateStore(file, new StateSnapshotSerializer()).load())
                .isInstanceOf(StateSerializationException.class);
    }
}
