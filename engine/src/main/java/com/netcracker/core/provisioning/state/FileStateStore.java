package com.netcracker.core.provisioning.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcracker.core.provisioning.exception.ProvisioningException;
import com.netcracker.core.provisioning.exception.StateConflictException;
import com.netcracker.core.provisioning.model.StateSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Keeps the state document in a local JSON file. Writes go to a temporary file that is then moved over
 * the document, so readers never see a partial write. The lock is a sibling {@code .lock} file created
 * exclusively; a lock past its expiry may be taken over.
 */
@Slf4j
public class FileStateStore implements StateStore {
    private static final ObjectMapper LOCK_MAPPER = new ObjectMapper();

    private final Path path;
    private final Path lockPath;
    private final StateSnapshotSerializer serializer;
    private final Clock clock;

    public FileStateStore(Path path, StateSnapshotSerializer serializer) {
        this(path, serializer, Clock.systemUTC());
    }

    public FileStateStore(Path path, StateSnapshotSerializer serializer, Clock clock) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath();
        this.lockPath = this.path.resolveSibling(this.path.getFileName() + ".lock");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized StateSnapshot load() {
        if (!Files.exists(path)) {
            log.debug("State file '{}' does not exist, starting from empty state", path);
            return StateSnapshot.empty();
        }
        try {
            return serializer.deserialize(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ProvisioningException("Failed to read state file '" + path + "'", e);
        }
    }

    @Override
    public synchronized void save(StateSnapshot snapshot) {
        StateSnapshots.checkNewer(Files.exists(path) ? load() : null, snapshot);
        try {
            Files.createDirectories(path.getParent());
            Path tmp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
            Files.writeString(tmp, serializer.serialize(snapshot), StandardCharsets.UTF_8);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved state serial {} to '{}'", snapshot.getSerial(), path);
        } catch (IOException e) {
            throw new ProvisioningException("Failed to write state file '" + path + "'", e);
        }
    }

    @Override
    public synchronized LockHandle lock(Duration ttl) {
        Instant now = clock.instant();
        LockInfo info = new LockInfo(UUID.randomUUID().toString(), StateSnapshots.owner(), now.plus(ttl).toEpochMilli());
        try {
            Files.createDirectories(lockPath.getParent());
            if (!tryCreateLock(info)) {
                LockInfo holder = readLock();
                if (holder != null && now.toEpochMilli() < holder.expiresAt()) {
                    throw new StateConflictException("State file '" + path + "' is locked by " + holder.owner()
                                                     + " until " + Instant.ofEpochMilli(holder.expiresAt()));
                }
                log.warn("Taking over expired state lock {}", holder);
                Files.deleteIfExists(lockPath);
                if (!tryCreateLock(info)) {
                    throw new StateConflictException("State file '" + path + "' was locked concurrently");
                }
            }
        } catch (IOException e) {
            throw new StateConflictException("Failed to lock state file '" + path + "'", e);
        }
        log.info("Acquired state lock {} on '{}'", info.id(), path);
        return new LockHandle(this, info.id(), info.owner(), now);
    }

    @Override
    public synchronized void unlock(LockHandle handle) {
        try {
            LockInfo holder = readLock();
            if (holder == null || !holder.id().equals(handle.getId())) {
                log.warn("Lock {} is no longer held on '{}', nothing to release", handle.getId(), path);
                return;
            }
            Files.deleteIfExists(lockPath);
            log.info("Released state lock {} on '{}'", handle.getId(), path);
        } catch (IOException e) {
            throw new ProvisioningException("Failed to release state lock on '" + path + "'", e);
        }
    }

    private boolean tryCreateLock(LockInfo info) throws IOException {
        try {
            Files.writeString(lockPath, LOCK_MAPPER.writeValueAsString(info), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    private LockInfo readLock() throws IOException {
        try {
            return LOCK_MAPPER.readValue(Files.readString(lockPath, StandardCharsets.UTF_8), LockInfo.class);
        } catch (NoSuchFileException e) {
            return null;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable lock file '{}', treating it as expired", lockPath, e);
            return new LockInfo("unknown", "unknown", 0);
        }
    }

    record LockInfo(String id, String owner, long expiresAt) {}
}
