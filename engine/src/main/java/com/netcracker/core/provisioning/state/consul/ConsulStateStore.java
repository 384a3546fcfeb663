package com.netcracker.core.provisioning.state.consul;

import com.netcracker.core.provisioning.exception.ProvisioningException;
import com.netcracker.core.provisioning.exception.StateConflictException;
import com.netcracker.core.provisioning.model.StateSnapshot;
import com.netcracker.core.provisioning.state.LockHandle;
import com.netcracker.core.provisioning.state.StateSnapshotSerializer;
import com.netcracker.core.provisioning.state.StateSnapshots;
import com.netcracker.core.provisioning.state.StateStore;
import io.vertx.core.Future;
import io.vertx.ext.consul.ConsulClient;
import io.vertx.ext.consul.KeyValue;
import io.vertx.ext.consul.KeyValueOptions;
import io.vertx.ext.consul.SessionBehavior;
import io.vertx.ext.consul.SessionOptions;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps the state document under a single Consul KV key.
 * <p>
 * Writes use check-and-set on the modify index of the value that was compared against, so a concurrent
 * writer makes the save fail instead of being overwritten. The lock is a Consul session acquiring
 * {@code <key>/.lock}; the session is renewed every half TTL while the lock is held.
 */
@Slf4j
public class ConsulStateStore implements StateStore {
    static final String LOCK_SUFFIX = "/.lock";
    private static final long MIN_SESSION_TTL_SECONDS = 10;
    private static final long MAX_SESSION_TTL_SECONDS = 86400;

    private final ConsulClient client;
    private final String key;
    private final String lockKey;
    private final StateSnapshotSerializer serializer;
    private final Duration requestTimeout;
    private final Clock clock;
    private final ScheduledExecutorService renewals;
    private final Map<String, ScheduledFuture<?>> renewTasks = new ConcurrentHashMap<>();

    public ConsulStateStore(ConsulClient client, String key, StateSnapshotSerializer serializer, Duration requestTimeout) {
        this(client, key, serializer, requestTimeout, Clock.systemUTC(), Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "consul-state-lock-renewal");
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, ex) -> log.error("Uncaught exception in {}", th.getName(), ex));
            return t;
        }));
    }

    ConsulStateStore(ConsulClient client,
                     String key,
                     StateSnapshotSerializer serializer,
                     Duration requestTimeout,
                     Clock clock,
                     ScheduledExecutorService renewals) {
        this.client = Objects.requireNonNull(client, "client");
        this.key = trimSlashes(Objects.requireNonNull(key, "key"));
        this.lockKey = this.key + LOCK_SUFFIX;
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.clock = clock;
        this.renewals = renewals;
    }

    @Override
    public StateSnapshot load() {
        KeyValue kv = await(client.getValue(key), "read " + key);
        if (isAbsent(kv)) {
            log.debug("Consul key '{}' is empty, starting from empty state", key);
            return StateSnapshot.empty();
        }
        return serializer.deserialize(kv.getValue());
    }

    @Override
    public void save(StateSnapshot snapshot) {
        KeyValue kv = await(client.getValue(key), "read " + key);
        long casIndex = 0;
        if (!isAbsent(kv)) {
            StateSnapshots.checkNewer(serializer.deserialize(kv.getValue()), snapshot);
            casIndex = kv.getModifyIndex();
        }
        KeyValueOptions options = new KeyValueOptions().setCasIndex(casIndex);
        Boolean written = await(client.putValueWithOptions(key, serializer.serialize(snapshot), options), "write " + key);
        if (!Boolean.TRUE.equals(written)) {
            throw new StateConflictException("State key '" + key + "' was modified concurrently (cas index " + casIndex + ")");
        }
        log.debug("Saved state serial {} to consul key '{}'", snapshot.getSerial(), key);
    }

    @Override
    public LockHandle lock(Duration ttl) {
        long ttlSeconds = Math.min(MAX_SESSION_TTL_SECONDS, Math.max(MIN_SESSION_TTL_SECONDS, ttl.toSeconds()));
        String owner = StateSnapshots.owner();
        SessionOptions sessionOptions = new SessionOptions()
                .setName("provisioner-lock " + owner)
                .setTtl(ttlSeconds)
                .setLockDelay(0)
                .setBehavior(SessionBehavior.RELEASE);
        String session = await(client.createSessionWithOptions(sessionOptions), "create session");

        Boolean acquired;
        try {
            acquired = await(client.putValueWithOptions(lockKey, owner, new KeyValueOptions().setAcquireSession(session)),
                    "acquire " + lockKey);
        } catch (RuntimeException e) {
            destroyQuietly(session, e);
            throw e;
        }
        if (!Boolean.TRUE.equals(acquired)) {
            destroyQuietly(session, null);
            throw new StateConflictException("State key '" + key + "' is locked by another session");
        }

        long period = Math.max(1, ttlSeconds / 2);
        renewTasks.put(session, renewals.scheduleAtFixedRate(() -> renew(session), period, period, TimeUnit.SECONDS));
        log.info("Acquired consul state lock on '{}' with session {}", lockKey, session);
        return new LockHandle(this, session, owner, clock.instant());
    }

    @Override
    public void unlock(LockHandle handle) {
        String session = handle.getId();
        ScheduledFuture<?> renewal = renewTasks.remove(session);
        if (renewal != null) {
            renewal.cancel(false);
        }
        try {
            await(client.putValueWithOptions(lockKey, handle.getOwner(), new KeyValueOptions().setReleaseSession(session)),
                    "release " + lockKey);
        } catch (RuntimeException e) {
            destroyQuietly(session, e);
            throw e;
        }
        await(client.destroySession(session), "destroy session " + session);
        log.info("Released consul state lock on '{}'", lockKey);
    }

    public void close() {
        renewals.shutdownNow();
    }

    private void renew(String session) {
        client.renewSession(session).onFailure(e -> log.warn("Failed to renew consul session {}", session, e));
    }

    private void destroyQuietly(String session, Throwable primary) {
        try {
            await(client.destroySession(session), "destroy session " + session);
        } catch (RuntimeException e) {
            if (primary != null) {
                primary.addSuppressed(e);
            } else {
                log.warn("Failed to destroy consul session {}", session, e);
            }
        }
    }

    private <T> T await(Future<T> future, String operation) {
        try {
            return future.toCompletionStage().toCompletableFuture().get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException("Interrupted during consul " + operation, e);
        } catch (ExecutionException e) {
            throw new ProvisioningException("Consul " + operation + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new ProvisioningException("Consul " + operation + " timed out after " + requestTimeout, e);
        }
    }

    private static boolean isAbsent(KeyValue kv) {
        return kv == null || kv.getValue() == null || kv.getValue().isEmpty();
    }

    private static String trimSlashes(String value) {
        String result = value;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
