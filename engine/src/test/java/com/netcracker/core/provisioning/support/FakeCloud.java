package com.netcracker.core.provisioning.support;

import com.netcracker.core.provisioning.provider.ProviderRegistry;
import com.netcracker.core.provisioning.provider.ProviderResult;
import com.netcracker.core.provisioning.provider.ResourceNotFoundException;
import com.netcracker.core.provisioning.provider.ResourceProvider;
import com.netcracker.core.provisioning.provider.ResourceSchema;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory remote system shared by fake providers of several resource types. Records every call in order
 * as {@code "<operation> <id>"} and can inject failures or hold calls until released.
 */
public class FakeCloud {
    private final Map<String, Map<String, Object>> objects = new ConcurrentHashMap<>();
    private final Map<String, String> types = new ConcurrentHashMap<>();
    private final List<String> calls = new ArrayList<>();
    private final Map<String, Deque<RuntimeException>> failures = new ConcurrentHashMap<>();
    private final Map<String, Supplier<RuntimeException>> permanentFailures = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> arrivals = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> sequences = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    public FakeProvider provider(String type, ResourceSchema schema) {
        return new FakeProvider(type, schema);
    }

    public ProviderRegistry registry(ResourceProvider... providers) {
        return new ProviderRegistry(List.of(providers));
    }

    /**
     * Standard set of types: {@code vpc}, {@code subnet}, {@code sg}, {@code instance} and {@code bucket}.
     * Only {@code tags} can be updated in place.
     */
    public ProviderRegistry standardRegistry() {
        ResourceSchema schema = ResourceSchema.builder().updatableAttribute("tags").build();
        return registry(
                provider("vpc", schema),
                provider("subnet", schema),
                provider("sg", schema),
                provider("instance", schema),
                provider("bucket", schema));
    }

    public void failNext(String operation, String type, RuntimeException... errors) {
        failures.computeIfAbsent(operation + " " + type, k -> new ArrayDeque<>()).addAll(List.of(errors));
    }

    public void failAlways(String operation, String type, Supplier<RuntimeException> error) {
        permanentFailures.put(operation + " " + type, error);
    }

    /**
     * Makes calls of the operation on the type wait until {@link #release} is called.
     */
    public void hold(String operation, String type) {
        gates.put(operation + " " + type, new CountDownLatch(1));
        arrivals.put(operation + " " + type, new CountDownLatch(1));
    }

    public boolean awaitArrival(String operation, String type) throws InterruptedException {
        return arrivals.get(operation + " " + type).await(5, TimeUnit.SECONDS);
    }

    public void release(String operation, String type) {
        gates.get(operation + " " + type).countDown();
    }

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    public synchronized int position(String operation, String id) {
        return calls.indexOf(operation + " " + id);
    }

    public synchronized long count(String operation, String type) {
        return calls.stream()
                .filter(call -> call.startsWith(operation + " "))
                .filter(call -> type.equals(types.get(call.substring(operation.length() + 1))))
                .count();
    }

    public Map<String, Object> object(String id) {
        return objects.get(id);
    }

    public Set<String> ids() {
        return new TreeSet<>(objects.keySet());
    }

    public Set<String> idsOf(String type) {
        Set<String> result = new TreeSet<>();
        objects.keySet().forEach(id -> {
            if (type.equals(types.get(id))) {
                result.add(id);
            }
        });
        return result;
    }

    public void modifyOutOfBand(String id, String attribute, Object value) {
        objects.get(id).put(attribute, value);
    }

    public void deleteOutOfBand(String id) {
        objects.remove(id);
    }

    public int maxConcurrentCalls() {
        return maxInFlight.get();
    }

    private synchronized void record(String operation, String id) {
        calls.add(operation + " " + id);
    }

    private void enter(String operation, String type) {
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            CountDownLatch arrival = arrivals.get(operation + " " + type);
            if (arrival != null) {
                arrival.countDown();
            }
            CountDownLatch gate = gates.get(operation + " " + type);
            if (gate != null) {
                awaitGate(gate);
            }
            Deque<RuntimeException> queued = failures.get(operation + " " + type);
            RuntimeException next = queued == null ? null : queued.poll();
            if (next != null) {
                throw next;
            }
            Supplier<RuntimeException> permanent = permanentFailures.get(operation + " " + type);
            if (permanent != null) {
                throw permanent.get();
            }
        } catch (RuntimeException e) {
            inFlight.decrementAndGet();
            throw e;
        }
    }

    private void exit() {
        inFlight.decrementAndGet();
    }

    private static void awaitGate(CountDownLatch gate) {
        try {
            if (!gate.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Held call was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    public class FakeProvider implements ResourceProvider {
        private final String type;
        private final ResourceSchema schema;

        FakeProvider(String type, ResourceSchema schema) {
            this.type = type;
            this.schema = schema;
        }

        @Override
        public String type() {
            return type;
        }

        @Override
        public ResourceSchema schema() {
            return schema;
        }

        @Override
        public ProviderResult create(Map<String, Object> attributes) {
            enter("create", type);
            try {
                String id = type + "-" + sequences.computeIfAbsent(type, k -> new AtomicInteger()).incrementAndGet();
                Map<String, Object> stored = new LinkedHashMap<>(attributes);
                stored.put("arn", "arn:" + type + ":" + id);
                objects.put(id, stored);
                types.put(id, type);
                record("create", id);
                return new ProviderResult(id, new LinkedHashMap<>(stored));
            } finally {
                exit();
            }
        }

        @Override
        public Map<String, Object> read(String id) {
            enter("read", type);
            try {
                Map<String, Object> stored = objects.get(id);
                if (stored == null) {
                    throw new ResourceNotFoundException(type, id);
                }
                record("read", id);
                return new LinkedHashMap<>(stored);
            } finally {
                exit();
            }
        }

        @Override
        public Map<String, Object> update(String id, Map<String, Object> attributes) {
            enter("update", type);
            try {
                Map<String, Object> stored = objects.get(id);
                if (stored == null) {
                    throw new ResourceNotFoundException(type, id);
                }
                stored.putAll(attributes);
                record("update", id);
                return new LinkedHashMap<>(stored);
            } finally {
                exit();
            }
        }

        @Override
        public void delete(String id) {
            enter("delete", type);
            try {
                if (objects.remove(id) == null) {
                    throw new ResourceNotFoundException(type, id);
                }
                record("delete", id);
            } finally {
                exit();
            }
        }
    }
}
