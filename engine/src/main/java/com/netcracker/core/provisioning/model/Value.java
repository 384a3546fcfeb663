package com.netcracker.core.provisioning.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attribute value of a declared resource. A value is either fully known ({@link Literal},
 * or a {@link ListValue}/{@link MapValue} of known values), a {@link Reference} to another
 * resource, a {@link CountIndex} placeholder substituted during expansion, or {@link Unknown}
 * when it depends on a resource that has not been applied yet.
 */
public sealed interface Value permits Value.Literal, Value.ListValue, Value.MapValue,
        Value.Reference, Value.CountIndex, Value.Unknown {

    static Literal of(Object value) {
        return new Literal(value);
    }

    static ListValue list(Value... items) {
        return new ListValue(List.of(items));
    }

    static ListValue list(List<? extends Value> items) {
        return new ListValue(List.copyOf(items));
    }

    static MapValue map(Map<String, ? extends Value> entries) {
        return new MapValue(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    static Reference ref(String type, String name, String attribute) {
        return new Reference(type, name, Selector.NONE, null, attribute);
    }

    static Reference ref(String type, String name, int index, String attribute) {
        return new Reference(type, name, Selector.INDEX, index, attribute);
    }

    static Reference refAll(String type, String name, String attribute) {
        return new Reference(type, name, Selector.ALL, null, attribute);
    }

    static CountIndex countIndex() {
        return CountIndex.INSTANCE;
    }

    static Unknown unknown() {
        return Unknown.INSTANCE;
    }

    /**
     * Converts a plain Java value (string, number, boolean, null, list or map of those) into a literal tree.
     */
    static Value fromPlain(Object plain) {
        if (plain instanceof Value value) {
            return value;
        }
        if (plain instanceof List<?> list) {
            List<Value> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(fromPlain(item));
            }
            return new ListValue(Collections.unmodifiableList(items));
        }
        if (plain instanceof Map<?, ?> map) {
            Map<String, Value> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put(String.valueOf(k), fromPlain(v)));
            return new MapValue(Collections.unmodifiableMap(entries));
        }
        return new Literal(plain);
    }

    /**
     * {@code true} when no {@link Reference}, {@link CountIndex} or {@link Unknown} remains in the tree.
     */
    default boolean isKnown() {
        return true;
    }

    /**
     * Plain Java representation with numbers normalized: integral numbers become {@link Long},
     * floating point numbers become {@link Double}.
     *
     * @throws IllegalStateException if the value is not known
     */
    Object toPlain();

    record Literal(Object value) implements Value {
        public Literal {
            if (value != null && !(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new IllegalArgumentException("Literal must be a string, number, boolean or null: " + value.getClass());
            }
        }

        @Override
        public Object toPlain() {
            return Values.normalize(value);
        }
    }

    record ListValue(List<Value> items) implements Value {
        public ListValue {
            Objects.requireNonNull(items, "items");
        }

        @Override
        public boolean isKnown() {
            return items.stream().allMatch(Value::isKnown);
        }

        @Override
        public Object toPlain() {
            List<Object> plain = new ArrayList<>(items.size());
            for (Value item : items) {
                plain.add(item.toPlain());
            }
            return plain;
        }
    }

    record MapValue(Map<String, Value> entries) implements Value {
        public MapValue {
            Objects.requireNonNull(entries, "entries");
        }

        @Override
        public boolean isKnown() {
            return entries.values().stream().allMatch(Value::isKnown);
        }

        @Override
        public Object toPlain() {
            Map<String, Object> plain = new LinkedHashMap<>();
            entries.forEach((k, v) -> plain.put(k, v.toPlain()));
            return plain;
        }
    }

    /**
     * Reference to an attribute of another declared resource.
     *
     * @param selector  how the target instance is chosen
     * @param index     instance index when {@code selector == INDEX}
     * @param attribute dot separated attribute path on the target, {@code id} for the provider identifier
     */
    record Reference(String type, String name, Selector selector, Integer index, String attribute) implements Value {
        public Reference {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(selector, "selector");
            Objects.requireNonNull(attribute, "attribute");
            if ((selector == Selector.INDEX) != (index != null)) {
                throw new IllegalArgumentException("Index must be set only for indexed references");
            }
        }

        public String declarationKey() {
            return type + "." + name;
        }

        @Override
        public boolean isKnown() {
            return false;
        }

        @Override
        public Object toPlain() {
            throw new IllegalStateException("Reference " + this + " is not resolved");
        }

        @Override
        public String toString() {
            return switch (selector) {
                case NONE -> declarationKey() + "." + attribute;
                case INDEX -> declarationKey() + "[" + index + "]." + attribute;
                case ALL -> declarationKey() + "[*]." + attribute;
            };
        }
    }

    enum Selector {
        NONE,
        INDEX,
        ALL
    }

    final class CountIndex implements Value {
        private static final CountIndex INSTANCE = new CountIndex();

        private CountIndex() {
        }

        @Override
        public boolean isKnown() {
            return false;
        }

        @Override
        public Object toPlain() {
            throw new IllegalStateException("count.index is only available inside counted declarations");
        }

        @Override
        public String toString() {
            return "count.index";
        }
    }

    final class Unknown implements Value {
        private static final Unknown INSTANCE = new Unknown();

        private Unknown() {
        }

        @Override
        public boolean isKnown() {
            return false;
        }

        @Override
        public Object toPlain() {
            throw new IllegalStateException("Value is not known until apply");
        }

        @Override
        public String toString() {
            return "(known after apply)";
        }
    }
}
