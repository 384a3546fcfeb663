package com.netcracker.core.provisioning.resolve;

import com.netcracker.core.provisioning.model.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Replaces references in attribute trees with the values a lookup provides for them.
 */
public final class ReferenceEvaluator {

    private ReferenceEvaluator() {
    }

    public static Map<String, Value> evaluateAll(Map<String, Value> attributes, Function<Value.Reference, Value> lookup) {
        Map<String, Value> evaluated = new LinkedHashMap<>();
        attributes.forEach((name, value) -> evaluated.put(name, evaluate(value, lookup)));
        return evaluated;
    }

    public static Value evaluate(Value value, Function<Value.Reference, Value> lookup) {
        if (value instanceof Value.Reference reference) {
            return lookup.apply(reference);
        }
        if (value instanceof Value.ListValue list) {
            List<Value> items = new ArrayList<>(list.items().size());
            for (Value item : list.items()) {
                items.add(evaluate(item, lookup));
            }
            return Value.list(items);
        }
        if (value instanceof Value.MapValue map) {
            Map<String, Value> entries = new LinkedHashMap<>();
            map.entries().forEach((k, v) -> entries.put(k, evaluate(v, lookup)));
            return Value.map(entries);
        }
        return value;
    }

    /**
     * Plain representation of fully known attributes.
     */
    public static Map<String, Object> toPlain(Map<String, Value> attributes) {
        Map<String, Object> plain = new LinkedHashMap<>();
        attributes.forEach((name, value) -> plain.put(name, value.toPlain()));
        return plain;
    }
}
