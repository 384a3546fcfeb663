package com.netcracker.core.provisioning.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Unique address of a resource node: {@code type.name} or {@code type.name[index]} for
 * instances expanded from a counted declaration.
 */
public record ResourceAddress(String type, String name, Integer index) implements Comparable<ResourceAddress> {
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^(?<type>[^.\\[\\]]+)\\.(?<name>[^.\\[\\]]+)(\\[(?<index>\\d+)])?$");
    private static final Comparator<ResourceAddress> ORDER = Comparator
            .comparing(ResourceAddress::type)
            .thenComparing(ResourceAddress::name)
            .thenComparing(ResourceAddress::index, Comparator.nullsFirst(Comparator.naturalOrder()));

    public ResourceAddress {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        if (type.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("Resource type and name must not be blank");
        }
        if (index != null && index < 0) {
            throw new IllegalArgumentException("Resource index must not be negative: " + index);
        }
    }

    public static ResourceAddress of(String type, String name) {
        return new ResourceAddress(type, name, null);
    }

    public static ResourceAddress of(String type, String name, int index) {
        return new ResourceAddress(type, name, index);
    }

    public static ResourceAddress parse(String address) {
        Matcher m = ADDRESS_PATTERN.matcher(Objects.requireNonNull(address, "address"));
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed resource address: " + address);
        }
        String index = m.group("index");
        return new ResourceAddress(m.group("type"), m.group("name"), index == null ? null : Integer.valueOf(index));
    }

    /**
     * Key of the declaration that produced this address, without the instance index.
     */
    public String declarationKey() {
        return type + "." + name;
    }

    public boolean isIndexed() {
        return index != null;
    }

    @Override
    public int compareTo(ResourceAddress other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return index == null ? declarationKey() : declarationKey() + "[" + index + "]";
    }
}
