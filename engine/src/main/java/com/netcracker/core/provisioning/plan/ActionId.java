package com.netcracker.core.provisioning.plan;

import com.netcracker.core.provisioning.model.ResourceAddress;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a planned action. Deletes carry the provider id of the object they remove, since one address can
 * have a current and several deposed objects.
 */
public record ActionId(ResourceAddress address, ActionType type, String objectId) implements Comparable<ActionId> {
    private static final Comparator<ActionId> ORDER = Comparator
            .comparing(ActionId::address)
            .thenComparing(ActionId::type)
            .thenComparing(ActionId::objectId, Comparator.nullsFirst(Comparator.naturalOrder()));

    public ActionId {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(type, "type");
        if ((type == ActionType.DELETE) != (objectId != null)) {
            throw new IllegalArgumentException("Object id must be set for deletes only");
        }
    }

    public static ActionId create(ResourceAddress address) {
        return new ActionId(address, ActionType.CREATE, null);
    }

    public static ActionId update(ResourceAddress address) {
        return new ActionId(address, ActionType.UPDATE, null);
    }

    public static ActionId noop(ResourceAddress address) {
        return new ActionId(address, ActionType.NOOP, null);
    }

    public static ActionId delete(ResourceAddress address, String objectId) {
        return new ActionId(address, ActionType.DELETE, objectId);
    }

    @Override
    public int compareTo(ActionId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        String base = address + ":" + type.name().toLowerCase();
        return objectId == null ? base : base + "(" + objectId + ")";
    }
}
