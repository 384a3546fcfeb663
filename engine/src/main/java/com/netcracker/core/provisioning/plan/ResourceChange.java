package com.netcracker.core.provisioning.plan;

import com.netcracker.core.provisioning.model.DeposedObject;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceNode;
import com.netcracker.core.provisioning.model.ResourceState;
import com.netcracker.core.provisioning.model.Value;

import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Planned change of one resource.
 *
 * @param replaceOrder      set for {@link ChangeType#REPLACE} only
 * @param changedAttributes attributes whose desired value differs from, or is not yet known against, the prior state
 * @param desired           desired node, {@code null} for deletes
 * @param plannedAttributes desired attributes as far as they are known at plan time
 * @param dependencies      addresses the desired node depends on
 * @param prior             state entry the change starts from, {@code null} for creates and deposed objects
 * @param deposed           deposed object to remove, set for deposed deletes only
 */
public record ResourceChange(ResourceAddress address,
                             ChangeType type,
                             ReplaceOrder replaceOrder,
                             SortedSet<String> changedAttributes,
                             ResourceNode desired,
                             Map<String, Value> plannedAttributes,
                             SortedSet<ResourceAddress> dependencies,
                             ResourceState prior,
                             DeposedObject deposed) {

    public ResourceChange {
        changedAttributes = changedAttributes == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(changedAttributes));
        dependencies = dependencies == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(dependencies));
        plannedAttributes = plannedAttributes == null ? Map.of() : Map.copyOf(plannedAttributes);
    }

    static ResourceChange create(ResourceNode desired, Map<String, Value> planned, SortedSet<ResourceAddress> dependencies) {
        return new ResourceChange(desired.address(), ChangeType.CREATE, null, new TreeSet<>(planned.keySet()),
                desired, planned, dependencies, null, null);
    }

    static ResourceChange update(ResourceNode desired, Map<String, Value> planned, SortedSet<ResourceAddress> dependencies,
                                 ResourceState prior, SortedSet<String> changed) {
        return new ResourceChange(desired.address(), ChangeType.UPDATE, null, changed,
                desired, planned, dependencies, prior, null);
    }

    static ResourceChange replace(ResourceNode desired, Map<String, Value> planned, SortedSet<ResourceAddress> dependencies,
                                  ResourceState prior, SortedSet<String> changed, ReplaceOrder order) {
        return new ResourceChange(desired.address(), ChangeType.REPLACE, order, changed,
                desired, planned, dependencies, prior, null);
    }

    static ResourceChange noop(ResourceNode desired, Map<String, Value> planned, SortedSet<ResourceAddress> dependencies,
                               ResourceState prior) {
        return new ResourceChange(desired.address(), ChangeType.NOOP, null, null,
                desired, planned, dependencies, prior, null);
    }

    static ResourceChange delete(ResourceState prior) {
        return new ResourceChange(prior.address(), ChangeType.DELETE, null, null,
                null, null, null, prior, null);
    }

    static ResourceChange deleteDeposed(DeposedObject deposed) {
        return new ResourceChange(deposed.address(), ChangeType.DELETE, null, null,
                null, null, null, null, deposed);
    }

    public boolean isDeposed() {
        return deposed != null;
    }

    public boolean isCreateBeforeDestroy() {
        return replaceOrder == ReplaceOrder.CREATE_BEFORE_DESTROY;
    }

    /**
     * Provider id of the object this change removes, if it removes one.
     */
    public String removedObjectId() {
        if (deposed != null) {
            return deposed.id();
        }
        return (type == ChangeType.DELETE || type == ChangeType.REPLACE) ? prior.id() : null;
    }
}
