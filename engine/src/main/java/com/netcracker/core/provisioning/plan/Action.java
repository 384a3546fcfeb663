package com.netcracker.core.provisioning.plan;

import com.netcracker.core.provisioning.model.ResourceAddress;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Executable step of a plan.
 *
 * @param change    resource change the step belongs to
 * @param dependsOn actions that must succeed before this one may run
 */
public record Action(ActionId id, ResourceChange change, SortedSet<ActionId> dependsOn) {

    public Action {
        dependsOn = Collections.unmodifiableSortedSet(new TreeSet<>(dependsOn));
    }

    public ActionType type() {
        return id.type();
    }

    public ResourceAddress address() {
        return id.address();
    }

    @Override
    public String toString() {
        return id.toString();
    }
}
