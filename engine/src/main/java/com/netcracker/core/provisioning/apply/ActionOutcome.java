package com.netcracker.core.provisioning.apply;

import com.netcracker.core.provisioning.plan.ActionId;

/**
 * @param attempts provider calls made, including retries
 * @param error    message of the last failure, {@code null} on success
 */
public record ActionOutcome(ActionId id, ActionStatus status, int attempts, String error) {}
