package com.netcracker.core.provisioning.exception;

import com.netcracker.core.provisioning.model.ResourceAddress;
import lombok.Getter;

/**
 * An attribute expression names an address that is not declared.
 */
@Getter
public class UnresolvedReferenceException extends ValidationException {
    private final ResourceAddress source;
    private final String attributePath;
    private final String target;
    /**
     * Address the reference was looking for; unindexed for all-instance references, {@code null} when malformed.
     */
    private final ResourceAddress targetAddress;

    public UnresolvedReferenceException(ResourceAddress source,
                                        String attributePath,
                                        String target,
                                        ResourceAddress targetAddress) {
        super("Reference to undeclared resource '" + target + "' in " + source + "." + attributePath);
        this.source = source;
        this.attributePath = attributePath;
        this.target = target;
        this.targetAddress = targetAddress;
    }
}
