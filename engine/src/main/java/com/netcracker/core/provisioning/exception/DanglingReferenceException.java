package com.netcracker.core.provisioning.exception;

import com.netcracker.core.provisioning.model.ResourceAddress;
import lombok.Getter;

/**
 * A desired resource still references a resource whose declaration was removed and which would be deleted.
 */
@Getter
public class DanglingReferenceException extends ValidationException {
    private final ResourceAddress source;
    private final String attributePath;
    private final ResourceAddress target;

    public DanglingReferenceException(ResourceAddress source, String attributePath, ResourceAddress target) {
        super("Resource '" + target + "' is scheduled for deletion but still referenced by "
              + source + "." + attributePath);
        this.source = source;
        this.attributePath = attributePath;
        this.target = target;
    }
}
