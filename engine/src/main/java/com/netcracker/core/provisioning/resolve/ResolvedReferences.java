package com.netcracker.core.provisioning.resolve;

import com.netcracker.core.provisioning.exception.UnresolvedReferenceException;

import java.util.List;

public record ResolvedReferences(List<Reference> references, List<UnresolvedReferenceException> unresolved) {

    public boolean hasErrors() {
        return !unresolved.isEmpty();
    }
}
