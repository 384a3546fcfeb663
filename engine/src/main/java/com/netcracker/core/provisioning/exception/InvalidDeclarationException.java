package com.netcracker.core.provisioning.exception;

import lombok.Getter;

@Getter
public class InvalidDeclarationException extends ValidationException {
    private final String declarationKey;

    public InvalidDeclarationException(String declarationKey, String reason) {
        super("Invalid declaration '" + declarationKey + "': " + reason);
        this.declarationKey = declarationKey;
    }
}
