package com.graysky.api.exception;

import lombok.Getter;

/**
 * Another writer committed a record for the same identity first.
 * Raised by the relational store when its identity key constraint rejects an insert.
 */
@Getter
public class DuplicateIdentityException extends StorageException {

    private final String identityDigest;

    public DuplicateIdentityException(String identityDigest, Throwable cause) {
        super("Visitor identity already exists: " + identityDigest, cause);
        this.identityDigest = identityDigest;
    }
}
