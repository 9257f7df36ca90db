package io.fieldsync.core;

/**
 * A Field Versions blob failed the structural check at the trust boundary.
 * Raised before any merge is attempted.
 */
public class MalformedFieldVersionsException extends IllegalArgumentException {
    public MalformedFieldVersionsException(String message) {
        super(message);
    }
}
