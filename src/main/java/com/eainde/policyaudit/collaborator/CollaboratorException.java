package com.eainde.policyaudit.collaborator;

/** Any failure of the reasoning collaborator: transport, timeout, or an unusable answer. */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
