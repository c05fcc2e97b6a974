package com.eainde.policyaudit.model;

/**
 * Raised when a finding is built without a usable page reference or snippet.
 * Findings are never emitted with placeholder evidence.
 */
public class EvidenceIntegrityException extends IllegalArgumentException {

    public EvidenceIntegrityException(String message) {
        super(message);
    }
}
