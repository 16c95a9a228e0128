package com.flagship.treasury_ledger.exception;

import java.util.Map;

/**
 * Base class for all domain failures of the treasury ledger.
 *
 * Subclasses fix the {@link ErrorKind}; the optional details map is copied
 * verbatim into the API error body.
 */
public abstract class TreasuryException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, String> details;

    protected TreasuryException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    protected TreasuryException(ErrorKind kind, String message, Map<String, String> details) {
        this(kind, message, details, null);
    }

    protected TreasuryException(ErrorKind kind, String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
