package com.regiongraph.api;

/**
 * Raised when a network cannot be wired or negotiated as configured.
 *
 * All reasons are fatal to graph construction; nothing retries them.
 */
public class LinkConfigurationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** The link type name is not in the policy registry. */
        UNKNOWN_LINK_TYPE,
        /** The parameter string cannot be parsed for the chosen policy. */
        INVALID_PARAMS,
        /** The same source output is already linked to the input. */
        DUPLICATE_LINK,
        /** Dimension negotiation did not converge. */
        UNRESOLVED_DIMENSIONS
    }

    private final Reason reason;

    public LinkConfigurationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public LinkConfigurationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
