package com.taxledger.costbasis.ordering;

/**
 * An event cannot be placed in the canonical processing order (missing date or unresolvable asset).
 */
public class EventOrderingException extends RuntimeException {

    public EventOrderingException(String message) {
        super(message);
    }
}
