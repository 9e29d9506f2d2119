package com.pocketpilot.budget.repository;

/**
 * Raised by a prescription store when a read, write or delete cannot be completed.
 */
public class PrescriptionStoreException extends RuntimeException {

    public PrescriptionStoreException(String message) {
        super(message);
    }

    public PrescriptionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
