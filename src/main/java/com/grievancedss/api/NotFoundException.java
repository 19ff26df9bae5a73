package com.grievancedss.api;

/**
 * Thrown when a requested grievance or rule does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
