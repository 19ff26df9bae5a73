package com.grievancedss.adjudication;

/**
 * Thrown when a submission lacks what evaluation needs (e.g. a grievance type).
 */
public class InvalidGrievanceException extends RuntimeException {

    public InvalidGrievanceException(String message) {
        super(message);
    }
}
