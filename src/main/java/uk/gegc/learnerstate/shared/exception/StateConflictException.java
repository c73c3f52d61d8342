package uk.gegc.learnerstate.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when a conditional write of learner state loses a race
 * against another writer for the same learner.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class StateConflictException extends RuntimeException {

    private final String userId;

    public StateConflictException(String userId, String message) {
        super(message);
        this.userId = userId;
    }

    public StateConflictException(String userId, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
