package uk.gegc.learnerstate.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when externally supplied input cannot be applied to learner state:
 * an empty or malformed topic set, a blank question id, or scheduling parameters
 * outside their allowed range.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
