package tech.datarepository.client.exception;

import java.util.Map;

/**
 * The request was well-formed but failed validation (HTTP 422).
 */
public class InvalidInputException extends HttpException {

    public InvalidInputException(String message) {
        super(message, 422);
    }

    public InvalidInputException(String message, Map<String, Object> context) {
        super(message, 422, null, context);
    }
}
