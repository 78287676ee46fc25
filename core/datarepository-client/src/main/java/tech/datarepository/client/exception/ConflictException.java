package tech.datarepository.client.exception;

import java.util.Map;

/**
 * The request conflicts with the current state of the resource (HTTP 409).
 */
public class ConflictException extends HttpException {

    public ConflictException(String message) {
        super(message, 409);
    }

    public ConflictException(String message, Map<String, Object> context) {
        super(message, 409, null, context);
    }
}
