package tech.datarepository.client.exception;

import java.util.Map;

/**
 * The requested resource does not exist (HTTP 404).
 */
public class NotFoundException extends HttpException {

    public NotFoundException(String message) {
        super(message, 404);
    }

    public NotFoundException(String message, Map<String, Object> context) {
        super(message, 404, null, context);
    }
}
