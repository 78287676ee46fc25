package tech.datarepository.client.exception;

import java.util.Map;

/**
 * The caller is not allowed to access the resource (HTTP 403).
 */
public class ForbiddenException extends HttpException {

    public ForbiddenException(String message) {
        super(message, 403);
    }

    public ForbiddenException(String message, Map<String, Object> context) {
        super(message, 403, null, context);
    }
}
