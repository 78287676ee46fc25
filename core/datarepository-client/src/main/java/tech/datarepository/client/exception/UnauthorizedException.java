package tech.datarepository.client.exception;

import java.util.Map;

/**
 * Missing or invalid credentials (HTTP 401).
 */
public class UnauthorizedException extends HttpException {

    public UnauthorizedException(String message) {
        super(message, 401);
    }

    public UnauthorizedException(String message, Map<String, Object> context) {
        super(message, 401, null, context);
    }
}
