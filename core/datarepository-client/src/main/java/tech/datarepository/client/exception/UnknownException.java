package tech.datarepository.client.exception;

import java.util.Map;

/**
 * An error status with no more specific mapping.
 */
public class UnknownException extends HttpException {

    public UnknownException(String message, int statusCode, Map<String, Object> context) {
        super(message, statusCode, null, context);
    }
}
