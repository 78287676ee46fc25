package tech.datarepository.client.exception;

import java.util.Map;

/**
 * The request was malformed (HTTP 400).
 */
public class BadRequestException extends HttpException {

    public BadRequestException(String message) {
        super(message, 400);
    }

    public BadRequestException(String message, Map<String, Object> context) {
        super(message, 400, null, context);
    }
}
