package tech.datarepository.client.exception;

import java.util.Map;

/**
 * The data source failed while serving the request (HTTP 5xx).
 */
public class ServerException extends HttpException {

    public ServerException(String message) {
        super(message, 500);
    }

    public ServerException(String message, int statusCode, Map<String, Object> context) {
        super(message, statusCode, null, context);
    }
}
