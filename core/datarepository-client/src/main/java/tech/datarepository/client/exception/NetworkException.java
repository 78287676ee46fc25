package tech.datarepository.client.exception;

import java.util.Map;

/**
 * No response was received from the data source (connection refused, timeout, ...).
 */
public class NetworkException extends HttpException {

    public NetworkException(String message, Throwable cause) {
        super(message, 0, cause, Map.of());
    }
}
