package tech.datarepository.client.exception;

/**
 * Base exception for errors raised by a data client.
 */
public abstract class DataClientException extends RuntimeException {

    protected DataClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorFamily getFamily();
}
