package tech.datarepository.client.exception;

/**
 * Format-level error: the client could not deserialize or interpret returned data.
 */
public class DataFormatException extends DataClientException {

    public DataFormatException(String message) {
        super(message, null);
    }

    public DataFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorFamily getFamily() {
        return ErrorFamily.FORMAT;
    }
}
