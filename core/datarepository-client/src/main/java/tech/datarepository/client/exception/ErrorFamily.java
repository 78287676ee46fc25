package tech.datarepository.client.exception;

/**
 * The closed set of error kinds a {@link tech.datarepository.client.DataClient} may raise.
 */
public enum ErrorFamily {
    /** The data source rejected or failed to serve the request. */
    TRANSPORT,
    /** The returned data could not be deserialized or interpreted. */
    FORMAT
}
