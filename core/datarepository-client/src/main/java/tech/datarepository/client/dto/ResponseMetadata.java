package tech.datarepository.client.dto;

import java.time.Instant;

/**
 * Metadata attached to every successful data API response.
 */
public record ResponseMetadata(
    String requestId,
    Instant timestamp
) {}
