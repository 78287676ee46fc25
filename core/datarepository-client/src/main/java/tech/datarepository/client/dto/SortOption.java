package tech.datarepository.client.dto;

import java.util.Objects;

/**
 * A single sort key. A sort specification is an ordered {@code List<SortOption>}.
 */
public record SortOption(
    String field,
    SortOrder order
) {
    public SortOption {
        Objects.requireNonNull(field, "field");
        if (order == null) {
            order = SortOrder.ASC;
        }
    }

    public static SortOption asc(String field) {
        return new SortOption(field, SortOrder.ASC);
    }

    public static SortOption desc(String field) {
        return new SortOption(field, SortOrder.DESC);
    }
}
