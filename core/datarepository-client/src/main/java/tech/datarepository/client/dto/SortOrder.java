package tech.datarepository.client.dto;

/**
 * Sort direction for a {@link SortOption}.
 */
public enum SortOrder {
    ASC,
    DESC
}
