package lab.fieldservice.adapter;

import lab.fieldservice.common.InvalidRequestException;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validated list parameters. Anything that is not a reserved parameter is treated as an
 * equality filter and must name a filterable field.
 */
public record ListQuery(
        int page,
        int limit,
        String search,
        Map<String, Object> filters,
        String sortBy,
        Sort.Direction sortDirection,
        boolean includeInactive
) {
    private static final Set<String> RESERVED = Set.of("page", "limit", "search", "sortBy", "sortOrder", "includeInactive");

    public ListQuery {
        filters = filters == null ? Map.of() : Map.copyOf(filters);
    }

    public static ListQuery from(Map<String, String> params, EntityMetadata metadata, int defaultLimit, int maxLimit) {
        int page = parsePositive(params.get("page"), 1, "page");
        int limit = parsePositive(params.get("limit"), defaultLimit, "limit");
        if (limit > maxLimit) {
            throw new InvalidRequestException("limit must not exceed " + maxLimit);
        }

        String search = params.get("search");
        if (search != null && search.isBlank()) {
            search = null;
        }

        String sortBy = params.getOrDefault("sortBy", metadata.defaultSortField());
        if (!metadata.sortableFields().contains(sortBy)) {
            throw new InvalidRequestException("invalid sortBy: " + sortBy);
        }
        Sort.Direction direction = metadata.defaultSortDirection();
        String sortOrder = params.get("sortOrder");
        if (sortOrder != null) {
            direction = Sort.Direction.fromOptionalString(sortOrder)
                    .orElseThrow(() -> new InvalidRequestException("invalid sortOrder: " + sortOrder));
        }

        Map<String, Object> filters = new LinkedHashMap<>();
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (RESERVED.contains(param.getKey())) {
                continue;
            }
            Class<?> type = metadata.filterableFields().get(param.getKey());
            if (type == null) {
                throw new InvalidRequestException("invalid filter field: " + param.getKey());
            }
            filters.put(param.getKey(), convert(param.getKey(), param.getValue(), type));
        }

        boolean includeInactive = Boolean.parseBoolean(params.getOrDefault("includeInactive", "false"));
        return new ListQuery(page, limit, search, filters, sortBy, direction, includeInactive);
    }

    private static int parsePositive(String raw, int defaultValue, String name) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 1) {
                throw new InvalidRequestException(name + " must be a positive integer");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidRequestException(name + " must be a positive integer");
        }
    }

    static Object convert(String field, String raw, Class<?> type) {
        String value = raw == null ? "" : raw.trim();
        try {
            if (type == String.class) {
                return value;
            }
            if (type == Long.class) {
                return Long.valueOf(value);
            }
            if (type == Integer.class) {
                return Integer.valueOf(value);
            }
            if (type == Boolean.class) {
                if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
                    throw new IllegalArgumentException(value);
                }
                return Boolean.valueOf(value);
            }
            if (type == BigDecimal.class) {
                return new BigDecimal(value);
            }
            if (type == LocalDate.class) {
                return LocalDate.parse(value);
            }
            if (type.isEnum()) {
                String constant = value.toUpperCase(Locale.ROOT);
                for (Object candidate : type.getEnumConstants()) {
                    if (((Enum<?>) candidate).name().equals(constant)) {
                        return candidate;
                    }
                }
                throw new IllegalArgumentException(value);
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new InvalidRequestException("invalid value for " + field + ": " + raw);
        }
        throw new IllegalStateException("unsupported filter type " + type.getName() + " for " + field);
    }
}
