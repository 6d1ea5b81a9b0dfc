package lab.fieldservice.adapter;

import lab.fieldservice.orchestration.policy.ResourceType;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Query surface of one resource: which fields are searchable, filterable (with their Java type
 * for parameter conversion) and sortable.
 */
public record EntityMetadata(
        ResourceType resourceType,
        List<String> searchableFields,
        Map<String, Class<?>> filterableFields,
        Set<String> sortableFields,
        String defaultSortField,
        Sort.Direction defaultSortDirection
) {
    public EntityMetadata {
        searchableFields = List.copyOf(searchableFields);
        filterableFields = Map.copyOf(filterableFields);
        sortableFields = Set.copyOf(sortableFields);
        if (!sortableFields.contains(defaultSortField)) {
            throw new IllegalStateException(
                    "default sort field " + defaultSortField + " is not sortable for " + resourceType.id());
        }
    }
}
