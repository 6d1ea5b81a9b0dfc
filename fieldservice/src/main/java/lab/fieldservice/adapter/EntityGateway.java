package lab.fieldservice.adapter;

import lab.fieldservice.domain.RowScoped;
import lab.fieldservice.orchestration.policy.ResourceType;
import lab.fieldservice.orchestration.policy.RowFilter;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Data access for one resource. Row filters arrive as plain {@link RowFilter} values and are
 * combined with the caller's search and filters by the implementation.
 */
public interface EntityGateway<T extends RowScoped> {

    ResourceType getResourceType();

    EntityMetadata metadata();

    /**
     * @param rowFilter additional row constraint, or null when the caller may see every row
     */
    PageResult<T> findAll(RowFilter rowFilter, ListQuery query);

    Optional<T> findById(Long id);

    T save(T entity);

    void delete(T entity);

    record PageResult<T>(
            List<T> data,
            Pagination pagination,
            AppliedFilters appliedFilters
    ) {}

    record Pagination(
            int page,
            int limit,
            long total,
            int totalPages,
            boolean hasNext,
            boolean hasPrev
    ) {
        public static Pagination of(int page, int limit, long total) {
            int totalPages = (int) ((total + limit - 1) / limit);
            return new Pagination(page, limit, total, totalPages, page < totalPages, page > 1);
        }
    }

    record AppliedFilters(
            String search,
            Map<String, Object> filters,
            String sortBy,
            String sortOrder
    ) {}
}
