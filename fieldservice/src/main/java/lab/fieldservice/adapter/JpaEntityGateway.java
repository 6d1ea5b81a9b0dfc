package lab.fieldservice.adapter;

import lab.fieldservice.domain.RowScoped;
import lab.fieldservice.domain.SecuredRepository;
import lab.fieldservice.orchestration.policy.ResourceType;
import lab.fieldservice.orchestration.policy.RowFilter;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class JpaEntityGateway<T extends RowScoped> implements EntityGateway<T> {

    private final EntityMetadata metadata;
    private final SecuredRepository<T> repository;
    private final QueryConstraintBuilder constraintBuilder;

    public JpaEntityGateway(EntityMetadata metadata, SecuredRepository<T> repository,
                            QueryConstraintBuilder constraintBuilder) {
        this.metadata = metadata;
        this.repository = repository;
        this.constraintBuilder = constraintBuilder;
    }

    @Override
    public ResourceType getResourceType() {
        return metadata.resourceType();
    }

    @Override
    public EntityMetadata metadata() {
        return metadata;
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<T> findAll(RowFilter rowFilter, ListQuery query) {
        Map<String, Object> filters = new LinkedHashMap<>(query.filters());
        if (!query.includeInactive() && metadata.filterableFields().containsKey("active")) {
            filters.putIfAbsent("active", Boolean.TRUE);
        }

        Specification<T> specification = constraintBuilder.compose(
                rowFilter, query.search(), metadata.searchableFields(), filters);
        PageRequest pageRequest = PageRequest.of(
                query.page() - 1, query.limit(), Sort.by(query.sortDirection(), query.sortBy()));
        Page<T> page = repository.findAll(specification, pageRequest);

        return new PageResult<>(
                page.getContent(),
                Pagination.of(query.page(), query.limit(), page.getTotalElements()),
                new AppliedFilters(query.search(), filters, query.sortBy(), query.sortDirection().name())
        );
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<T> findById(Long id) {
        return repository.findById(id);
    }

    @Override
    @Transactional
    public T save(T entity) {
        return repository.save(entity);
    }

    @Override
    @Transactional
    public void delete(T entity) {
        repository.delete(entity);
    }
}
