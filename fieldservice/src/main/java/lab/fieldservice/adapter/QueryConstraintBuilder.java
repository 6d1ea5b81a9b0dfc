package lab.fieldservice.adapter;

import jakarta.persistence.criteria.Predicate;
import lab.fieldservice.orchestration.policy.RowFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates row filters into JPA specifications and ANDs them with the caller's search and
 * equality filters. The row constraint is just one more clause; it never inspects the others.
 */
@Component
@Slf4j
public class QueryConstraintBuilder {

    public <T> Specification<T> toSpecification(RowFilter rowFilter) {
        if (rowFilter == null) {
            return (root, query, cb) -> null;
        }
        if (rowFilter instanceof RowFilter.FieldEquals equals) {
            return (root, query, cb) -> cb.equal(root.get(equals.field()), equals.value());
        }
        if (rowFilter != RowFilter.matchNothing()) {
            log.warn("event=query_constraint.unsupported_filter filter={}", rowFilter);
        }
        // An empty disjunction is always false.
        return (root, query, cb) -> cb.disjunction();
    }

    public <T> Specification<T> search(String term, List<String> fields) {
        if (term == null || fields.isEmpty()) {
            return (root, query, cb) -> null;
        }
        String pattern = "%" + term.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, query, cb) -> cb.or(fields.stream()
                .map(field -> cb.like(cb.lower(root.<String>get(field)), pattern))
                .toArray(Predicate[]::new));
    }

    public <T> Specification<T> equalTo(Map<String, Object> filters) {
        if (filters.isEmpty()) {
            return (root, query, cb) -> null;
        }
        return (root, query, cb) -> cb.and(filters.entrySet().stream()
                .map(entry -> cb.equal(root.get(entry.getKey()), entry.getValue()))
                .toArray(Predicate[]::new));
    }

    public <T> Specification<T> compose(RowFilter rowFilter, String search, List<String> searchableFields,
                                        Map<String, Object> filters) {
        Specification<T> searchSpec = search(search, searchableFields);
        return searchSpec
                .and(equalTo(filters))
                .and(toSpecification(rowFilter));
    }
}
