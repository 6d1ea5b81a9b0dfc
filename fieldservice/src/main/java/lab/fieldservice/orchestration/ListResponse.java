package lab.fieldservice.orchestration;

import lab.fieldservice.adapter.EntityGateway.AppliedFilters;
import lab.fieldservice.adapter.EntityGateway.PageResult;
import lab.fieldservice.adapter.EntityGateway.Pagination;

import java.time.Instant;
import java.util.List;

public record ListResponse<T>(
        boolean success,
        List<T> data,
        int count,
        Pagination pagination,
        AppliedFilters appliedFilters,
        boolean rlsApplied,
        String timestamp
) {
    public static <T> ListResponse<T> of(PageResult<T> page, boolean rlsApplied) {
        return new ListResponse<>(
                true,
                page.data(),
                page.data().size(),
                page.pagination(),
                page.appliedFilters(),
                rlsApplied,
                Instant.now().toString()
        );
    }
}
