package lab.fieldservice.adapter;

import lab.fieldservice.common.InvalidRequestException;
import lab.fieldservice.domain.invoice.InvoiceStatus;
import lab.fieldservice.orchestration.policy.ResourceType;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListQueryTest {

    private final EntityMetadata metadata = new EntityMetadata(
            ResourceType.INVOICES,
            List.of("invoiceNumber"),
            Map.of("status", InvoiceStatus.class, "customerId", Long.class, "active", Boolean.class),
            Set.of("id", "createdAt", "dueDate"),
            "createdAt",
            Sort.Direction.DESC
    );

    @Test
    void from_noParams_usesDefaults() {
        ListQuery query = ListQuery.from(Map.of(), metadata, 50, 200);

        assertThat(query.page()).isEqualTo(1);
        assertThat(query.limit()).isEqualTo(50);
        assertThat(query.sortBy()).isEqualTo("createdAt");
        assertThat(query.sortDirection()).isEqualTo(Sort.Direction.DESC);
        assertThat(query.filters()).isEmpty();
        assertThat(query.includeInactive()).isFalse();
    }

    @Test
    void from_convertsFiltersToFieldTypes() {
        ListQuery query = ListQuery.from(
                Map.of("status", "paid", "customerId", "42", "sortBy", "dueDate", "sortOrder", "asc"),
                metadata, 50, 200);

        assertThat(query.filters()).containsEntry("status", InvoiceStatus.PAID).containsEntry("customerId", 42L);
        assertThat(query.sortBy()).isEqualTo("dueDate");
        assertThat(query.sortDirection()).isEqualTo(Sort.Direction.ASC);
    }

    @Test
    void from_blankSearch_isIgnored() {
        assertThat(ListQuery.from(Map.of("search", "  "), metadata, 50, 200).search()).isNull();
    }

    @Test
    void from_unknownFilterField_isRejected() {
        assertThatThrownBy(() -> ListQuery.from(Map.of("amount", "10"), metadata, 50, 200))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("invalid filter field: amount");
    }

    @Test
    void from_invalidPagingOrSort_isRejected() {
        assertThatThrownBy(() -> ListQuery.from(Map.of("page", "0"), metadata, 50, 200))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> ListQuery.from(Map.of("limit", "500"), metadata, 50, 200))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> ListQuery.from(Map.of("sortBy", "amount"), metadata, 50, 200))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> ListQuery.from(Map.of("sortOrder", "sideways"), metadata, 50, 200))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void from_badFilterValue_isRejected() {
        assertThatThrownBy(() -> ListQuery.from(Map.of("customerId", "abc"), metadata, 50, 200))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("invalid value for customerId: abc");
        assertThatThrownBy(() -> ListQuery.from(Map.of("active", "yes"), metadata, 50, 200))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> ListQuery.from(Map.of("status", "settled"), metadata, 50, 200))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("invalid value for status: settled");
    }
}
