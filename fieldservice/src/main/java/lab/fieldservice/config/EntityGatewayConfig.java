package lab.fieldservice.config;

import lab.fieldservice.adapter.EntityGateway;
import lab.fieldservice.adapter.EntityMetadata;
import lab.fieldservice.adapter.JpaEntityGateway;
import lab.fieldservice.adapter.QueryConstraintBuilder;
import lab.fieldservice.domain.contract.Contract;
import lab.fieldservice.domain.contract.ContractRepository;
import lab.fieldservice.domain.contract.ContractStatus;
import lab.fieldservice.domain.customer.Customer;
import lab.fieldservice.domain.customer.CustomerRepository;
import lab.fieldservice.domain.inventory.InventoryItem;
import lab.fieldservice.domain.inventory.InventoryItemRepository;
import lab.fieldservice.domain.inventory.InventoryStatus;
import lab.fieldservice.domain.invoice.Invoice;
import lab.fieldservice.domain.invoice.InvoiceRepository;
import lab.fieldservice.domain.invoice.InvoiceStatus;
import lab.fieldservice.domain.policy.PolicyAuditLog;
import lab.fieldservice.domain.policy.PolicyAuditLogRepository;
import lab.fieldservice.domain.technician.Technician;
import lab.fieldservice.domain.technician.TechnicianRepository;
import lab.fieldservice.domain.technician.TechnicianStatus;
import lab.fieldservice.domain.workorder.WorkOrder;
import lab.fieldservice.domain.workorder.WorkOrderPriority;
import lab.fieldservice.domain.workorder.WorkOrderRepository;
import lab.fieldservice.domain.workorder.WorkOrderStatus;
import lab.fieldservice.orchestration.policy.ResourceType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One gateway per resource, each describing which fields callers may search, filter and sort on.
 */
@Configuration
public class EntityGatewayConfig {

    @Bean
    public EntityGateway<Customer> customerGateway(CustomerRepository repository, QueryConstraintBuilder builder) {
        EntityMetadata metadata = new EntityMetadata(
                ResourceType.CUSTOMERS,
                List.of("email", "firstName", "lastName", "companyName"),
                Map.of("id", Long.class, "email", String.class, "active", Boolean.class),
                Set.of("id", "email", "lastName", "companyName", "createdAt"),
                "createdAt",
                Sort.Direction.DESC
        );
        return new JpaEntityGateway<>(metadata, repository, builder);
    }

    @Bean
    public EntityGateway<Technician> technicianGateway(TechnicianRepository repository, QueryConstraintBuilder builder) {
        EntityMetadata metadata = new EntityMetadata(
                ResourceType.TECHNICIANS,
                List.of("licenseNumber", "firstName", "lastName"),
                Map.of("id", Long.class, "status", TechnicianStatus.class, "active", Boolean.class),
                Set.of("id", "licenseNumber", "lastName", "hourlyRate", "createdAt"),
                "createdAt",
                Sort.Direction.DESC
        );
        return new JpaEntityGateway<>(metadata, repository, builder);
    }

    @Bean
    public EntityGateway<WorkOrder> workOrderGateway(WorkOrderRepository repository, QueryConstraintBuilder builder) {
        EntityMetadata metadata = new EntityMetadata(
                ResourceType.WORK_ORDERS,
                List.of("title", "description"),
                Map.of(
                        "status", WorkOrderStatus.class,
                        "priority", WorkOrderPriority.class,
                        "customerId", Long.class,
                        "assignedTechnicianId", Long.class,
                        "active", Boolean.class
                ),
                Set.of("id", "title", "priority", "status", "createdAt"),
                "createdAt",
                Sort.Direction.DESC
        );
        return new JpaEntityGateway<>(metadata, repository, builder);
    }

    @Bean
    public EntityGateway<Invoice> invoiceGateway(InvoiceRepository repository, QueryConstraintBuilder builder) {
        EntityMetadata metadata = new EntityMetadata(
                ResourceType.INVOICES,
                List.of("invoiceNumber"),
                Map.of(
                        "status", InvoiceStatus.class,
                        "customerId", Long.class,
                        "workOrderId", Long.class,
                        "active", Boolean.class
                ),
                Set.of("id", "invoiceNumber", "total", "dueDate", "createdAt"),
                "createdAt",
                Sort.Direction.DESC
        );
        return new JpaEntityGateway<>(metadata, repository, builder);
    }

    @Bean
    public EntityGateway<Contract> contractGateway(ContractRepository repository, QueryConstraintBuilder builder) {
        EntityMetadata metadata = new EntityMetadata(
                ResourceType.CONTRACTS,
                List.of("contractNumber"),
                Map.of("status", ContractStatus.class, "customerId", Long.class, "active", Boolean.class),
                Set.of("id", "contractNumber", "startDate", "endDate", "createdAt"),
                "createdAt",
                Sort.Direction.DESC
        );
        return new JpaEntityGateway<>(metadata, repository, builder);
    }

    @Bean
    public EntityGateway<InventoryItem> inventoryGateway(InventoryItemRepository repository, QueryConstraintBuilder builder) {
        EntityMetadata metadata = new EntityMetadata(
                ResourceType.INVENTORY,
                List.of("name", "sku", "location"),
                Map.of("status", InventoryStatus.class, "sku", String.class, "active", Boolean.class),
                Set.of("id", "name", "sku", "quantity", "createdAt"),
                "name",
                Sort.Direction.ASC
        );
        return new JpaEntityGateway<>(metadata, repository, builder);
    }

    @Bean
    public EntityGateway<PolicyAuditLog> policyAuditGateway(PolicyAuditLogRepository repository, QueryConstraintBuilder builder) {
        EntityMetadata metadata = new EntityMetadata(
                ResourceType.AUDIT_LOGS,
                List.of("reason"),
                Map.of(
                        "resourceType", String.class,
                        "outcome", String.class,
                        "role", String.class,
                        "requesterId", Long.class
                ),
                Set.of("id", "createdAt"),
                "createdAt",
                Sort.Direction.DESC
        );
        return new JpaEntityGateway<>(metadata, repository, builder);
    }
}
