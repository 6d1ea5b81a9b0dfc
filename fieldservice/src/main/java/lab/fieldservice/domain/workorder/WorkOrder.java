package lab.fieldservice.domain.workorder;

import jakarta.persistence.*;
import lab.fieldservice.domain.RowScoped;
import lab.fieldservice.orchestration.policy.RecordAttributes;
import lombok.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "work_orders", indexes = {
        @Index(name = "idx_work_order_customer", columnList = "customerId"),
        @Index(name = "idx_work_order_technician", columnList = "assignedTechnicianId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class WorkOrder implements RowScoped {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WorkOrderPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private WorkOrderStatus status;

    @Column(nullable = false)
    private Long customerId;

    private Long assignedTechnicianId;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static WorkOrder opened(String title, String description, WorkOrderPriority priority, Long customerId) {
        Instant now = Instant.now();
        return WorkOrder.builder()
                .title(title)
                .description(description)
                .priority(priority == null ? WorkOrderPriority.NORMAL : priority)
                .status(WorkOrderStatus.PENDING)
                .customerId(customerId)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void assignTo(Long technicianId) {
        this.assignedTechnicianId = technicianId;
        if (technicianId != null && this.status == WorkOrderStatus.PENDING) {
            this.status = WorkOrderStatus.ASSIGNED;
        }
        this.updatedAt = Instant.now();
    }

    public void revise(String title, String description, WorkOrderPriority priority, WorkOrderStatus status,
                       Long customerId, Boolean active) {
        if (title != null) this.title = title;
        if (description != null) this.description = description;
        if (priority != null) this.priority = priority;
        if (status != null) this.status = status;
        if (customerId != null) this.customerId = customerId;
        if (active != null) this.active = active;
        this.updatedAt = Instant.now();
    }

    @Override
    public RecordAttributes attributes() {
        Map<String, Object> values = new HashMap<>();
        values.put("id", id);
        values.put("customerId", customerId);
        values.put("assignedTechnicianId", assignedTechnicianId);
        values.put("status", status);
        values.put("priority", priority);
        values.put("active", active);
        return RecordAttributes.of(values);
    }
}
