package lab.fieldservice.orchestration.policy;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyEvaluatorTest {

    private final PolicyEvaluator evaluator = new PolicyEvaluator();

    private static final Requester CUSTOMER = new Requester(7L, "customer", 42L, null);
    private static final Requester TECHNICIAN = new Requester(9L, "technician", null, 3L);

    private static RecordAttributes invoiceOwnedBy(Object customerId) {
        Map<String, Object> values = new HashMap<>();
        values.put("id", 100L);
        values.put("customerId", customerId);
        return RecordAttributes.of(values);
    }

    private static Policy customerOwnsInvoices(OperationClass operationClass) {
        return Policy.ownRecords("customer", ResourceType.INVOICES, operationClass, "customerId",
                OwnerValue.CUSTOMER_PROFILE_ID);
    }

    @Nested
    class DenyAll {

        @Test
        void list_returnsMatchNothingFilter() {
            Policy policy = Policy.of("technician", ResourceType.CONTRACTS, OperationClass.READ, PolicyKind.DENY_ALL);

            AccessDecision decision = evaluator.evaluate(policy,
                    RequestContext.of(TECHNICIAN, ResourceType.CONTRACTS, Operation.LIST));

            assertThat(decision.outcome()).isEqualTo(AccessOutcome.ALLOW_FILTERED);
            assertThat(decision.filterPredicate()).contains(RowFilter.matchNothing());
            assertThat(decision.policyApplied()).isTrue();
            assertThat(decision.reason()).isEqualTo("DENY_ALL");
        }

        @Test
        void write_isDenied() {
            Policy policy = Policy.of("technician", ResourceType.CONTRACTS, OperationClass.WRITE, PolicyKind.DENY_ALL);

            AccessDecision decision = evaluator.evaluate(policy,
                    RequestContext.of(TECHNICIAN, ResourceType.CONTRACTS, Operation.DELETE)
                            .withTarget(invoiceOwnedBy(1L)));

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.filterPredicate()).isEmpty();
        }

        @Test
        void unregisteredDefault_reportsNoPolicyReason() {
            Policy policy = Policy.defaultDeny("janitor", ResourceType.INVOICES, OperationClass.READ);

            AccessDecision decision = evaluator.evaluate(policy,
                    RequestContext.of(Requester.of(1L, "janitor"), ResourceType.INVOICES, Operation.LIST));

            assertThat(decision.outcome()).isEqualTo(AccessOutcome.ALLOW_FILTERED);
            assertThat(decision.policyApplied()).isTrue();
            assertThat(decision.reason()).isEqualTo("NO_POLICY_REGISTERED");
        }
    }

    @Test
    void allRecords_allowsEverythingAndReportsApplied() {
        Policy policy = Policy.of("admin", ResourceType.CONTRACTS, OperationClass.READ, PolicyKind.ALL_RECORDS);

        AccessDecision decision = evaluator.evaluate(policy,
                RequestContext.of(Requester.of(1L, "admin"), ResourceType.CONTRACTS, Operation.LIST));

        assertThat(decision.outcome()).isEqualTo(AccessOutcome.ALLOW_ALL);
        assertThat(decision.filterPredicate()).isEmpty();
        assertThat(decision.policyApplied()).isTrue();
    }

    @Test
    void publicResource_allowsEverythingAndReportsNotApplied() {
        Policy policy = Policy.of("technician", ResourceType.INVENTORY, OperationClass.READ, PolicyKind.PUBLIC_RESOURCE);

        AccessDecision decision = evaluator.evaluate(policy,
                RequestContext.of(TECHNICIAN, ResourceType.INVENTORY, Operation.LIST));

        assertThat(decision.outcome()).isEqualTo(AccessOutcome.ALLOW_ALL);
        assertThat(decision.policyApplied()).isFalse();
    }

    @Nested
    class OwnRecordsOnly {

        @Test
        void list_filtersOnOwnerFieldWithRequesterIdentity() {
            AccessDecision decision = evaluator.evaluate(customerOwnsInvoices(OperationClass.READ),
                    RequestContext.of(CUSTOMER, ResourceType.INVOICES, Operation.LIST));

            assertThat(decision.outcome()).isEqualTo(AccessOutcome.ALLOW_FILTERED);
            assertThat(decision.filterPredicate()).contains(RowFilter.fieldEquals("customerId", 42L));
        }

        @Test
        void get_ownRecord_isAllowed() {
            AccessDecision decision = evaluator.evaluate(customerOwnsInvoices(OperationClass.READ),
                    RequestContext.of(CUSTOMER, ResourceType.INVOICES, Operation.GET).withTarget(invoiceOwnedBy(42L)));

            assertThat(decision.outcome()).isEqualTo(AccessOutcome.ALLOW_ALL);
            assertThat(decision.policyApplied()).isTrue();
        }

        @Test
        void get_otherRecord_isDenied() {
            AccessDecision decision = evaluator.evaluate(customerOwnsInvoices(OperationClass.READ),
                    RequestContext.of(CUSTOMER, ResourceType.INVOICES, Operation.GET).withTarget(invoiceOwnedBy(43L)));

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.reason()).isEqualTo("OWNER_MISMATCH: customerId");
        }

        @Test
        void update_ownerComparedByNumericValue() {
            AccessDecision decision = evaluator.evaluate(customerOwnsInvoices(OperationClass.WRITE),
                    RequestContext.of(CUSTOMER, ResourceType.INVOICES, Operation.UPDATE).withTarget(invoiceOwnedBy(42)));

            assertThat(decision.outcome()).isEqualTo(AccessOutcome.ALLOW_ALL);
        }

        @Test
        void update_missingOwnerField_isDeniedWithoutException() {
            AccessDecision decision = evaluator.evaluate(customerOwnsInvoices(OperationClass.WRITE),
                    RequestContext.of(CUSTOMER, ResourceType.INVOICES, Operation.UPDATE).withTarget(invoiceOwnedBy(null)));

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.reason()).isEqualTo("OWNER_FIELD_MISSING: customerId");
        }

        @Test
        void write_withoutTarget_isDenied() {
            AccessDecision decision = evaluator.evaluate(customerOwnsInvoices(OperationClass.WRITE),
                    RequestContext.of(CUSTOMER, ResourceType.INVOICES, Operation.CREATE));

            assertThat(decision.isDenied()).isTrue();
        }

        @Test
        void missingRequesterIdentity_readsNothingAndDeniesWrites() {
            Requester noProfile = Requester.of(7L, "customer");

            AccessDecision read = evaluator.evaluate(customerOwnsInvoices(OperationClass.READ),
                    RequestContext.of(noProfile, ResourceType.INVOICES, Operation.LIST));
            AccessDecision write = evaluator.evaluate(customerOwnsInvoices(OperationClass.WRITE),
                    RequestContext.of(noProfile, ResourceType.INVOICES, Operation.UPDATE).withTarget(invoiceOwnedBy(42L)));

            assertThat(read.filterPredicate()).contains(RowFilter.matchNothing());
            assertThat(write.isDenied()).isTrue();
            assertThat(write.reason()).startsWith("REQUESTER_IDENTITY_MISSING");
        }

        @Test
        void defaultOwnerValue_comparesWithUserId() {
            Policy policy = Policy.ownRecords("technician", ResourceType.WORK_ORDERS, OperationClass.READ,
                    "createdBy", null);

            AccessDecision decision = evaluator.evaluate(policy,
                    RequestContext.of(TECHNICIAN, ResourceType.WORK_ORDERS, Operation.LIST));

            assertThat(decision.filterPredicate()).contains(RowFilter.fieldEquals("createdBy", 9L));
        }
    }

    @Nested
    class MinimumRole {

        private final Policy managerOrAbove = Policy.minimumRole("dispatcher", ResourceType.AUDIT_LOGS,
                OperationClass.READ, Role.MANAGER);

        @Test
        void rankBelowMinimum_isDenied() {
            AccessDecision decision = evaluator.evaluate(managerOrAbove,
                    RequestContext.of(Requester.of(1L, "dispatcher"), ResourceType.AUDIT_LOGS, Operation.LIST));

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.policyApplied()).isTrue();
        }

        @Test
        void rankAtOrAboveMinimum_isAllowed() {
            AccessDecision manager = evaluator.evaluate(managerOrAbove,
                    RequestContext.of(Requester.of(1L, "manager"), ResourceType.AUDIT_LOGS, Operation.LIST));
            AccessDecision admin = evaluator.evaluate(managerOrAbove,
                    RequestContext.of(Requester.of(1L, "ADMIN"), ResourceType.AUDIT_LOGS, Operation.LIST));

            assertThat(manager.outcome()).isEqualTo(AccessOutcome.ALLOW_ALL);
            assertThat(admin.outcome()).isEqualTo(AccessOutcome.ALLOW_ALL);
        }

        @Test
        void unknownRole_ranksZero() {
            AccessDecision decision = evaluator.evaluate(managerOrAbove,
                    RequestContext.of(Requester.of(1L, "auditor"), ResourceType.AUDIT_LOGS, Operation.LIST));

            assertThat(decision.isDenied()).isTrue();
        }
    }

    @Test
    void evaluate_isIdempotent() {
        Policy policy = customerOwnsInvoices(OperationClass.READ);
        RequestContext context = RequestContext.of(CUSTOMER, ResourceType.INVOICES, Operation.LIST);

        assertThat(evaluator.evaluate(policy, context)).isEqualTo(evaluator.evaluate(policy, context));
    }
}
