package lab.fieldservice.domain;

import lab.fieldservice.orchestration.policy.RecordAttributes;

/**
 * A persisted record that row-level policies can inspect.
 */
public interface RowScoped {

    Long getId();

    RecordAttributes attributes();
}
