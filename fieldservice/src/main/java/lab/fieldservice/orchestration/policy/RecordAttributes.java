package lab.fieldservice.orchestration.policy;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the fields of one record, keyed by field name. Absent and null fields are
 * reported the same way.
 */
public final class RecordAttributes {

    private final Map<String, Object> values;

    private RecordAttributes(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new HashMap<String, Object>(values));
    }

    public static RecordAttributes of(Map<String, ?> values) {
        return new RecordAttributes(values == null ? Map.of() : values);
    }

    public static RecordAttributes empty() {
        return new RecordAttributes(Map.of());
    }

    public Optional<Object> get(String field) {
        return Optional.ofNullable(values.get(field));
    }

    /**
     * True when the field is present and equal to {@code expected}. Numbers compare by value so
     * an {@code Integer} 42 holds a {@code Long} 42.
     */
    public boolean holds(String field, Object expected) {
        return get(field).map(actual -> sameValue(actual, expected)).orElse(false);
    }

    static boolean sameValue(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Number left && expected instanceof Number right) {
            return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString())) == 0;
        }
        return actual.toString().equals(expected.toString());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RecordAttributes other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RecordAttributes" + values;
    }
}
