package lab.fieldservice.orchestration.policy;

/**
 * Row predicate produced by the evaluator. Kept free of persistence types; the query layer
 * translates it into its own constraint.
 */
public interface RowFilter {

    boolean matches(RecordAttributes record);

    static RowFilter matchNothing() {
        return MatchNothing.INSTANCE;
    }

    static RowFilter fieldEquals(String field, Object value) {
        return new FieldEquals(field, value);
    }

    enum MatchNothing implements RowFilter {
        INSTANCE;

        @Override
        public boolean matches(RecordAttributes record) {
            return false;
        }

        @Override
        public String toString() {
            return "MATCH_NOTHING";
        }
    }

    record FieldEquals(String field, Object value) implements RowFilter {

        @Override
        public boolean matches(RecordAttributes record) {
            return record != null && record.holds(field, value);
        }

        @Override
        public String toString() {
            return field + "=" + value;
        }
    }
}
