package lab.fieldservice.orchestration;

import java.time.Instant;

public record RecordResponse<T>(
        boolean success,
        T data,
        boolean rlsApplied,
        String timestamp
) {
    public static <T> RecordResponse<T> of(T data, boolean rlsApplied) {
        return new RecordResponse<>(true, data, rlsApplied, Instant.now().toString());
    }
}
