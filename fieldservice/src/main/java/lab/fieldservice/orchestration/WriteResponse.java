package lab.fieldservice.orchestration;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WriteResponse<T>(
        boolean success,
        String message,
        T data,
        String timestamp
) {
    public static <T> WriteResponse<T> of(String message, T data) {
        return new WriteResponse<>(true, message, data, Instant.now().toString());
    }

    public static WriteResponse<Void> of(String message) {
        return new WriteResponse<>(true, message, null, Instant.now().toString());
    }
}
