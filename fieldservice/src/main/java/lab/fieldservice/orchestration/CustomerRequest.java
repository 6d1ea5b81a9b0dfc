package lab.fieldservice.orchestration;

public record CustomerRequest(
        String email,
        String firstName,
        String lastName,
        String phone,
        String companyName,
        Boolean active
) {
}
