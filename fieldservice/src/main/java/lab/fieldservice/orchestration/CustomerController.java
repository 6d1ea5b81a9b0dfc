package lab.fieldservice.orchestration;

import lab.fieldservice.adapter.EntityGateway;
import lab.fieldservice.config.RlsProperties;
import lab.fieldservice.domain.customer.Customer;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/customers")
public class CustomerController extends SecuredEntityController<Customer, CustomerRequest> {

    public CustomerController(
            RowLevelSecurityMediator mediator,
            EntityGateway<Customer> gateway,
            RequesterResolver requesterResolver,
            RlsProperties rlsProperties
    ) {
        super(mediator, gateway, requesterResolver, rlsProperties);
    }

    @Override
    protected String displayName() {
        return "Customer";
    }

    @Override
    protected Customer toEntity(CustomerRequest request) {
        return Customer.registered(
                required(request.email(), "email"),
                request.firstName(),
                request.lastName(),
                request.phone(),
                request.companyName()
        );
    }

    @Override
    protected void applyChanges(Customer customer, CustomerRequest request) {
        customer.revise(request.email(), request.firstName(), request.lastName(),
                request.phone(), request.companyName(), request.active());
    }
}
