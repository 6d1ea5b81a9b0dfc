package lab.fieldservice.domain.customer;

import lab.fieldservice.domain.SecuredRepository;

public interface CustomerRepository extends SecuredRepository<Customer> {
}
