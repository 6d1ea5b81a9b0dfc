package lab.fieldservice.domain.contract;

import lab.fieldservice.domain.SecuredRepository;

public interface ContractRepository extends SecuredRepository<Contract> {
}
