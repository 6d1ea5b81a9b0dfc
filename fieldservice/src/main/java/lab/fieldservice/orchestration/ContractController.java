package lab.fieldservice.orchestration;

import lab.fieldservice.adapter.EntityGateway;
import lab.fieldservice.config.RlsProperties;
import lab.fieldservice.domain.contract.Contract;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/contracts")
public class ContractController extends SecuredEntityController<Contract, ContractRequest> {

    public ContractController(
            RowLevelSecurityMediator mediator,
            EntityGateway<Contract> gateway,
            RequesterResolver requesterResolver,
            RlsProperties rlsProperties
    ) {
        super(mediator, gateway, requesterResolver, rlsProperties);
    }

    @Override
    protected String displayName() {
        return "Contract";
    }

    @Override
    protected Contract toEntity(ContractRequest request) {
        return Contract.drafted(
                required(request.contractNumber(), "contractNumber"),
                required(request.customerId(), "customerId"),
                required(request.startDate(), "startDate"),
                request.endDate(),
                request.contractValue()
        );
    }

    @Override
    protected void applyChanges(Contract contract, ContractRequest request) {
        contract.revise(request.customerId(), request.startDate(), request.endDate(),
                request.contractValue(), request.status(), request.active());
    }
}
