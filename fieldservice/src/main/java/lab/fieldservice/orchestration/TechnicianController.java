package lab.fieldservice.orchestration;

import lab.fieldservice.adapter.EntityGateway;
import lab.fieldservice.config.RlsProperties;
import lab.fieldservice.domain.technician.Technician;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/technicians")
public class TechnicianController extends SecuredEntityController<Technician, TechnicianRequest> {

    public TechnicianController(
            RowLevelSecurityMediator mediator,
            EntityGateway<Technician> gateway,
            RequesterResolver requesterResolver,
            RlsProperties rlsProperties
    ) {
        super(mediator, gateway, requesterResolver, rlsProperties);
    }

    @Override
    protected String displayName() {
        return "Technician";
    }

    @Override
    protected Technician toEntity(TechnicianRequest request) {
        return Technician.hired(
                required(request.licenseNumber(), "licenseNumber"),
                request.firstName(),
                request.lastName(),
                request.hourlyRate()
        );
    }

    @Override
    protected void applyChanges(Technician technician, TechnicianRequest request) {
        technician.revise(request.licenseNumber(), request.firstName(), request.lastName(),
                request.hourlyRate(), request.status(), request.active());
    }
}
