package lab.fieldservice.domain.technician;

import lab.fieldservice.domain.SecuredRepository;

public interface TechnicianRepository extends SecuredRepository<Technician> {
}
