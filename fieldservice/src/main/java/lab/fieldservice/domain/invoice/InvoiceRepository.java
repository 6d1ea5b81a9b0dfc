package lab.fieldservice.domain.invoice;

import lab.fieldservice.domain.SecuredRepository;

public interface InvoiceRepository extends SecuredRepository<Invoice> {
}
