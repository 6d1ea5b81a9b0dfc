package lab.fieldservice.orchestration;

import lab.fieldservice.adapter.EntityGateway;
import lab.fieldservice.config.RlsProperties;
import lab.fieldservice.domain.invoice.Invoice;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController extends SecuredEntityController<Invoice, InvoiceRequest> {

    public InvoiceController(
            RowLevelSecurityMediator mediator,
            EntityGateway<Invoice> gateway,
            RequesterResolver requesterResolver,
            RlsProperties rlsProperties
    ) {
        super(mediator, gateway, requesterResolver, rlsProperties);
    }

    @Override
    protected String displayName() {
        return "Invoice";
    }

    @Override
    protected Invoice toEntity(InvoiceRequest request) {
        return Invoice.drafted(
                required(request.invoiceNumber(), "invoiceNumber"),
                required(request.customerId(), "customerId"),
                request.workOrderId(),
                required(request.amount(), "amount"),
                request.tax(),
                request.dueDate()
        );
    }

    // The invoice number is fixed once issued.
    @Override
    protected void applyChanges(Invoice invoice, InvoiceRequest request) {
        invoice.revise(request.customerId(), request.workOrderId(), request.amount(), request.tax(),
                request.status(), request.dueDate(), request.active());
    }
}
