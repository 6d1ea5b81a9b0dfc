package lab.fieldservice.orchestration;

import lab.fieldservice.adapter.EntityGateway;
import lab.fieldservice.config.RlsProperties;
import lab.fieldservice.domain.inventory.InventoryItem;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/inventory")
public class InventoryController extends SecuredEntityController<InventoryItem, InventoryRequest> {

    public InventoryController(
            RowLevelSecurityMediator mediator,
            EntityGateway<InventoryItem> gateway,
            RequesterResolver requesterResolver,
            RlsProperties rlsProperties
    ) {
        super(mediator, gateway, requesterResolver, rlsProperties);
    }

    @Override
    protected String displayName() {
        return "Inventory item";
    }

    @Override
    protected InventoryItem toEntity(InventoryRequest request) {
        return InventoryItem.stocked(
                required(request.name(), "name"),
                required(request.sku(), "sku"),
                request.quantity() == null ? 0 : request.quantity(),
                request.reorderLevel() == null ? 0 : request.reorderLevel(),
                request.unitCost(),
                request.location()
        );
    }

    @Override
    protected void applyChanges(InventoryItem item, InventoryRequest request) {
        item.revise(request.name(), request.quantity(), request.reorderLevel(), request.unitCost(),
                request.location(), request.status(), request.active());
    }
}
