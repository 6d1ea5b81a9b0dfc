package lab.fieldservice.domain.inventory;

import lab.fieldservice.domain.SecuredRepository;

public interface InventoryItemRepository extends SecuredRepository<InventoryItem> {
}
