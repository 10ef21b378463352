package com.rms.restaurantservice.repository.inventory;

import com.rms.restaurantservice.model.MenuInventoryMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MenuInventoryMappingRepository extends JpaRepository<MenuInventoryMapping, Long> {
    List<MenuInventoryMapping> findByMenuItemIdOrderByIdAsc(Long menuItemId);

    boolean existsByMenuItemIdAndInventoryItemId(Long menuItemId, Long inventoryItemId);

    long countByMenuItemId(Long menuItemId);

    long countByInventoryItemId(Long inventoryItemId);
}
