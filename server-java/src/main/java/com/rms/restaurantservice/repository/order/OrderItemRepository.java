package com.rms.restaurantservice.repository.order;

import com.rms.restaurantservice.model.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface OrderItemRepository extends JpaRepository<OrderItem, Long> {
    List<OrderItem> findByOrderId(Long orderId);

    boolean existsByMenuItemId(Long menuItemId);

    /**
     * Rows of {@code [orderId, menuItemId, menuItemName, quantity]} for the given orders, in insertion
     * order. The name is null when the menu item no longer exists.
     */
    @Query("SELECT oi.orderId, oi.menuItemId, m.name, oi.quantity FROM OrderItem oi " +
            "LEFT JOIN MenuItem m ON m.id = oi.menuItemId " +
            "WHERE oi.orderId IN :orderIds ORDER BY oi.orderId, oi.id")
    List<Object[]> findItemNamesByOrderIds(@Param("orderIds") Collection<Long> orderIds);
}
