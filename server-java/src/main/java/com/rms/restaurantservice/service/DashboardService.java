package com.rms.restaurantservice.service;

import com.rms.restaurantservice.dto.DashboardStats;
import com.rms.restaurantservice.model.OrderStatus;
import com.rms.restaurantservice.model.PaymentStatus;
import com.rms.restaurantservice.repository.MenuItemRepository;
import com.rms.restaurantservice.repository.inventory.InventoryItemRepository;
import com.rms.restaurantservice.repository.order.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.function.Supplier;

/**
 * Headline counters. A counter whose query fails is reported as zero so one bad query
 * never blanks the whole dashboard.
 */
@Service
public class DashboardService {

    private static final Logger logger = LoggerFactory.getLogger(DashboardService.class);

    private final OrderRepository orderRepository;
    private final MenuItemRepository menuItemRepository;
    private final InventoryItemRepository inventoryItemRepository;

    public DashboardService(OrderRepository orderRepository, MenuItemRepository menuItemRepository,
                            InventoryItemRepository inventoryItemRepository) {
        this.orderRepository = orderRepository;
        this.menuItemRepository = menuItemRepository;
        this.inventoryItemRepository = inventoryItemRepository;
    }

    public DashboardStats getStats() {
        return new DashboardStats(
                count("totalOrders", orderRepository::count),
                amount("totalRevenue", () -> orderRepository.sumTotalAmountByPaymentStatus(PaymentStatus.COMPLETED)),
                count("pendingOrders", () -> orderRepository.countByStatus(OrderStatus.PENDING)),
                count("menuItems", menuItemRepository::countByAvailableTrue),
                count("lowStock", inventoryItemRepository::countLowStock),
                count("todayOrders", () -> orderRepository.countByCreatedAtGreaterThanEqual(LocalDate.now().atStartOfDay()))
        );
    }

    private long count(String counter, Supplier<Long> query) {
        try {
            Long value = query.get();
            return value == null ? 0L : value;
        } catch (RuntimeException e) {
            logger.error("Dashboard counter {} failed: {}", counter, e.getMessage(), e);
            return 0L;
        }
    }

    private BigDecimal amount(String counter, Supplier<BigDecimal> query) {
        try {
            BigDecimal value = query.get();
            return value == null ? BigDecimal.ZERO : value;
        } catch (RuntimeException e) {
            logger.error("Dashboard counter {} failed: {}", counter, e.getMessage(), e);
            return BigDecimal.ZERO;
        }
    }
}
