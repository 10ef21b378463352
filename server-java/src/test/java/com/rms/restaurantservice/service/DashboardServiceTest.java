package com.rms.restaurantservice.service;

import com.rms.restaurantservice.dto.DashboardStats;
import com.rms.restaurantservice.model.OrderStatus;
import com.rms.restaurantservice.model.PaymentStatus;
import com.rms.restaurantservice.repository.MenuItemRepository;
import com.rms.restaurantservice.repository.inventory.InventoryItemRepository;
import com.rms.restaurantservice.repository.order.OrderRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private MenuItemRepository menuItemRepository;

    @Mock
    private InventoryItemRepository inventoryItemRepository;

    @InjectMocks
    private DashboardService dashboardService;

    @Test
    void failingCounterReportsZeroWhileOthersStillReport() {
        when(orderRepository.count()).thenReturn(12L);
        when(orderRepository.sumTotalAmountByPaymentStatus(PaymentStatus.COMPLETED)).thenReturn(new BigDecimal("1830.00"));
        when(orderRepository.countByStatus(OrderStatus.PENDING)).thenThrow(new DataAccessResourceFailureException("database is locked"));
        when(menuItemRepository.countByAvailableTrue()).thenReturn(4L);
        when(inventoryItemRepository.countLowStock()).thenReturn(1L);
        when(orderRepository.countByCreatedAtGreaterThanEqual(any())).thenReturn(3L);

        DashboardStats stats = dashboardService.getStats();

        assertThat(stats.getTotalOrders()).isEqualTo(12L);
        assertThat(stats.getTotalRevenue()).isEqualByComparingTo("1830");
        assertThat(stats.getPendingOrders()).isZero();
        assertThat(stats.getMenuItems()).isEqualTo(4L);
        assertThat(stats.getLowStock()).isEqualTo(1L);
        assertThat(stats.getTodayOrders()).isEqualTo(3L);
    }

    @Test
    void revenueWithNoCompletedPaymentsIsZero() {
        when(orderRepository.sumTotalAmountByPaymentStatus(PaymentStatus.COMPLETED)).thenReturn(null);

        assertThat(dashboardService.getStats().getTotalRevenue()).isEqualByComparingTo(BigDecimal.ZERO);
    }
}
