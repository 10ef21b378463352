package com.rms.restaurantservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DashboardStats {
    private long totalOrders;
    private BigDecimal totalRevenue;
    private long pendingOrders;
    private long menuItems;
    private long lowStock;
    private long todayOrders;
}
