package com.rms.restaurantservice.controller;

import com.rms.restaurantservice.dto.DashboardStats;
import com.rms.restaurantservice.service.DashboardService;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping
    @PreAuthorize("@accessPolicy.permits(authentication)")
    public DashboardStats getStats() {
        return dashboardService.getStats();
    }
}
