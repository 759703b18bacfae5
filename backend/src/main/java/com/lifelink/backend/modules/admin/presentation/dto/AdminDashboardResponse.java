package com.lifelink.backend.modules.admin.presentation.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import com.lifelink.backend.modules.admin.application.AdminService.DashboardSummary;

public record AdminDashboardResponse(
        Map<String, Long> usersByRole,
        Map<String, Long> requestsByStatus,
        Map<String, Long> donationsByStatus
) {

    public static AdminDashboardResponse from(DashboardSummary summary) {
        Map<String, Long> users = new LinkedHashMap<>();
        summary.usersByRole().forEach((role, count) -> users.put(role.name().toLowerCase(), count));
        Map<String, Long> requests = new LinkedHashMap<>();
        summary.requestsByStatus().forEach((status, count) -> requests.put(status.getCode(), count));
        Map<String, Long> donations = new LinkedHashMap<>();
        summary.donationsByStatus().forEach((status, count) -> donations.put(status.getCode(), count));
        return new AdminDashboardResponse(users, requests, donations);
    }
}
