package com.salescrm.backend.controllers;

import com.salescrm.backend.dto.dashboard.*;
import com.salescrm.backend.dto.lead.LeadActivityDto;
import com.salescrm.backend.dto.lead.LeadDto;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.services.dashboard.DashboardService;
import com.salescrm.backend.services.dashboard.DateRange;
import com.salescrm.backend.services.dashboard.KpiService;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Sales dashboard. Every windowed endpoint accepts {@code range}
 * (today, week, month, quarter, year, custom) plus {@code from}/{@code to}
 * for custom ranges; the default is the current month.
 */
@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;
    private final KpiService kpiService;
    private final UserRepository userRepository;

    @GetMapping("/stats")
    public ResponseEntity<DashboardStatsDto> getStats(
            @RequestParam(required = false) String range,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(dashboardService.getStats(user, window(range, from, to)));
    }

    @GetMapping("/funnel")
    public ResponseEntity<List<FunnelStageDto>> getFunnel(
            @RequestParam(required = false) String range,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(dashboardService.getFunnel(user, window(range, from, to)));
    }

    @GetMapping("/charts/monthly")
    public ResponseEntity<List<MonthlyStatsDto>> getMonthly(Authentication authentication) {
        return ResponseEntity.ok(dashboardService.getMonthlyStats(getCurrentUser(authentication)));
    }

    @GetMapping("/charts/status")
    public ResponseEntity<List<StatusCountDto>> getStatusDistribution(
            @RequestParam(required = false) String range,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(dashboardService.getStatusDistribution(user, window(range, from, to)));
    }

    @GetMapping("/charts/sources")
    public ResponseEntity<List<SourcePerformanceDto>> getSourcePerformance(
            @RequestParam(required = false) String range,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(dashboardService.getSourcePerformance(user, window(range, from, to)));
    }

    @GetMapping("/charts/team")
    public ResponseEntity<List<TeamMemberPerformanceDto>> getTeamPerformance(
            @RequestParam(required = false) String range,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(dashboardService.getTeamPerformance(user, window(range, from, to)));
    }

    @GetMapping("/top-performers")
    public ResponseEntity<List<TeamMemberPerformanceDto>> getTopPerformers(
            @RequestParam(required = false) String range,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(dashboardService.getTopPerformers(user, window(range, from, to)));
    }

    @GetMapping("/overdue")
    public ResponseEntity<List<LeadDto>> getOverdueLeads(Authentication authentication) {
        return ResponseEntity.ok(dashboardService.getOverdueLeads(getCurrentUser(authentication)));
    }

    @GetMapping("/activities")
    public ResponseEntity<List<LeadActivityDto>> getRecentActivities(Authentication authentication) {
        return ResponseEntity.ok(dashboardService.getRecentActivities(getCurrentUser(authentication)));
    }

    @GetMapping("/kpi-targets")
    public ResponseEntity<List<KpiTargetDto>> getKpiTargets(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        if (from == null || to == null) {
            return ResponseEntity.ok(kpiService.getCurrentTargets(user));
        }
        return ResponseEntity.ok(kpiService.getTargets(user, from, to));
    }

    @PostMapping("/kpi-targets")
    public ResponseEntity<KpiTargetDto> createKpiTarget(
            @Valid @RequestBody KpiTargetRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(kpiService.createTarget(user, request));
    }

    private DateRange.Window window(String range, LocalDate from, LocalDate to) {
        return dashboardService.window(DateRange.parse(range), from, to);
    }

    private User getCurrentUser(Authentication authentication) {
        return userRepository.findByEmailIgnoreCase(authentication.getName())
                .orElseThrow(() -> new EntityNotFoundException("User not found"));
    }
}
