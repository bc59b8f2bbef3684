package com.visitor.kiosk.controller;

import com.visitor.kiosk.service.AdminQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/admin")
@Tag(name = "admin", description = "Admin management & dashboard")
public class AdminController {

    private final AdminQueryService adminQueryService;

    public AdminController(AdminQueryService adminQueryService) {
        this.adminQueryService = adminQueryService;
    }

    @Operation(summary = "List all visitors (paginated)")
    @GetMapping("/visitors")
    public ResponseEntity<?> visitors(@RequestParam(defaultValue = "0") int skip,
                                      @RequestParam(defaultValue = "25") int limit) {
        return page(() -> adminQueryService.listVisitors(skip, limit));
    }

    @Operation(summary = "List visit logs, most recent first (paginated)")
    @GetMapping("/visitlogs")
    public ResponseEntity<?> visitLogs(@RequestParam(defaultValue = "0") int skip,
                                       @RequestParam(defaultValue = "25") int limit) {
        return page(() -> adminQueryService.listVisitLogs(skip, limit));
    }

    @Operation(summary = "List all hosts (paginated)")
    @GetMapping("/hosts")
    public ResponseEntity<?> hosts(@RequestParam(defaultValue = "0") int skip,
                                   @RequestParam(defaultValue = "25") int limit) {
        return page(() -> adminQueryService.listHosts(skip, limit));
    }

    @Operation(summary = "List admin users (paginated)")
    @GetMapping("/users")
    public ResponseEntity<?> users(@RequestParam(defaultValue = "0") int skip,
                                   @RequestParam(defaultValue = "25") int limit) {
        return page(() -> adminQueryService.listAdminUsers(skip, limit));
    }

    private static ResponseEntity<?> page(Supplier<List<?>> query) {
        try {
            return ResponseEntity.ok(query.get());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("detail", e.getMessage()));
        }
    }
}
