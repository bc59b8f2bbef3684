package com.visitor.kiosk.controller;

import com.visitor.kiosk.dto.NotifyHostRequest;
import com.visitor.kiosk.service.HostNotificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@Tag(name = "notifications", description = "Notification triggers to hosts")
public class NotificationController {

    private final HostNotificationService notificationService;

    public NotificationController(HostNotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Operation(summary = "Notify a host that their visitor has arrived")
    @PostMapping("/notify-host")
    public ResponseEntity<?> notifyHost(@RequestBody NotifyHostRequest request) {
        if (!StringUtils.hasText(request.getHostEmail()) || !StringUtils.hasText(request.getVisitorName())) {
            return ResponseEntity.badRequest().body(Map.of("detail", "host_email and visitor_name required"));
        }
        String channel = notificationService.notifyHost(request.getHostEmail(), request.getVisitorName());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "sent");
        body.put("host_email", request.getHostEmail());
        body.put("visitor_name", request.getVisitorName());
        body.put("channel", channel);
        return ResponseEntity.ok(body);
    }
}
