package com.visitor.kiosk.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.visitor.kiosk.entity.AdminUser;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Dashboard view of an admin account, without the password hash.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AdminUserDto {

    private Long id;
    private String username;
    private String fullName;

    @JsonProperty("is_active")
    private boolean active;

    private Instant createdAt;

    public static AdminUserDto from(AdminUser u) {
        return AdminUserDto.builder()
                .id(u.getId())
                .username(u.getUsername())
                .fullName(u.getFullName())
                .active(u.isActive())
                .createdAt(u.getCreatedAt())
                .build();
    }
}
