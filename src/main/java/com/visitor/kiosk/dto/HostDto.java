package com.visitor.kiosk.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.visitor.kiosk.entity.Host;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HostDto {

    private Long id;
    private String fullName;
    private String email;
    private String phone;
    private String department;

    public static HostDto from(Host h) {
        return HostDto.builder()
                .id(h.getId())
                .fullName(h.getFullName())
                .email(h.getEmail())
                .phone(h.getPhone())
                .department(h.getDepartment())
                .build();
    }
}
