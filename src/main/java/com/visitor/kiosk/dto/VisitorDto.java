package com.visitor.kiosk.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.visitor.kiosk.entity.Visitor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VisitorDto {

    private Long id;
    private String fullName;
    private String email;
    private String phone;
    private String idNumber;
    private Instant createdAt;

    public static VisitorDto from(Visitor v) {
        return VisitorDto.builder()
                .id(v.getId())
                .fullName(v.getFullName())
                .email(v.getEmail())
                .phone(v.getPhone())
                .idNumber(v.getIdNumber())
                .createdAt(v.getCreatedAt())
                .build();
    }
}
