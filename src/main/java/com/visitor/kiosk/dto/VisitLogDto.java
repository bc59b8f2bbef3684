package com.visitor.kiosk.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.visitor.kiosk.entity.VisitLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Visit log with the visitor and host inlined, as returned by finalize and
 * the admin listing.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VisitLogDto {

    private Long id;
    private VisitorDto visitor;
    private HostDto host;
    private String purpose;
    private Instant checkInTime;
    private Instant checkOutTime;
    private String status;

    public static VisitLogDto from(VisitLog log) {
        return VisitLogDto.builder()
                .id(log.getId())
                .visitor(VisitorDto.from(log.getVisitor()))
                .host(HostDto.from(log.getHost()))
                .purpose(log.getPurpose())
                .checkInTime(log.getCheckInTime())
                .checkOutTime(log.getCheckOutTime())
                .status(log.getStatus().value())
                .build();
    }
}
