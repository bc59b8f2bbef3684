package com.visitor.kiosk.entity;

import com.visitor.kiosk.entity.converter.VisitStatusConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Locale;

@Entity
@Table(name = "visit_logs", indexes = {
    @Index(name = "idx_visit_logs_check_in_time", columnList = "check_in_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VisitLog {

    public enum Status {
        CHECKED_IN, CHECKED_OUT, CANCELLED;

        /** Lower-case wire form, e.g. {@code checked_in}. */
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Status fromValue(String value) {
            for (Status s : values()) {
                if (s.value().equalsIgnoreCase(value)) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Unknown visit status: " + value);
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "visitor_id", nullable = false)
    private Visitor visitor;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "host_id", nullable = false)
    private Host host;

    private String purpose;

    @Column(name = "check_in_time", nullable = false, updatable = false)
    private Instant checkInTime;

    @Column(name = "check_out_time")
    private Instant checkOutTime;

    @Convert(converter = VisitStatusConverter.class)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.CHECKED_IN;

    @PrePersist
    protected void onCreate() {
        if (checkInTime == null) checkInTime = Instant.now();
    }
}
