package com.temple.booking.infrastructure.persistence.availability.jpa.entity;

import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.AvailabilityRecord;
import com.temple.booking.domain.availability.DateState;
import com.temple.booking.domain.availability.DateStatus;
import com.temple.booking.domain.availability.RequesterId;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(
        name = "availability_record",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_availability_hall_date",
                columnNames = {"hall_id", "booking_date"}
        ),
        indexes = {
                @Index(name = "idx_state_hold_expires_at", columnList = "state, hold_expires_at")
        }
)
public class AvailabilityRecordJpaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hall_id", nullable = false)
    private Integer hallId;

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private DateState state;

    @Column(name = "reason", length = 100)
    private String reason;

    @Column(name = "holder_id", length = 64)
    private String holderId;

    @Column(name = "hold_expires_at")
    private Instant holdExpiresAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    protected AvailabilityRecordJpaEntity() {}

    public AvailabilityRecordJpaEntity(AvailabilityRecord record) {
        this.hallId = record.key().hallId();
        this.bookingDate = record.key().date();
        apply(record);
    }

    /**
     * 도메인 레코드의 상태를 반영 (키와 버전은 그대로, version 은 JPA 가 증가시킴)
     */
    public void apply(AvailabilityRecord record) {
        this.state = record.status().getState();
        this.reason = record.status().getReason();
        this.holderId = record.holderId() == null ? null : record.holderId().asString();
        this.holdExpiresAt = record.holdExpiresAt();
        this.updatedAt = record.updatedAt();
    }

    public AvailabilityRecord toDomain() {
        return new AvailabilityRecord(
                AvailabilityKey.of(hallId, bookingDate),
                DateStatus.of(state, reason),
                RequesterId.ofNullable(holderId),
                holdExpiresAt,
                updatedAt,
                version
        );
    }

    public Long getId() { return id; }
    public Integer getHallId() { return hallId; }
    public LocalDate getBookingDate() { return bookingDate; }
    public DateState getState() { return state; }
    public Long getVersion() { return version; }
}
