package com.ai.salon.entity;

import com.ai.salon.conversation.Slot;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * Capacity tally for one (date, slot) pair. The row is the unit of contention:
 * reservations claim capacity with a conditional increment on {@code bookedCount}.
 */
@Entity
@Table(name = "appointment_slots", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"slot_date", "slot_time"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "slot_time", nullable = false, length = 16)
    private Slot slot;

    @Column(name = "booked_count", nullable = false)
    @Builder.Default
    private int bookedCount = 0;

    @Version
    private Long version;
}
