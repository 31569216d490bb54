package com.ai.salon.repository;

import com.ai.salon.conversation.Slot;
import com.ai.salon.entity.AppointmentSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface AppointmentSlotRepository extends JpaRepository<AppointmentSlot, Long> {

    Optional<AppointmentSlot> findBySlotDateAndSlot(LocalDate slotDate, Slot slot);

    /**
     * Creates the zero tally for (date, slot) unless it already exists. A row created
     * concurrently by another transaction is left alone instead of raising a key clash.
     */
    @Modifying
    @Query(value = "INSERT INTO appointment_slots (slot_date, slot_time, booked_count, version) "
            + "VALUES (:slotDate, :slot, 0, 0) ON CONFLICT DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("slotDate") LocalDate slotDate, @Param("slot") String slot);

    /**
     * Claims one unit of capacity. Returns 0 when the slot is already at {@code capacity}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AppointmentSlot s SET s.bookedCount = s.bookedCount + 1, s.version = s.version + 1 "
            + "WHERE s.id = :id AND s.bookedCount < :capacity")
    int claimIfBelow(@Param("id") Long id, @Param("capacity") int capacity);

    /**
     * Unconditional claim, used by the unchecked append path.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AppointmentSlot s SET s.bookedCount = s.bookedCount + 1, s.version = s.version + 1 WHERE s.id = :id")
    int claim(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AppointmentSlot s SET s.bookedCount = s.bookedCount - 1, s.version = s.version + 1 "
            + "WHERE s.id = :id AND s.bookedCount > 0")
    int release(@Param("id") Long id);
}
