package com.ai.salon.repository;

import com.ai.salon.conversation.Slot;
import com.ai.salon.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    long countByAppointmentDateAndAppointmentTimeAndCancelledFalse(LocalDate appointmentDate, Slot appointmentTime);

    @Query("SELECT a.appointmentTime, COUNT(a) FROM Appointment a "
            + "WHERE a.appointmentDate = :date AND a.cancelled = false GROUP BY a.appointmentTime")
    List<Object[]> countActiveBySlot(@Param("date") LocalDate date);

    List<Appointment> findByAppointmentDateOrderByCreatedAtAsc(LocalDate appointmentDate);

    boolean existsByConfirmationNumber(String confirmationNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.confirmationNumber = :confirmationNumber")
    Optional<Appointment> findByConfirmationNumberForUpdate(@Param("confirmationNumber") String confirmationNumber);
}
