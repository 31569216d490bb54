package com.ai.salon.service;

import com.ai.salon.component.BookingRules;
import com.ai.salon.conversation.Slot;
import com.ai.salon.entity.Appointment;
import com.ai.salon.entity.AppointmentSlot;
import com.ai.salon.exception.AppointmentConflictException;
import com.ai.salon.exception.AppointmentNotFoundException;
import com.ai.salon.repository.AppointmentRepository;
import com.ai.salon.repository.AppointmentSlotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Appointment records and per-(date, slot) capacity.
 * Counts come from the appointment rows; the {@code appointment_slots} tally is what
 * reservations contend on.
 */
@Service
public class SlotLedger {

    private static final Logger log = LoggerFactory.getLogger(SlotLedger.class);

    private final AppointmentRepository appointmentRepository;
    private final AppointmentSlotRepository slotRepository;
    private final BookingRules rules;

    public SlotLedger(AppointmentRepository appointmentRepository,
                      AppointmentSlotRepository slotRepository,
                      BookingRules rules) {
        this.appointmentRepository = appointmentRepository;
        this.slotRepository = slotRepository;
        this.rules = rules;
    }

    /**
     * Non-cancelled appointments at (date, slot).
     */
    @Transactional(readOnly = true)
    public long count(LocalDate date, Slot slot) {
        return appointmentRepository.countByAppointmentDateAndAppointmentTimeAndCancelledFalse(date, slot);
    }

    /**
     * Slots with spare capacity on {@code date}, in canonical slot order.
     */
    @Transactional(readOnly = true)
    public List<Slot> available(LocalDate date) {
        Map<Slot, Long> counts = new EnumMap<>(Slot.class);
        for (Object[] row : appointmentRepository.countActiveBySlot(date)) {
            counts.put((Slot) row[0], (Long) row[1]);
        }
        List<Slot> open = new ArrayList<>();
        for (Slot slot : Slot.ordered()) {
            if (counts.getOrDefault(slot, 0L) < rules.maxPerSlot()) {
                open.add(slot);
            }
        }
        return open;
    }

    @Transactional(readOnly = true)
    public SlotCheckResult check(LocalDate date, Slot slot) {
        if (count(date, slot) < rules.maxPerSlot()) {
            return SlotCheckResult.available(slot);
        }
        List<Slot> alternatives = available(date);
        return SlotCheckResult.full(slot, alternatives);
    }

    /**
     * Same as {@link #check(LocalDate, Slot)} for free-text times. A time that is not one
     * of the fixed slots is reported as outside business hours, never as full.
     */
    @Transactional(readOnly = true)
    public SlotCheckResult check(LocalDate date, String time) {
        Optional<Slot> slot = Slot.fromLabel(time);
        if (slot.isEmpty()) {
            return SlotCheckResult.outsideHours(available(date));
        }
        return check(date, slot.get());
    }

    /**
     * Appends a record without re-checking capacity. The tally still moves so that
     * later conditional reservations see the booking.
     */
    @Transactional
    public Appointment reserve(Appointment appointment) {
        AppointmentSlot tally = tallyFor(appointment.getAppointmentDate(), appointment.getAppointmentTime());
        slotRepository.claim(tally.getId());
        Appointment saved = appointmentRepository.save(appointment);
        log.info("Reserved {} on {} at {} (unchecked)", saved.getConfirmationNumber(),
                saved.getAppointmentDate(), saved.getAppointmentTime().getLabel());
        return saved;
    }

    /**
     * Claims capacity and inserts the record in one transaction. The claim is a single
     * conditional increment, so two callers can never both take the last unit.
     */
    @Transactional
    public ReservationResult reserveIfAvailable(Appointment appointment) {
        LocalDate date = appointment.getAppointmentDate();
        Slot slot = appointment.getAppointmentTime();
        AppointmentSlot tally = tallyFor(date, slot);
        if (slotRepository.claimIfBelow(tally.getId(), rules.maxPerSlot()) == 0) {
            log.info("Slot full: date={}, slot={}", date, slot.getLabel());
            return ReservationResult.full(available(date));
        }
        Appointment saved = appointmentRepository.save(appointment);
        log.info("Booking created: {} for {} on {} at {}", saved.getConfirmationNumber(), saved.getCustomerName(),
                date, slot.getLabel());
        return ReservationResult.reserved(saved);
    }

    /**
     * Cancels an appointment and gives its unit of capacity back.
     */
    @Transactional
    public Appointment cancel(String confirmationNumber, String reason) {
        Appointment appt = appointmentRepository.findByConfirmationNumberForUpdate(confirmationNumber)
                .orElseThrow(() -> new AppointmentNotFoundException(confirmationNumber));
        if (appt.isCancelled()) {
            throw new AppointmentConflictException("Appointment already cancelled: " + confirmationNumber);
        }
        appt.setStatus(Appointment.Status.CANCELLED);
        appt.setCancelled(true);
        appt.setCancellationReason(reason);
        appt.setCancelledAt(Instant.now());
        appointmentRepository.save(appt);

        slotRepository.findBySlotDateAndSlot(appt.getAppointmentDate(), appt.getAppointmentTime())
                .ifPresent(tally -> slotRepository.release(tally.getId()));
        log.info("Cancelled appointment {} ({})", confirmationNumber, reason);
        return appt;
    }

    /**
     * Every appointment on {@code date}, cancelled ones included, in slot order.
     */
    @Transactional(readOnly = true)
    public List<Appointment> bookingsOn(LocalDate date) {
        // appointment_time is stored by name, so slot order is applied here rather than in SQL
        return appointmentRepository.findByAppointmentDateOrderByCreatedAtAsc(date).stream()
                .sorted(Comparator.comparing(Appointment::getAppointmentTime))
                .toList();
    }

    private AppointmentSlot tallyFor(LocalDate date, Slot slot) {
        Optional<AppointmentSlot> existing = slotRepository.findBySlotDateAndSlot(date, slot);
        if (existing.isPresent()) {
            return existing.get();
        }
        if (slotRepository.insertIfAbsent(date, slot.name()) == 0) {
            log.debug("Tally row for {} {} created concurrently", date, slot);
        }
        return slotRepository.findBySlotDateAndSlot(date, slot)
                .orElseThrow(() -> new IllegalStateException("No tally row for " + date + " " + slot));
    }

    public record SlotCheckResult(Outcome outcome, Slot slot, List<Slot> alternatives) {

        public enum Outcome { AVAILABLE, FULL, OUTSIDE_HOURS }

        public static SlotCheckResult available(Slot slot) {
            return new SlotCheckResult(Outcome.AVAILABLE, slot, List.of());
        }

        public static SlotCheckResult full(Slot slot, List<Slot> alternatives) {
            return new SlotCheckResult(Outcome.FULL, slot, List.copyOf(alternatives));
        }

        public static SlotCheckResult outsideHours(List<Slot> available) {
            return new SlotCheckResult(Outcome.OUTSIDE_HOURS, null, List.copyOf(available));
        }

        public boolean isAvailable() {
            return outcome == Outcome.AVAILABLE;
        }
    }

    public record ReservationResult(boolean reserved, Appointment appointment, List<Slot> alternatives) {

        public static ReservationResult reserved(Appointment appointment) {
            return new ReservationResult(true, appointment, List.of());
        }

        public static ReservationResult full(List<Slot> alternatives) {
            return new ReservationResult(false, null, List.copyOf(alternatives));
        }
    }
}
