package com.ai.salon.controller;

import com.ai.salon.component.BookingRules;
import com.ai.salon.conversation.Slot;
import com.ai.salon.dto.AppointmentView;
import com.ai.salon.dto.CancelRequest;
import com.ai.salon.dto.SlotAvailabilityView;
import com.ai.salon.exception.InvalidRequestException;
import com.ai.salon.service.SlotLedger;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private final SlotLedger slotLedger;
    private final BookingRules rules;

    public AppointmentController(SlotLedger slotLedger, BookingRules rules) {
        this.slotLedger = slotLedger;
        this.rules = rules;
    }

    @GetMapping
    public List<AppointmentView> bookingsOn(@RequestParam String date) {
        return slotLedger.bookingsOn(parseDate(date)).stream().map(AppointmentView::from).toList();
    }

    @GetMapping("/availability")
    public SlotAvailabilityView availability(@RequestParam String date, @RequestParam(required = false) String time) {
        LocalDate day = parseDate(date);
        String display = rules.formatDate(day);
        if (rules.isClosed(day)) {
            return new SlotAvailabilityView(display, time, "CLOSED", List.of());
        }
        if (StringUtils.isBlank(time)) {
            return new SlotAvailabilityView(display, null, "AVAILABLE_TIMES", labels(slotLedger.available(day)));
        }
        SlotLedger.SlotCheckResult check = slotLedger.check(day, time);
        String label = check.slot() == null ? time : check.slot().getLabel();
        List<String> available = check.isAvailable() ? List.of(label) : labels(check.alternatives());
        return new SlotAvailabilityView(display, label, check.outcome().name(), available);
    }

    @PostMapping("/{confirmationNumber}/cancel")
    public AppointmentView cancel(@PathVariable String confirmationNumber,
                                  @RequestBody(required = false) CancelRequest request) {
        String reason = request == null ? null : request.reason();
        return AppointmentView.from(slotLedger.cancel(confirmationNumber, StringUtils.defaultIfBlank(reason, "customer request")));
    }

    private LocalDate parseDate(String date) {
        return rules.parseDate(date).orElseThrow(() -> new InvalidRequestException("Unreadable date: " + date));
    }

    private static List<String> labels(List<Slot> slots) {
        return slots.stream().map(Slot::getLabel).toList();
    }
}
