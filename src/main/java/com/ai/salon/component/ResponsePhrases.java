package com.ai.salon.component;

import com.ai.salon.conversation.Slot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Every sentence the receptionist says back to a caller, failures included.
 */
@Component
public class ResponsePhrases {

    public String currentDateTime(String humanReadable) {
        return "The current date and time is " + humanReadable;
    }

    // booking context

    public String fieldsUpdated(List<String> updated, List<String> missing) {
        return "I've updated: " + String.join(", ", updated) + ". I still need: " + String.join(", ", missing) + ".";
    }

    public String allDetailsCollected(List<String> updated) {
        return "Great! I've updated: " + String.join(", ", updated)
                + ". I now have all your information. Let me summarize everything for you.";
    }

    public String nothingToUpdate() {
        return "I didn't catch any booking details. Could you repeat them?";
    }

    public String contextUpdateFailed() {
        return "I had trouble saving that information. Could you repeat it?";
    }

    public String missingName() {
        return "I didn't catch your name. Could you tell me your full name?";
    }

    public String invalidPhone(String raw) {
        return "'" + raw + "' isn't a valid phone number. Phone number must be exactly 10 digits. "
                + "Please provide a valid 10-digit phone number.";
    }

    public String unknownService(String raw, String services) {
        return "'" + raw + "' is not available. Our services are: " + services;
    }

    public String unreadableDate(String raw) {
        return "Sorry, I couldn't understand the date '" + raw + "'. Could you say it like January 15, 2025?";
    }

    public String closedOn(String dayName) {
        return "We're closed on " + dayName + "s. Please choose another day (we're open every other day of the week).";
    }

    public String unreadableTime(String raw) {
        return "Sorry, I couldn't understand the time '" + raw + "'. Our appointment times are: " + Slot.labels(Slot.ordered());
    }

    public String outsideBusinessHours(String time) {
        return time + " is outside our business hours. Our appointment times are: " + Slot.labels(Slot.ordered());
    }

    // summary and booking

    public String bookingIncomplete(List<String> missing) {
        return "Booking is incomplete. Still need: " + String.join(", ", missing);
    }

    public String bookingSummary(String name, String phone, String service, BigDecimal price, String date, String time) {
        return "Here's what I have:\n"
                + "Name: " + name + "\n"
                + "Phone: " + phone + "\n"
                + "Service: " + service + " ($" + price.stripTrailingZeros().toPlainString() + ")\n"
                + "Date: " + date + "\n"
                + "Time: " + time + "\n\n"
                + "Does everything look correct?";
    }

    public String cannotBookIncomplete() {
        return "Cannot book - missing required information. Please provide all details first.";
    }

    public String summarizeFirst() {
        return "Please let me summarize the booking details for confirmation first.";
    }

    public String slotTakenBeforeConfirm(String time, String date, List<Slot> alternatives) {
        if (alternatives.isEmpty()) {
            return "I'm sorry, " + time + " on " + date + " is now fully booked, and so is the rest of that day. "
                    + "Would you like to pick another date?";
        }
        return "I'm sorry, " + time + " on " + date + " is now fully booked. Available slots on " + date + ": "
                + Slot.labels(alternatives);
    }

    public String bookingConfirmed(String service, String date, String time, String confirmationNumber) {
        return "Perfect! Your appointment is confirmed for " + service + " on " + date + " at " + time
                + ". Your confirmation number is " + confirmationNumber + ". We'll see you then!";
    }

    public String bookingFailed() {
        return "I apologize, but I'm having trouble completing your booking right now. "
                + "Let me get assistance from my supervisor to help you with this.";
    }

    // availability

    public String slotAvailable(String time, String date) {
        return time + " on " + date + " is available.";
    }

    public String slotFull(String time, String date, List<Slot> alternatives) {
        if (alternatives.isEmpty()) {
            return "All slots on " + date + " are fully booked.";
        }
        return time + " is fully booked. Available slots on " + date + ": " + Slot.labels(alternatives);
    }

    public String outsideBusinessHoursOn(String time, String date, List<Slot> available) {
        return time + " is outside our business hours. Available times on " + date + ": " + Slot.labels(available);
    }

    public String availableTimes(String date, List<Slot> available) {
        if (available.isEmpty()) {
            return "Unfortunately, we're fully booked on " + date + ". Would you like to check another date?";
        }
        return "Available times on " + date + ":\n"
                + available.stream().map(s -> "• " + s.getLabel()).collect(Collectors.joining("\n"));
    }

    public String availabilityFailed() {
        return "I'm having trouble checking availability. Let me get help from my supervisor.";
    }

    // help

    public String escalated() {
        return "Let me check with my supervisor about that and get back to you. "
                + "I've noted your question. Please hold for a moment while I get the correct information.";
    }

    public String helpFailed() {
        return "I'm having a technical issue right now. Please hold on or I can connect you with a supervisor.";
    }
}
