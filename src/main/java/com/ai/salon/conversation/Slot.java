package com.ai.salon.conversation;

import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The seven bookable times of day, declared in canonical order.
 */
public enum Slot {

    NINE_AM(LocalTime.of(9, 0), "9:00 AM"),
    TEN_AM(LocalTime.of(10, 0), "10:00 AM"),
    ELEVEN_AM(LocalTime.of(11, 0), "11:00 AM"),
    ONE_PM(LocalTime.of(13, 0), "1:00 PM"),
    TWO_PM(LocalTime.of(14, 0), "2:00 PM"),
    THREE_PM(LocalTime.of(15, 0), "3:00 PM"),
    FOUR_PM(LocalTime.of(16, 0), "4:00 PM");

    // 10 AM, 10:00am, 10.00 AM, 14:00
    private static final Pattern TIME = Pattern.compile("^(\\d{1,2})(?:[:.](\\d{2}))?\\s*(a\\.?m\\.?|p\\.?m\\.?)?$");

    private final LocalTime startTime;
    private final String label;

    Slot(LocalTime startTime, String label) {
        this.startTime = startTime;
        this.label = label;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public String getLabel() {
        return label;
    }

    public static List<Slot> ordered() {
        return Arrays.asList(values());
    }

    public static String labels(List<Slot> slots) {
        return slots.stream().map(Slot::getLabel).collect(Collectors.joining(", "));
    }

    /**
     * Parses a spoken or typed time of day. Empty when the text is not a time at all.
     */
    public static Optional<LocalTime> parseTime(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher m = TIME.matcher(raw.trim().toLowerCase(Locale.ENGLISH));
        if (!m.matches()) {
            return Optional.empty();
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
        String meridiem = m.group(3);
        if (minute > 59) {
            return Optional.empty();
        }
        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                return Optional.empty();
            }
            boolean pm = meridiem.startsWith("p");
            hour = hour % 12 + (pm ? 12 : 0);
        } else if (hour > 23) {
            return Optional.empty();
        }
        return Optional.of(LocalTime.of(hour, minute));
    }

    public static Optional<Slot> fromTime(LocalTime time) {
        return Arrays.stream(values()).filter(s -> s.startTime.equals(time)).findFirst();
    }

    /**
     * Resolves free text such as "10 AM" or "14:00" to a slot. Empty both for
     * unparseable text and for a real time outside business hours.
     */
    public static Optional<Slot> fromLabel(String raw) {
        return parseTime(raw).flatMap(Slot::fromTime);
    }
}
