package com.ai.salon.component;

import com.ai.salon.config.SalonProperties;
import org.apache.commons.lang3.RegExUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Salon business rules read from {@link SalonProperties}: price list, date formats,
 * the closed weekday and slot capacity.
 */
@Component
public class BookingRules {

    private static final Logger log = LoggerFactory.getLogger(BookingRules.class);

    public static final int PHONE_DIGITS = 10;

    private static final Pattern NON_DIGITS = Pattern.compile("[^0-9]");

    private final SalonProperties properties;
    private final ResponsePhrases phrases;
    private final List<DateTimeFormatter> dateFormats;
    private final DateTimeFormatter displayFormat;

    public BookingRules(SalonProperties properties, ResponsePhrases phrases) {
        this.properties = properties;
        this.phrases = phrases;
        this.dateFormats = properties.getDatePatterns().stream()
                .map(p -> new DateTimeFormatterBuilder().parseCaseInsensitive().appendPattern(p).toFormatter(Locale.ENGLISH))
                .toList();
        this.displayFormat = DateTimeFormatter.ofPattern(properties.getDisplayDatePattern(), Locale.ENGLISH);
    }

    public ResponsePhrases phrases() {
        return phrases;
    }

    public int maxPerSlot() {
        return properties.getMaxPerSlot();
    }

    /**
     * Strips everything but the ASCII digits 0-9. Empty unless exactly ten remain.
     */
    public Optional<String> normalizePhone(String raw) {
        String digits = RegExUtils.removeAll(StringUtils.defaultString(raw), NON_DIGITS);
        return digits.length() == PHONE_DIGITS ? Optional.of(digits) : Optional.empty();
    }

    public Optional<BigDecimal> priceFor(String service) {
        if (StringUtils.isBlank(service)) {
            return Optional.empty();
        }
        return Optional.ofNullable(services().get(service.trim().toLowerCase(Locale.ENGLISH)));
    }

    public String displayService(String service) {
        return Arrays.stream(StringUtils.split(service.trim().toLowerCase(Locale.ENGLISH)))
                .map(StringUtils::capitalize)
                .collect(Collectors.joining(" "));
    }

    public String serviceList() {
        return services().keySet().stream().map(this::displayService).collect(Collectors.joining(", "));
    }

    public Map<String, BigDecimal> services() {
        return properties.getServices();
    }

    public Optional<LocalDate> parseDate(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        String text = StringUtils.normalizeSpace(raw);
        for (DateTimeFormatter format : dateFormats) {
            try {
                return Optional.of(LocalDate.parse(text, format));
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, format);
            }
        }
        return Optional.empty();
    }

    public String formatDate(LocalDate date) {
        return date.format(displayFormat);
    }

    public boolean isClosed(LocalDate date) {
        return date.getDayOfWeek() == properties.getClosedDay();
    }

    public DayOfWeek closedDay() {
        return properties.getClosedDay();
    }

    public String closedDayName() {
        return properties.getClosedDay().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    public LocalDateTime now() {
        return LocalDateTime.now(properties.getZone());
    }
}
