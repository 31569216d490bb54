package com.ai.salon.config;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Salon business rules: price list, opening days and slot capacity.
 */
@Data
@ConfigurationProperties(prefix = "salon")
public class SalonProperties {

    /**
     * Bookable services keyed by lower-case name.
     */
    private Map<String, BigDecimal> services = defaultServices();

    /**
     * Weekday on which the salon never takes bookings.
     */
    private DayOfWeek closedDay = DayOfWeek.THURSDAY;

    /**
     * Confirmed, non-cancelled appointments allowed per (date, slot).
     */
    private int maxPerSlot = 2;

    /**
     * Patterns tried in order when a caller gives a date.
     */
    private List<String> datePatterns = new ArrayList<>(List.of("MMMM d, yyyy", "MMM d, yyyy", "yyyy-MM-dd", "M/d/yyyy"));

    /**
     * Pattern used when a date is stored on the session or read back to the caller.
     */
    private String displayDatePattern = "MMMM d, yyyy";

    private ZoneId zone = ZoneId.systemDefault();

    /**
     * A conversation untouched for this long is treated as abandoned and its session dropped.
     */
    private Duration sessionIdleTimeout = Duration.ofMinutes(30);

    private static Map<String, BigDecimal> defaultServices() {
        Map<String, BigDecimal> services = new LinkedHashMap<>();
        services.put("haircut", BigDecimal.valueOf(40));
        services.put("hair coloring", BigDecimal.valueOf(80));
        services.put("highlights", BigDecimal.valueOf(120));
        services.put("blow dry", BigDecimal.valueOf(30));
        services.put("hair treatment", BigDecimal.valueOf(60));
        return services;
    }
}
