package com.ai.salon.dto;

import java.util.List;

public record SlotAvailabilityView(String date, String time, String outcome, List<String> available) {
}
