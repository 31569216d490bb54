package com.ai.salon.conversation;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class SlotTest {

    @Test
    void orderedFollowsTheDay() {
        assertThat(Slot.ordered()).extracting(Slot::getLabel)
                .containsExactly("9:00 AM", "10:00 AM", "11:00 AM", "1:00 PM", "2:00 PM", "3:00 PM", "4:00 PM");
    }

    @Test
    void parsesCommonSpokenForms() {
        assertThat(Slot.fromLabel("10:00 AM")).contains(Slot.TEN_AM);
        assertThat(Slot.fromLabel("10 am")).contains(Slot.TEN_AM);
        assertThat(Slot.fromLabel("2 p.m.")).contains(Slot.TWO_PM);
        assertThat(Slot.fromLabel("14:00")).contains(Slot.TWO_PM);
        assertThat(Slot.fromLabel(" 4:00PM ")).contains(Slot.FOUR_PM);
    }

    @Test
    void noonIsATimeButNotASlot() {
        assertThat(Slot.parseTime("12:00 PM")).contains(LocalTime.NOON);
        assertThat(Slot.fromLabel("12:00 PM")).isEmpty();
        assertThat(Slot.fromLabel("10:30 AM")).isEmpty();
    }

    @Test
    void rejectsNonTimes() {
        assertThat(Slot.parseTime("tomorrow morning")).isEmpty();
        assertThat(Slot.parseTime("13 pm")).isEmpty();
        assertThat(Slot.parseTime("25:00")).isEmpty();
        assertThat(Slot.parseTime(null)).isEmpty();
    }
}
