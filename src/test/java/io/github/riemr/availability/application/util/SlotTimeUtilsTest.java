package io.github.riemr.availability.application.util;

import io.github.riemr.availability.application.dto.CandidateSlot;
import io.github.riemr.availability.domain.model.BusinessHours;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SlotTimeUtilsTest {

    private static final BusinessHours HOURS = new BusinessHours(9, 18, 60, ZoneOffset.UTC);

    private static Instant at(String iso) {
        return Instant.parse(iso);
    }

    @Test
    void generatesHourlySlotsWithinBusinessHours() {
        List<CandidateSlot> slots = SlotTimeUtils.listBusinessHourSlots(LocalDate.of(2025, 1, 6), HOURS);

        assertThat(slots).hasSize(9);
        CandidateSlot first = slots.get(0);
        assertThat(first.getStartLabel()).isEqualTo("09:00");
        assertThat(first.getEndLabel()).isEqualTo("10:00");
        assertThat(first.getDisplayLabel()).isEqualTo("9am-10am");
        assertThat(first.getSlotStart()).isEqualTo(at("2025-01-06T09:00:00Z"));
        assertThat(first.getSlotEnd()).isEqualTo(at("2025-01-06T10:00:00Z"));
        assertThat(slots.get(3).getDisplayLabel()).isEqualTo("12pm-1pm");
        assertThat(slots.get(8).getStartTime()).isEqualTo(LocalTime.of(17, 0));
        assertThat(slots.get(8).getEndTime()).isEqualTo(LocalTime.of(18, 0));
    }

    @Test
    void slotSequenceCanBeIteratedAgain() {
        Iterable<CandidateSlot> slots = SlotTimeUtils.generateBusinessHourSlots(LocalDate.of(2025, 1, 6), HOURS);
        List<CandidateSlot> first = new ArrayList<>();
        List<CandidateSlot> second = new ArrayList<>();
        slots.forEach(first::add);
        slots.forEach(second::add);

        assertThat(first).hasSize(9).isEqualTo(second);
    }

    @Test
    void slotsThatWouldRunPastClosingAreNotGenerated() {
        BusinessHours ninetyMinutes = new BusinessHours(9, 12, 90, ZoneOffset.UTC);
        List<CandidateSlot> slots = SlotTimeUtils.listBusinessHourSlots(LocalDate.of(2025, 1, 6), ninetyMinutes);

        assertThat(slots).extracting(CandidateSlot::getDisplayLabel)
                .containsExactly("9am-10:30am", "10:30am-12pm");
    }

    @Test
    void slotInstantsFollowTheBusinessZone() {
        BusinessHours la = new BusinessHours(9, 18, 60, ZoneId.of("America/Los_Angeles"));
        CandidateSlot first = SlotTimeUtils.listBusinessHourSlots(LocalDate.of(2025, 1, 6), la).get(0);

        assertThat(first.getSlotStart()).isEqualTo(at("2025-01-06T17:00:00Z"));
        assertThat(first.getStartLabel()).isEqualTo("09:00");
    }

    @Test
    void dayOfWeekIsCalendarBased() {
        assertThat(SlotTimeUtils.dayOfWeek(LocalDate.of(2025, 1, 6))).isEqualTo(DayOfWeek.MONDAY);
        assertThat(SlotTimeUtils.dayOfWeekLabel(DayOfWeek.MONDAY)).isEqualTo("Monday");
        assertThat(SlotTimeUtils.parseDayOfWeekLabel("Saturday")).isEqualTo(DayOfWeek.SATURDAY);
    }

    @Test
    void overlapIsHalfOpenAndSymmetric() {
        Instant t0 = at("2025-01-06T00:00:00Z");
        Instant t4 = at("2025-01-06T04:00:00Z");
        Instant t5 = at("2025-01-06T05:00:00Z");
        Instant t10 = at("2025-01-06T10:00:00Z");

        assertThat(SlotTimeUtils.intervalsOverlap(t0, t5, t5, t10)).isFalse();
        assertThat(SlotTimeUtils.intervalsOverlap(t5, t10, t0, t5)).isFalse();
        assertThat(SlotTimeUtils.intervalsOverlap(t0, t5, t4, t10)).isTrue();
        assertThat(SlotTimeUtils.intervalsOverlap(t4, t10, t0, t5)).isTrue();
        assertThat(SlotTimeUtils.intervalsOverlap(t0, t10, t4, t5)).isTrue();
    }

    @Test
    void pastDateIsStrictlyBeforeTodayInUtc() {
        Clock clock = Clock.fixed(at("2025-01-06T23:30:00Z"), ZoneId.of("Asia/Tokyo"));

        assertThat(SlotTimeUtils.isPastDate(LocalDate.of(2025, 1, 5), clock)).isTrue();
        assertThat(SlotTimeUtils.isPastDate(LocalDate.of(2025, 1, 6), clock)).isFalse();
        assertThat(SlotTimeUtils.isPastDate(LocalDate.of(2025, 1, 7), clock)).isFalse();
    }

    @Test
    void distinctDaysOfWeekOfAMonth() {
        List<LocalDate> days = SlotTimeUtils.daysOf(YearMonth.of(2025, 2));

        assertThat(days).hasSize(28);
        assertThat(SlotTimeUtils.distinctDaysOfWeek(days)).hasSize(7)
                .first().isEqualTo(DayOfWeek.SATURDAY);
        assertThat(SlotTimeUtils.distinctDaysOfWeek(days.subList(0, 2)))
                .containsExactly(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
    }
}
