package io.github.riemr.availability.application.util;

import io.github.riemr.availability.application.dto.CandidateSlot;
import io.github.riemr.availability.domain.model.BusinessHours;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

public final class SlotTimeUtils {
    private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("HH:mm");

    private SlotTimeUtils() {}

    /**
     * Candidate slots of {@code date} within business hours. Slots are produced on iteration
     * and the returned Iterable can be iterated any number of times.
     * A slot is only produced when it ends at or before closing time.
     */
    public static Iterable<CandidateSlot> generateBusinessHourSlots(LocalDate date, BusinessHours hours) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(hours, "hours");
        int open = hours.getStartHour() * 60;
        int close = hours.getEndHour() * 60;
        int step = hours.getSlotMinutes();
        return () -> new Iterator<>() {
            private int cursor = open;

            @Override
            public boolean hasNext() {
                return cursor + step <= close;
            }

            @Override
            public CandidateSlot next() {
                if (!hasNext()) throw new NoSuchElementException();
                CandidateSlot slot = slotAt(date, cursor, cursor + step, hours);
                cursor += step;
                return slot;
            }
        };
    }

    public static List<CandidateSlot> listBusinessHourSlots(LocalDate date, BusinessHours hours) {
        List<CandidateSlot> res = new ArrayList<>();
        generateBusinessHourSlots(date, hours).forEach(res::add);
        return res;
    }

    private static CandidateSlot slotAt(LocalDate date, int fromMinute, int toMinute, BusinessHours hours) {
        LocalTime start = LocalTime.of(fromMinute / 60, fromMinute % 60);
        LocalTime end = LocalTime.of(toMinute / 60, toMinute % 60);
        Instant slotStart = date.atTime(start).atZone(hours.getZone()).toInstant();
        Instant slotEnd = date.atTime(end).atZone(hours.getZone()).toInstant();
        return CandidateSlot.builder()
                .date(date)
                .startTime(start)
                .endTime(end)
                .slotStart(slotStart)
                .slotEnd(slotEnd)
                .startLabel(start.format(LABEL))
                .endLabel(end.format(LABEL))
                .displayLabel(displayHour(start) + "-" + displayHour(end))
                .build();
    }

    /** 9:00 -> "9am", 12:00 -> "12pm", 13:30 -> "1:30pm" */
    static String displayHour(LocalTime t) {
        int h = t.getHour();
        String suffix = h < 12 ? "am" : "pm";
        int h12 = h % 12 == 0 ? 12 : h % 12;
        return t.getMinute() == 0
                ? h12 + suffix
                : h12 + ":" + String.format("%02d", t.getMinute()) + suffix;
    }

    /** Calendar weekday; depends only on the date, never on the caller's zone. */
    public static DayOfWeek dayOfWeek(LocalDate date) {
        return date.getDayOfWeek();
    }

    /** "Monday", "Tuesday" ... as stored in availability ranges. */
    public static String dayOfWeekLabel(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    public static DayOfWeek parseDayOfWeekLabel(String label) {
        if (label == null) throw new IllegalArgumentException("day of week label is null");
        return DayOfWeek.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Half-open interval overlap: [aStart, aEnd) and [bStart, bEnd) share at least one instant.
     * Every conflict check goes through this method.
     */
    public static boolean intervalsOverlap(Instant aStart, Instant aEnd, Instant bStart, Instant bEnd) {
        return aStart.isBefore(bEnd) && bStart.isBefore(aEnd);
    }

    /** Strictly before today, today taken at UTC midnight. */
    public static boolean isPastDate(LocalDate date, Clock clock) {
        return date.isBefore(LocalDate.now(clock.withZone(ZoneOffset.UTC)));
    }

    public static List<LocalDate> daysOf(YearMonth month) {
        List<LocalDate> res = new ArrayList<>(month.lengthOfMonth());
        for (int d = 1; d <= month.lengthOfMonth(); d++) {
            res.add(month.atDay(d));
        }
        return res;
    }

    /** Distinct weekdays in first-seen order. */
    public static Set<DayOfWeek> distinctDaysOfWeek(List<LocalDate> dates) {
        Set<DayOfWeek> res = new LinkedHashSet<>();
        for (LocalDate d : dates) {
            res.add(dayOfWeek(d));
        }
        return res;
    }
}
