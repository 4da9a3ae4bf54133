package io.github.riemr.availability.infrastructure.repository;

import io.github.riemr.availability.application.dto.DateAvailabilityData;
import io.github.riemr.availability.application.dto.WeeklyResourceCounts;
import io.github.riemr.availability.application.exception.UpstreamDataException;
import io.github.riemr.availability.application.repository.AvailabilityRepository;
import io.github.riemr.availability.application.util.SlotTimeUtils;
import io.github.riemr.availability.domain.model.AvailabilityWindow;
import io.github.riemr.availability.domain.model.BookingConflict;
import io.github.riemr.availability.domain.model.BusinessHours;
import io.github.riemr.availability.domain.model.ExternalTaskConflict;
import io.github.riemr.availability.domain.model.JobTiming;
import io.github.riemr.availability.domain.model.PlanType;
import io.github.riemr.availability.domain.model.Resource;
import io.github.riemr.availability.domain.model.ResourceAvailabilityPattern;
import io.github.riemr.availability.domain.model.ResourceType;
import io.github.riemr.availability.infrastructure.mapper.AvailabilityMapper;
import io.github.riemr.availability.infrastructure.persistence.entity.AvailabilityWindowRow;
import io.github.riemr.availability.infrastructure.persistence.entity.BlockedDateRow;
import io.github.riemr.availability.infrastructure.persistence.entity.BookingRow;
import io.github.riemr.availability.infrastructure.persistence.entity.DayOfWeekCountRow;
import io.github.riemr.availability.infrastructure.persistence.entity.ExternalTaskRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

@Repository
@Slf4j
public class AvailabilityRepositoryImpl implements AvailabilityRepository {
    private final AvailabilityMapper mapper;
    private final BusinessHours businessHours;
    private final JobTiming jobTiming;

    public AvailabilityRepositoryImpl(AvailabilityMapper mapper, BusinessHours businessHours, JobTiming jobTiming) {
        this.mapper = mapper;
        this.businessHours = businessHours;
        this.jobTiming = jobTiming;
    }

    @Override
    @Transactional(readOnly = true)
    public WeeklyResourceCounts countResourcesByDayOfWeek(Set<DayOfWeek> daysOfWeek, PlanType planType) {
        if (daysOfWeek.isEmpty()) {
            return new WeeklyResourceCounts(Map.of(), Map.of());
        }
        List<String> labels = daysOfWeek.stream().map(SlotTimeUtils::dayOfWeekLabel).toList();

        Map<DayOfWeek, Integer> movers = new EnumMap<>(DayOfWeek.class);
        if (planType.requiresMover()) {
            daysOfWeek.forEach(d -> movers.put(d, 0));
            fillCounts(movers, query("mover counts", () -> mapper.countActiveMoversByDayOfWeek(labels)));
        }
        Map<DayOfWeek, Integer> drivers = new EnumMap<>(DayOfWeek.class);
        daysOfWeek.forEach(d -> drivers.put(d, 0));
        fillCounts(drivers, query("driver counts", () -> mapper.countActiveDriversByDayOfWeek(labels)));

        return new WeeklyResourceCounts(movers, drivers);
    }

    @Override
    @Transactional(readOnly = true)
    public DateAvailabilityData loadDateAvailability(LocalDate date, PlanType planType, Long excludeAppointmentId) {
        String dayLabel = SlotTimeUtils.dayOfWeekLabel(SlotTimeUtils.dayOfWeek(date));

        // blocked dates are stored as calendar days at UTC midnight
        Date blockedFrom = Date.from(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        Date blockedTo = Date.from(date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant());
        Set<Long> blockedMoverIds = new HashSet<>();
        Set<Long> blockedDriverIds = new HashSet<>();
        for (BlockedDateRow row : query("blocked dates", () -> mapper.selectBlockedUsers(blockedFrom, blockedTo))) {
            Long userId = require(row.getUserId(), "blocked_date.user_id");
            String type = require(row.getUserType(), "blocked_date.user_type");
            switch (type.trim().toLowerCase(Locale.ROOT)) {
                case "mover" -> blockedMoverIds.add(userId);
                case "driver" -> blockedDriverIds.add(userId);
                default -> throw new UpstreamDataException("Unknown blocked_date.user_type: " + type);
            }
        }

        List<Resource> movers = planType.requiresMover()
                ? toResources(ResourceType.MOVER, query("mover rosters", () -> mapper.selectActiveMoverWindows(dayLabel)), blockedMoverIds)
                : List.of();
        List<Resource> drivers = toResources(ResourceType.DRIVER,
                query("driver rosters", () -> mapper.selectActiveDriverWindows(dayLabel)), blockedDriverIds);

        // wide enough to catch jobs whose buffers reach into the business day
        Instant dayStart = date.atStartOfDay(businessHours.getZone()).toInstant().minus(jobTiming.reach());
        Instant dayEnd = date.plusDays(1).atStartOfDay(businessHours.getZone()).toInstant().plus(jobTiming.reach());
        Date from = Date.from(dayStart);
        Date to = Date.from(dayEnd);

        Map<Long, List<BookingConflict>> moverBookings = movers.isEmpty()
                ? Map.of()
                : toBookings(query("mover bookings", () -> mapper.selectMoverBookings(from, to, excludeAppointmentId)), ids(movers));
        Map<Long, List<BookingConflict>> driverBookings = drivers.isEmpty()
                ? Map.of()
                : toBookings(query("driver bookings", () -> mapper.selectDriverBookings(from, to, excludeAppointmentId)), ids(drivers));
        Map<Long, List<ExternalTaskConflict>> driverTasks = drivers.isEmpty()
                ? Map.of()
                : toTasks(query("driver tasks", () -> mapper.selectDriverTasks(from, to, excludeAppointmentId)), ids(drivers));

        log.debug("Loaded {} movers, {} drivers for {} (blocked movers={}, drivers={})",
                movers.size(), drivers.size(), date, blockedMoverIds.size(), blockedDriverIds.size());

        return DateAvailabilityData.builder()
                .movers(movers)
                .drivers(drivers)
                .blockedMoverIds(Set.copyOf(blockedMoverIds))
                .blockedDriverIds(Set.copyOf(blockedDriverIds))
                .moverBookings(moverBookings)
                .driverBookings(driverBookings)
                .driverTasks(driverTasks)
                .build();
    }

    /* === Row mapping === */

    private void fillCounts(Map<DayOfWeek, Integer> target, List<DayOfWeekCountRow> rows) {
        for (DayOfWeekCountRow row : rows) {
            DayOfWeek day = parseDay(row.getDayOfWeek());
            int count = require(row.getResourceCount(), "resource_count");
            if (count < 0) throw new UpstreamDataException("Negative resource count for " + day + ": " + count);
            if (target.containsKey(day)) {
                target.put(day, count);
            }
        }
    }

    private List<Resource> toResources(ResourceType type, List<AvailabilityWindowRow> rows, Set<Long> blockedIds) {
        Map<Long, List<AvailabilityWindow>> windowsById = new LinkedHashMap<>();
        for (AvailabilityWindowRow row : rows) {
            Long id = require(row.getResourceId(), "resource_id");
            if (blockedIds.contains(id)) continue;
            LocalTime start = parseTime(row.getStartTime());
            LocalTime end = parseTime(row.getEndTime());
            if (!end.isAfter(start)) {
                throw new UpstreamDataException("Availability of " + type + " " + id + " ends before it starts: " + start + "-" + end);
            }
            windowsById.computeIfAbsent(id, k -> new ArrayList<>())
                    .add(new AvailabilityWindow(parseDay(row.getDayOfWeek()), start, end));
        }
        List<Resource> res = new ArrayList<>(windowsById.size());
        windowsById.forEach((id, windows) -> res.add(new Resource(id, type, ResourceAvailabilityPattern.of(windows))));
        return res;
    }

    private Map<Long, List<BookingConflict>> toBookings(List<BookingRow> rows, Set<Long> rosterIds) {
        Map<Long, List<BookingConflict>> res = new LinkedHashMap<>();
        for (BookingRow row : rows) {
            Long resourceId = require(row.getResourceId(), "booking.resource_id");
            if (!rosterIds.contains(resourceId)) continue;
            Instant start = require(row.getBookingDate(), "booking_date").toInstant();
            Instant end = require(row.getEndDate(), "end_date").toInstant();
            if (end.isBefore(start)) {
                throw new UpstreamDataException("Booking of appointment " + row.getAppointmentId() + " ends before it starts");
            }
            long appointmentId = require(row.getAppointmentId(), "booking.appointment_id");
            res.computeIfAbsent(resourceId, k -> new ArrayList<>())
                    .add(new BookingConflict(resourceId, appointmentId, start, end));
        }
        return res;
    }

    private Map<Long, List<ExternalTaskConflict>> toTasks(List<ExternalTaskRow> rows, Set<Long> rosterIds) {
        Map<Long, List<ExternalTaskConflict>> res = new LinkedHashMap<>();
        for (ExternalTaskRow row : rows) {
            Long driverId = require(row.getDriverId(), "onfleet_task.driver_id");
            if (!rosterIds.contains(driverId)) continue;
            long appointmentId = require(row.getAppointmentId(), "onfleet_task.appointment_id");
            Instant taskStart = require(row.getAppointmentTime(), "appointment.time").toInstant();
            res.computeIfAbsent(driverId, k -> new ArrayList<>())
                    .add(ExternalTaskConflict.startingAt(driverId, appointmentId, taskStart, jobTiming));
        }
        return res;
    }

    private static Set<Long> ids(List<Resource> resources) {
        Set<Long> res = new HashSet<>();
        resources.forEach(r -> res.add(r.getId()));
        return res;
    }

    private static DayOfWeek parseDay(String label) {
        try {
            return SlotTimeUtils.parseDayOfWeekLabel(label);
        } catch (IllegalArgumentException e) {
            throw new UpstreamDataException("Unknown day of week: " + label, e);
        }
    }

    private static LocalTime parseTime(String value) {
        if (value == null) throw new UpstreamDataException("Availability time is missing");
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new UpstreamDataException("Malformed availability time: " + value, e);
        }
    }

    private static <T> T require(T value, String column) {
        if (value == null) throw new UpstreamDataException(column + " is null");
        return value;
    }

    private static <T> List<T> query(String what, Supplier<List<T>> call) {
        List<T> rows;
        try {
            rows = call.get();
        } catch (DataAccessException e) {
            log.error("Failed to load {}: {}", what, e.getMessage());
            throw new UpstreamDataException("Failed to load " + what, e);
        }
        if (rows == null) throw new UpstreamDataException("No result for " + what);
        return rows;
    }
}
