package io.github.riemr.availability.application.service;

import io.github.riemr.availability.application.cache.AvailabilityCache;
import io.github.riemr.availability.application.cache.AvailabilityCacheKeys;
import io.github.riemr.availability.application.dto.AvailabilityMetadata;
import io.github.riemr.availability.application.dto.CacheStats;
import io.github.riemr.availability.application.dto.CandidateSlot;
import io.github.riemr.availability.application.dto.ConflictCounts;
import io.github.riemr.availability.application.dto.DailyAvailabilityQuery;
import io.github.riemr.availability.application.dto.DailyAvailabilityResponse;
import io.github.riemr.availability.application.dto.DateAvailabilityData;
import io.github.riemr.availability.application.dto.DriverRequirement;
import io.github.riemr.availability.application.dto.MonthlyAvailabilityDate;
import io.github.riemr.availability.application.dto.MonthlyAvailabilityQuery;
import io.github.riemr.availability.application.dto.MonthlyAvailabilityResponse;
import io.github.riemr.availability.application.dto.ResourceCounts;
import io.github.riemr.availability.application.dto.ResourcesChecked;
import io.github.riemr.availability.application.dto.TimeSlotAvailability;
import io.github.riemr.availability.application.dto.WeeklyResourceCounts;
import io.github.riemr.availability.application.exception.AvailabilityValidationException;
import io.github.riemr.availability.application.exception.UpstreamDataException;
import io.github.riemr.availability.application.repository.AvailabilityRepository;
import io.github.riemr.availability.application.util.DriverRequirementCalculator;
import io.github.riemr.availability.application.util.ResourceConflictEvaluator;
import io.github.riemr.availability.application.util.ResourceConflictEvaluator.SlotConflict;
import io.github.riemr.availability.application.util.SlotTimeUtils;
import io.github.riemr.availability.domain.model.AvailabilityLevel;
import io.github.riemr.availability.domain.model.BusinessHours;
import io.github.riemr.availability.domain.model.JobTiming;
import io.github.riemr.availability.domain.model.PlanType;
import io.github.riemr.availability.domain.model.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Answers "can a new appointment be accepted" for a month (per day) or a date (per slot).
 * <p>
 * Both queries follow the same template: derive the cache key, return the cached response
 * (marked as a cache hit) when present, otherwise compute, store with the view's TTL and return.
 * Queries are independent of each other; the cache is the only shared state.
 */
@Service
@Slf4j
public class AvailabilityService {

    private static final List<PlanType> ALL_PLAN_TYPES = List.of(PlanType.DIY, PlanType.FULL_SERVICE);

    /* === Collaborators === */
    private final AvailabilityRepository repository;
    private final AvailabilityCache cache;
    private final BusinessHours businessHours;
    private final JobTiming jobTiming;
    private final Clock clock;

    /* === Settings === */
    private final Duration monthlyTtl;
    private final Duration dailyTtl;

    public AvailabilityService(AvailabilityRepository repository,
                               AvailabilityCache cache,
                               BusinessHours businessHours,
                               JobTiming jobTiming,
                               Clock clock,
                               @Value("${availability.cache.ttl.monthly:PT5M}") Duration monthlyTtl,
                               @Value("${availability.cache.ttl.daily:PT2M}") Duration dailyTtl) {
        this.repository = repository;
        this.cache = cache;
        this.businessHours = businessHours;
        this.jobTiming = jobTiming;
        this.clock = clock;
        this.monthlyTtl = monthlyTtl;
        this.dailyTtl = dailyTtl;
    }

    /* ===================================================================== */
    /* Monthly overview                                                      */
    /* ===================================================================== */

    /**
     * Per-day availability of a month, computed from weekly resource counts only
     * (no slot granularity). Past days are unavailable without any lookup.
     *
     * @throws AvailabilityValidationException malformed query
     * @throws UpstreamDataException roster counts could not be read
     */
    public MonthlyAvailabilityResponse getMonthlyAvailability(MonthlyAvailabilityQuery query) {
        YearMonth month = validate(query);
        long startedAt = clock.millis();

        String cacheKey = AvailabilityCacheKeys.monthly(query);
        Optional<MonthlyAvailabilityResponse> cached = readCache(cacheKey, MonthlyAvailabilityResponse.class);
        if (cached.isPresent()) {
            log.debug("Monthly availability cache hit: {}", cacheKey);
            return cached.get().markCacheHit();
        }

        log.info("Computing monthly availability for {} planType={} units={}", month, query.getPlanType(), query.getUnitCount());

        List<LocalDate> days = SlotTimeUtils.daysOf(month);
        List<LocalDate> upcoming = days.stream().filter(d -> !SlotTimeUtils.isPastDate(d, clock)).toList();
        Set<DayOfWeek> weekdays = SlotTimeUtils.distinctDaysOfWeek(upcoming);
        WeeklyResourceCounts counts = weekdays.isEmpty()
                ? new WeeklyResourceCounts(Map.of(), Map.of())
                : repository.countResourcesByDayOfWeek(weekdays, query.getPlanType());

        PlanType planType = query.getPlanType();
        // the monthly view assumes a mover will be found when one is required
        DriverRequirement requirement = DriverRequirementCalculator.calculateDriverRequirement(planType, query.getUnitCount(), true);
        int requiredMovers = planType.requiredMovers();

        List<MonthlyAvailabilityDate> dates = new ArrayList<>(days.size());
        for (LocalDate day : days) {
            if (SlotTimeUtils.isPastDate(day, clock)) {
                dates.add(MonthlyAvailabilityDate.builder().date(day).hasAvailability(false).build());
                continue;
            }
            DayOfWeek dow = SlotTimeUtils.dayOfWeek(day);
            int movers = counts.movers(dow);
            int drivers = counts.drivers(dow);

            boolean moverOk = !planType.requiresMover() || movers >= requiredMovers;
            boolean driverOk = drivers >= requirement.getDriversNeeded();
            boolean available = moverOk && driverOk;

            dates.add(MonthlyAvailabilityDate.builder()
                    .date(day)
                    .hasAvailability(available)
                    .availabilityLevel(available
                            ? ResourceConflictEvaluator.determineAvailabilityLevel(movers, drivers, requiredMovers, requirement.getDriversNeeded())
                            : null)
                    .resourceCounts(new ResourceCounts(movers, drivers))
                    .build());
            log.debug("[Monthly] {} ({}): movers={}, drivers={}, driversNeeded={}, available={}",
                    day, dow, movers, drivers, requirement.getDriversNeeded(), available);
        }

        MonthlyAvailabilityResponse response = MonthlyAvailabilityResponse.builder()
                .dates(List.copyOf(dates))
                .metadata(AvailabilityMetadata.builder()
                        .queryTimeMs(clock.millis() - startedAt)
                        .totalDaysChecked(days.size())
                        .resourcesChecked(new ResourcesChecked(counts.totalMovers(), counts.totalDrivers()))
                        .conflictsFound(ConflictCounts.none())
                        .cacheHit(false)
                        .build())
                .build();

        writeCache(cacheKey, response, monthlyTtl);
        return response;
    }

    /* ===================================================================== */
    /* Daily time slots                                                      */
    /* ===================================================================== */

    /**
     * Availability of every candidate slot of a date.
     * A past date returns the full slot list, all unavailable, without any lookup.
     *
     * @throws AvailabilityValidationException malformed query
     * @throws UpstreamDataException rosters or conflicts could not be read
     */
    public DailyAvailabilityResponse getDailyTimeSlots(DailyAvailabilityQuery query) {
        validate(query);
        long startedAt = clock.millis();
        LocalDate date = query.getDate();

        if (SlotTimeUtils.isPastDate(date, clock)) {
            return pastDateResponse(date, startedAt);
        }

        String cacheKey = AvailabilityCacheKeys.daily(query);
        Optional<DailyAvailabilityResponse> cached = readCache(cacheKey, DailyAvailabilityResponse.class);
        if (cached.isPresent()) {
            log.debug("Daily availability cache hit: {}", cacheKey);
            return cached.get().markCacheHit();
        }

        log.info("Computing daily availability for {} planType={} units={} exclude={}",
                date, query.getPlanType(), query.getUnitCount(), query.getExcludeAppointmentId());

        DayOfWeek dow = SlotTimeUtils.dayOfWeek(date);
        DateAvailabilityData data = repository.loadDateAvailability(date, query.getPlanType(), query.getExcludeAppointmentId());
        if (data == null) {
            throw new UpstreamDataException("No availability data returned for " + date);
        }

        SlotEvaluation totals = new SlotEvaluation();
        List<TimeSlotAvailability> timeSlots = new ArrayList<>();
        for (CandidateSlot slot : SlotTimeUtils.generateBusinessHourSlots(date, businessHours)) {
            timeSlots.add(evaluateSlot(slot, dow, query, data, totals));
        }

        DailyAvailabilityResponse response = DailyAvailabilityResponse.builder()
                .date(date)
                .timeSlots(List.copyOf(timeSlots))
                .metadata(AvailabilityMetadata.builder()
                        .queryTimeMs(clock.millis() - startedAt)
                        .totalSlotsChecked(timeSlots.size())
                        .resourcesChecked(new ResourcesChecked(data.getMovers().size(), data.getDrivers().size()))
                        .conflictsFound(new ConflictCounts(
                                data.getBlockedMoverIds().size() + data.getBlockedDriverIds().size(),
                                totals.bookingConflicts,
                                totals.externalTaskConflicts))
                        .cacheHit(false)
                        .build())
                .build();

        writeCache(cacheKey, response, dailyTtl);
        return response;
    }

    private TimeSlotAvailability evaluateSlot(CandidateSlot slot,
                                              DayOfWeek dow,
                                              DailyAvailabilityQuery query,
                                              DateAvailabilityData data,
                                              SlotEvaluation totals) {
        PlanType planType = query.getPlanType();

        // counted exactly: the level depends on the mover surplus, not only on adequacy
        int availableMovers = 0;
        if (planType.requiresMover()) {
            for (Resource mover : data.getMovers()) {
                SlotConflict conflict = ResourceConflictEvaluator.evaluate(mover, dow, slot, data.bookingsOf(mover), List.of(), jobTiming);
                if (conflict == SlotConflict.NONE) {
                    availableMovers++;
                } else {
                    totals.count(conflict);
                }
            }
        }
        boolean moverOk = !planType.requiresMover() || availableMovers >= planType.requiredMovers();

        DriverRequirement requirement = DriverRequirementCalculator.calculateDriverRequirement(planType, query.getUnitCount(), moverOk);

        // drivers are counted exactly, the count is part of the response
        int availableDrivers = 0;
        for (Resource driver : data.getDrivers()) {
            SlotConflict conflict = ResourceConflictEvaluator.evaluate(driver, dow, slot, data.bookingsOf(driver), data.tasksOf(driver), jobTiming);
            if (conflict == SlotConflict.NONE) {
                availableDrivers++;
            } else {
                totals.count(conflict);
            }
        }
        boolean driverOk = availableDrivers >= requirement.getDriversNeeded();
        boolean available = moverOk && driverOk;

        return TimeSlotAvailability.builder()
                .startTime(slot.getStartLabel())
                .endTime(slot.getEndLabel())
                .display(slot.getDisplayLabel())
                .available(available)
                .availabilityLevel(available
                        ? ResourceConflictEvaluator.determineAvailabilityLevel(availableMovers, availableDrivers,
                                planType.requiredMovers(), requirement.getDriversNeeded())
                        : AvailabilityLevel.LOW)
                .resourceCounts(new ResourceCounts(availableMovers, availableDrivers))
                .build();
    }

    private DailyAvailabilityResponse pastDateResponse(LocalDate date, long startedAt) {
        List<TimeSlotAvailability> slots = new ArrayList<>();
        for (CandidateSlot slot : SlotTimeUtils.generateBusinessHourSlots(date, businessHours)) {
            slots.add(TimeSlotAvailability.builder()
                    .startTime(slot.getStartLabel())
                    .endTime(slot.getEndLabel())
                    .display(slot.getDisplayLabel())
                    .available(false)
                    .availabilityLevel(AvailabilityLevel.LOW)
                    .resourceCounts(new ResourceCounts(0, 0))
                    .build());
        }
        return DailyAvailabilityResponse.builder()
                .date(date)
                .timeSlots(List.copyOf(slots))
                .metadata(AvailabilityMetadata.builder()
                        .queryTimeMs(clock.millis() - startedAt)
                        .totalSlotsChecked(slots.size())
                        .resourcesChecked(new ResourcesChecked(0, 0))
                        .conflictsFound(ConflictCounts.none())
                        .cacheHit(false)
                        .build())
                .build();
    }

    /* ===================================================================== */
    /* Maintenance                                                           */
    /* ===================================================================== */

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    /**
     * Pre-computes single-unit daily views. A failing date is logged and skipped.
     *
     * @param dates null or empty warms nothing
     * @param planTypes null or empty means every plan type
     * @return number of daily views computed or already cached
     */
    public int warmCache(List<LocalDate> dates, List<PlanType> planTypes) {
        if (dates == null || dates.isEmpty()) {
            log.info("Nothing to warm: no dates given");
            return 0;
        }
        List<PlanType> types = (planTypes == null || planTypes.isEmpty()) ? ALL_PLAN_TYPES : planTypes;
        log.info("Warming availability cache for {} dates x {} plan types", dates.size(), types.size());
        int warmed = 0;
        for (LocalDate date : dates) {
            for (PlanType type : types) {
                try {
                    getDailyTimeSlots(new DailyAvailabilityQuery(date, type, 1, null));
                    warmed++;
                } catch (RuntimeException e) {
                    log.error("Failed to warm availability cache for {} {}: {}", date, type, e.getMessage(), e);
                }
            }
        }
        return warmed;
    }

    /* ===================================================================== */
    /* Helpers                                                               */
    /* ===================================================================== */

    private static YearMonth validate(MonthlyAvailabilityQuery q) {
        if (q == null) throw new AvailabilityValidationException("query is required");
        requirePlanAndUnits(q.getPlanType(), q.getUnitCount());
        if (q.getMonth() < 1 || q.getMonth() > 12) {
            throw new AvailabilityValidationException("month must be 1..12: " + q.getMonth());
        }
        try {
            return YearMonth.of(q.getYear(), q.getMonth());
        } catch (DateTimeException e) {
            throw new AvailabilityValidationException("Invalid year: " + q.getYear());
        }
    }

    private static void validate(DailyAvailabilityQuery q) {
        if (q == null) throw new AvailabilityValidationException("query is required");
        if (q.getDate() == null) throw new AvailabilityValidationException("date is required");
        requirePlanAndUnits(q.getPlanType(), q.getUnitCount());
    }

    private static void requirePlanAndUnits(PlanType planType, int unitCount) {
        if (planType == null) throw new AvailabilityValidationException("planType is required");
        if (unitCount < 1) throw new AvailabilityValidationException("unitCount must be at least 1: " + unitCount);
    }

    private <T> Optional<T> readCache(String key, Class<T> type) {
        return guarded("read " + key, () -> cache.get(key, type)).flatMap(o -> o);
    }

    private void writeCache(String key, Object value, Duration ttl) {
        guarded("write " + key, () -> {
            cache.set(key, value, ttl);
            return Boolean.TRUE;
        });
    }

    /** Cache trouble never fails a query; it only costs a fresh computation. */
    private <T> Optional<T> guarded(String what, Supplier<T> action) {
        try {
            return Optional.ofNullable(action.get());
        } catch (RuntimeException e) {
            log.warn("Availability cache failed to {}: {}", what, e.getMessage());
            return Optional.empty();
        }
    }

    private static final class SlotEvaluation {
        int bookingConflicts;
        int externalTaskConflicts;

        void count(SlotConflict conflict) {
            switch (conflict) {
                case BOOKING -> bookingConflicts++;
                case EXTERNAL_TASK -> externalTaskConflicts++;
                default -> { }
            }
        }
    }
}
