package io.github.riemr.availability.application.service;

import io.github.riemr.availability.application.cache.AvailabilityCache;
import io.github.riemr.availability.application.cache.InMemoryAvailabilityCache;
import io.github.riemr.availability.application.dto.DailyAvailabilityQuery;
import io.github.riemr.availability.application.dto.DailyAvailabilityResponse;
import io.github.riemr.availability.application.dto.DateAvailabilityData;
import io.github.riemr.availability.application.dto.MonthlyAvailabilityDate;
import io.github.riemr.availability.application.dto.MonthlyAvailabilityQuery;
import io.github.riemr.availability.application.dto.MonthlyAvailabilityResponse;
import io.github.riemr.availability.application.dto.ResourceCounts;
import io.github.riemr.availability.application.dto.TimeSlotAvailability;
import io.github.riemr.availability.application.dto.WeeklyResourceCounts;
import io.github.riemr.availability.application.exception.AvailabilityValidationException;
import io.github.riemr.availability.application.exception.UpstreamDataException;
import io.github.riemr.availability.application.repository.AvailabilityRepository;
import io.github.riemr.availability.domain.model.AvailabilityLevel;
import io.github.riemr.availability.domain.model.AvailabilityWindow;
import io.github.riemr.availability.domain.model.BookingConflict;
import io.github.riemr.availability.domain.model.BusinessHours;
import io.github.riemr.availability.domain.model.JobTiming;
import io.github.riemr.availability.domain.model.PlanType;
import io.github.riemr.availability.domain.model.Resource;
import io.github.riemr.availability.domain.model.ResourceAvailabilityPattern;
import io.github.riemr.availability.domain.model.ResourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class AvailabilityServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 6);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
    private static final BusinessHours HOURS = new BusinessHours(9, 18, 60, ZoneOffset.UTC);
    private static final JobTiming TIMING = JobTiming.ofMinutes(15, 15, 60);

    private AvailabilityRepository repository;
    private InMemoryAvailabilityCache cache;
    private AvailabilityService service;

    @BeforeEach
    void setup() {
        repository = mock(AvailabilityRepository.class);
        cache = new InMemoryAvailabilityCache(CLOCK, 100, Duration.ofMinutes(5), Duration.ofMinutes(5));
        service = newService(cache);
    }

    private AvailabilityService newService(AvailabilityCache c) {
        return new AvailabilityService(repository, c, HOURS, TIMING, CLOCK, Duration.ofMinutes(5), Duration.ofMinutes(2));
    }

    private static Resource resource(long id, ResourceType type) {
        return new Resource(id, type, ResourceAvailabilityPattern.of(List.of(
                new AvailabilityWindow(DayOfWeek.MONDAY, LocalTime.of(9, 0), LocalTime.of(17, 0)))));
    }

    private static DateAvailabilityData data(List<Resource> movers,
                                             List<Resource> drivers,
                                             Map<Long, List<BookingConflict>> driverBookings) {
        return DateAvailabilityData.builder()
                .movers(movers)
                .drivers(drivers)
                .blockedMoverIds(Set.of())
                .blockedDriverIds(Set.of())
                .moverBookings(Map.of())
                .driverBookings(driverBookings)
                .driverTasks(Map.of())
                .build();
    }

    private static List<Boolean> availability(DailyAvailabilityResponse response) {
        return response.getTimeSlots().stream().map(TimeSlotAvailability::isAvailable).toList();
    }

    private static DailyAvailabilityQuery daily(LocalDate date, PlanType planType, int units) {
        return new DailyAvailabilityQuery(date, planType, units, null);
    }

    /* === daily === */

    @Test
    void daily_fullService_availableInsideDriverAndMoverHours() {
        when(repository.loadDateAvailability(MONDAY, PlanType.FULL_SERVICE, null)).thenReturn(data(
                List.of(resource(1, ResourceType.MOVER)),
                List.of(resource(10, ResourceType.DRIVER), resource(11, ResourceType.DRIVER)),
                Map.of()));

        DailyAvailabilityResponse response = service.getDailyTimeSlots(daily(MONDAY, PlanType.FULL_SERVICE, 2));

        assertThat(response.getDate()).isEqualTo(MONDAY);
        assertThat(response.getTimeSlots()).hasSize(9);
        assertThat(availability(response)).containsExactly(true, true, true, true, true, true, true, true, false);

        TimeSlotAvailability first = response.getTimeSlots().get(0);
        assertThat(first.getStartTime()).isEqualTo("09:00");
        assertThat(first.getEndTime()).isEqualTo("10:00");
        assertThat(first.getDisplay()).isEqualTo("9am-10am");
        assertThat(first.getResourceCounts()).isEqualTo(new ResourceCounts(1, 2));

        TimeSlotAvailability last = response.getTimeSlots().get(8);
        assertThat(last.getDisplay()).isEqualTo("5pm-6pm");
        assertThat(last.getAvailabilityLevel()).isEqualTo(AvailabilityLevel.LOW);

        assertThat(response.getMetadata().getTotalSlotsChecked()).isEqualTo(9);
        assertThat(response.getMetadata().getTotalDaysChecked()).isNull();
        assertThat(response.getMetadata().isCacheHit()).isFalse();
    }

    @Test
    void daily_fullService_withoutMover_isUnavailable() {
        when(repository.loadDateAvailability(MONDAY, PlanType.FULL_SERVICE, null)).thenReturn(data(
                List.of(),
                List.of(resource(10, ResourceType.DRIVER), resource(11, ResourceType.DRIVER), resource(12, ResourceType.DRIVER)),
                Map.of()));

        DailyAvailabilityResponse response = service.getDailyTimeSlots(daily(MONDAY, PlanType.FULL_SERVICE, 1));

        assertThat(response.getTimeSlots()).allSatisfy(slot -> {
            assertThat(slot.isAvailable()).isFalse();
            assertThat(slot.getResourceCounts().getAvailableMovers()).isZero();
        });
    }

    @Test
    void daily_bookingWithBuffers_blocksOverlappingSlotsOfOnlyDriver() {
        Map<Long, List<BookingConflict>> bookings = Map.of(10L, List.of(new BookingConflict(10, 500,
                Instant.parse("2025-01-06T10:00:00Z"), Instant.parse("2025-01-06T11:30:00Z"))));
        when(repository.loadDateAvailability(MONDAY, PlanType.DIY, null))
                .thenReturn(data(List.of(), List.of(resource(10, ResourceType.DRIVER)), bookings));

        DailyAvailabilityResponse response = service.getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 1));

        assertThat(availability(response)).containsExactly(false, false, false, true, true, true, true, true, false);
        assertThat(response.getMetadata().getConflictsFound().getExistingBookings()).isEqualTo(3);
        assertThat(response.getMetadata().getConflictsFound().getOnfleetTasks()).isZero();
    }

    @Test
    void daily_bookingOfOneDriver_isCoveredBySecondDriver() {
        Map<Long, List<BookingConflict>> bookings = Map.of(10L, List.of(new BookingConflict(10, 500,
                Instant.parse("2025-01-06T10:00:00Z"), Instant.parse("2025-01-06T11:30:00Z"))));
        when(repository.loadDateAvailability(MONDAY, PlanType.DIY, null)).thenReturn(data(
                List.of(), List.of(resource(10, ResourceType.DRIVER), resource(11, ResourceType.DRIVER)), bookings));

        DailyAvailabilityResponse response = service.getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 1));

        assertThat(availability(response)).containsExactly(true, true, true, true, true, true, true, true, false);
        assertThat(response.getTimeSlots().get(1).getResourceCounts().getAvailableDrivers()).isEqualTo(1);
        assertThat(response.getTimeSlots().get(4).getResourceCounts().getAvailableDrivers()).isEqualTo(2);
    }

    @Test
    void daily_fullService_bookingOfOneDriver_isCoveredBySecondDriver() {
        Map<Long, List<BookingConflict>> bookings = Map.of(10L, List.of(new BookingConflict(10, 500,
                Instant.parse("2025-01-06T10:00:00Z"), Instant.parse("2025-01-06T11:30:00Z"))));
        when(repository.loadDateAvailability(MONDAY, PlanType.FULL_SERVICE, null)).thenReturn(data(
                List.of(resource(1, ResourceType.MOVER)),
                List.of(resource(10, ResourceType.DRIVER), resource(11, ResourceType.DRIVER)),
                bookings));

        DailyAvailabilityResponse response = service.getDailyTimeSlots(daily(MONDAY, PlanType.FULL_SERVICE, 2));

        assertThat(availability(response)).containsExactly(true, true, true, true, true, true, true, true, false);
    }

    @Test
    void daily_fullService_bookingOfOnlyDriver_blocksOverlappingSlots() {
        Map<Long, List<BookingConflict>> bookings = Map.of(10L, List.of(new BookingConflict(10, 500,
                Instant.parse("2025-01-06T10:00:00Z"), Instant.parse("2025-01-06T11:30:00Z"))));
        when(repository.loadDateAvailability(MONDAY, PlanType.FULL_SERVICE, null)).thenReturn(data(
                List.of(resource(1, ResourceType.MOVER)),
                List.of(resource(10, ResourceType.DRIVER)),
                bookings));

        DailyAvailabilityResponse response = service.getDailyTimeSlots(daily(MONDAY, PlanType.FULL_SERVICE, 2));

        assertThat(availability(response)).containsExactly(false, false, false, true, true, true, true, true, false);
    }

    @Test
    void daily_diy_largeDriverSurplus_isHigh() {
        List<Resource> drivers = LongStream.rangeClosed(101, 120).mapToObj(id -> resource(id, ResourceType.DRIVER)).toList();
        when(repository.loadDateAvailability(MONDAY, PlanType.DIY, null)).thenReturn(data(List.of(), drivers, Map.of()));

        DailyAvailabilityResponse response = service.getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 1));

        TimeSlotAvailability first = response.getTimeSlots().get(0);
        assertThat(first.isAvailable()).isTrue();
        assertThat(first.getAvailabilityLevel()).isEqualTo(AvailabilityLevel.HIGH);
    }

    @Test
    void daily_fullService_countsEveryFreeMover() {
        List<Resource> movers = LongStream.rangeClosed(1, 10).mapToObj(id -> resource(id, ResourceType.MOVER)).toList();
        List<Resource> drivers = LongStream.rangeClosed(101, 120).mapToObj(id -> resource(id, ResourceType.DRIVER)).toList();
        when(repository.loadDateAvailability(MONDAY, PlanType.FULL_SERVICE, null)).thenReturn(data(movers, drivers, Map.of()));

        DailyAvailabilityResponse response = service.getDailyTimeSlots(daily(MONDAY, PlanType.FULL_SERVICE, 2));

        TimeSlotAvailability first = response.getTimeSlots().get(0);
        assertThat(first.isAvailable()).isTrue();
        assertThat(first.getResourceCounts()).isEqualTo(new ResourceCounts(10, 20));
        assertThat(first.getAvailabilityLevel()).isEqualTo(AvailabilityLevel.HIGH);
    }

    @Test
    void daily_pastDate_returnsAllSlotsUnavailableWithoutLookup() {
        LocalDate yesterday = LocalDate.of(2024, 12, 31);

        DailyAvailabilityResponse response = service.getDailyTimeSlots(daily(yesterday, PlanType.DIY, 1));

        assertThat(response.getTimeSlots()).hasSize(9).allSatisfy(slot -> {
            assertThat(slot.isAvailable()).isFalse();
            assertThat(slot.getAvailabilityLevel()).isEqualTo(AvailabilityLevel.LOW);
        });
        verifyNoInteractions(repository);
        assertThat(cache.stats().getSize()).isZero();
    }

    @Test
    void daily_secondCall_isServedFromCache() {
        when(repository.loadDateAvailability(MONDAY, PlanType.DIY, null))
                .thenReturn(data(List.of(), List.of(resource(10, ResourceType.DRIVER)), Map.of()));

        DailyAvailabilityResponse first = service.getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 1));
        DailyAvailabilityResponse second = service.getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 1));

        verify(repository, times(1)).loadDateAvailability(any(), any(), any());
        assertThat(first.getMetadata().isCacheHit()).isFalse();
        assertThat(second.getMetadata().isCacheHit()).isTrue();
        assertThat(second.getTimeSlots()).isEqualTo(first.getTimeSlots());
        // the stored copy is not flipped
        assertThat(service.getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 1)).getMetadata().isCacheHit()).isTrue();
        assertThat(first.getMetadata().isCacheHit()).isFalse();
    }

    @Test
    void daily_excludedAppointment_isForwardedAndCachedSeparately() {
        when(repository.loadDateAvailability(eq(MONDAY), eq(PlanType.DIY), any()))
                .thenReturn(data(List.of(), List.of(resource(10, ResourceType.DRIVER)), Map.of()));

        service.getDailyTimeSlots(new DailyAvailabilityQuery(MONDAY, PlanType.DIY, 1, 77L));
        service.getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 1));

        verify(repository).loadDateAvailability(MONDAY, PlanType.DIY, 77L);
        verify(repository).loadDateAvailability(MONDAY, PlanType.DIY, null);
        assertThat(cache.stats().getSize()).isEqualTo(2);
    }

    @Test
    void daily_upstreamFailure_propagatesAndCachesNothing() {
        when(repository.loadDateAvailability(any(), any(), any())).thenThrow(new UpstreamDataException("db down"));

        assertThatThrownBy(() -> service.getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 1)))
                .isInstanceOf(UpstreamDataException.class)
                .hasMessage("db down");
        assertThat(cache.stats().getSize()).isZero();
    }

    @Test
    void daily_missingData_isUpstreamFailure() {
        when(repository.loadDateAvailability(any(), any(), any())).thenReturn(null);

        assertThatThrownBy(() -> service.getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 1)))
                .isInstanceOf(UpstreamDataException.class);
    }

    @Test
    void daily_invalidQuery_isRejectedBeforeAnyLookup() {
        AvailabilityCache cacheMock = mock(AvailabilityCache.class);
        AvailabilityService guarded = newService(cacheMock);

        assertThatThrownBy(() -> guarded.getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 0)))
                .isInstanceOf(AvailabilityValidationException.class);
        assertThatThrownBy(() -> guarded.getDailyTimeSlots(daily(null, PlanType.DIY, 1)))
                .isInstanceOf(AvailabilityValidationException.class);
        assertThatThrownBy(() -> guarded.getDailyTimeSlots(daily(MONDAY, null, 1)))
                .isInstanceOf(AvailabilityValidationException.class);
        assertThatThrownBy(() -> DailyAvailabilityQuery.of("2025-13-01", "DIY", 1, null))
                .isInstanceOf(AvailabilityValidationException.class);
        verifyNoInteractions(repository, cacheMock);
    }

    @Test
    void daily_brokenCache_fallsBackToFreshComputation() {
        AvailabilityCache broken = mock(AvailabilityCache.class);
        when(broken.get(anyString(), any())).thenThrow(new IllegalStateException("cache down"));
        doThrow(new IllegalStateException("cache down")).when(broken).set(anyString(), any(), any());
        when(repository.loadDateAvailability(MONDAY, PlanType.DIY, null))
                .thenReturn(data(List.of(), List.of(resource(10, ResourceType.DRIVER)), Map.of()));

        DailyAvailabilityResponse response = newService(broken).getDailyTimeSlots(daily(MONDAY, PlanType.DIY, 1));

        assertThat(response.getTimeSlots()).hasSize(9);
        assertThat(response.getMetadata().isCacheHit()).isFalse();
    }

    /* === monthly === */

    @Test
    void monthly_countsAndLevelsPerWeekday() {
        when(repository.countResourcesByDayOfWeek(any(), eq(PlanType.FULL_SERVICE))).thenReturn(new WeeklyResourceCounts(
                Map.of(DayOfWeek.MONDAY, 3),
                Map.of(DayOfWeek.MONDAY, 3, DayOfWeek.TUESDAY, 4)));

        MonthlyAvailabilityResponse response = service.getMonthlyAvailability(
                new MonthlyAvailabilityQuery(2025, 1, PlanType.FULL_SERVICE, 2));

        assertThat(response.getDates()).hasSize(31);
        MonthlyAvailabilityDate monday = response.getDates().get(5);
        assertThat(monday.getDate()).isEqualTo(MONDAY);
        assertThat(monday.isHasAvailability()).isTrue();
        assertThat(monday.getAvailabilityLevel()).isEqualTo(AvailabilityLevel.HIGH);
        assertThat(monday.getResourceCounts()).isEqualTo(new ResourceCounts(3, 3));

        MonthlyAvailabilityDate tuesday = response.getDates().get(6);
        assertThat(tuesday.isHasAvailability()).isFalse();
        assertThat(tuesday.getAvailabilityLevel()).isNull();
        assertThat(tuesday.getResourceCounts()).isEqualTo(new ResourceCounts(0, 4));

        assertThat(response.getMetadata().getTotalDaysChecked()).isEqualTo(31);
        assertThat(response.getMetadata().getResourcesChecked().getMovers()).isEqualTo(3);
        assertThat(response.getMetadata().getResourcesChecked().getDrivers()).isEqualTo(7);
        verify(repository).countResourcesByDayOfWeek(eq(Set.of(DayOfWeek.values())), eq(PlanType.FULL_SERVICE));
    }

    @Test
    void monthly_diy_needsOneDriverPerUnit() {
        when(repository.countResourcesByDayOfWeek(any(), eq(PlanType.DIY))).thenReturn(new WeeklyResourceCounts(
                Map.of(), Map.of(DayOfWeek.MONDAY, 2, DayOfWeek.WEDNESDAY, 3)));

        MonthlyAvailabilityResponse response = service.getMonthlyAvailability(
                new MonthlyAvailabilityQuery(2025, 1, PlanType.DIY, 3));

        assertThat(response.getDates().get(5).isHasAvailability()).isFalse();
        assertThat(response.getDates().get(0).isHasAvailability()).isTrue();
        assertThat(response.getDates().get(0).getAvailabilityLevel()).isEqualTo(AvailabilityLevel.LOW);
    }

    @Test
    void monthly_diy_singleUnitWithDriverSurplus_isHigh() {
        when(repository.countResourcesByDayOfWeek(any(), eq(PlanType.DIY))).thenReturn(new WeeklyResourceCounts(
                Map.of(), Map.of(DayOfWeek.MONDAY, 20)));

        MonthlyAvailabilityResponse response = service.getMonthlyAvailability(
                new MonthlyAvailabilityQuery(2025, 1, PlanType.DIY, 1));

        assertThat(response.getDates().get(5).getAvailabilityLevel()).isEqualTo(AvailabilityLevel.HIGH);
    }

    @Test
    void monthly_pastMonth_isUnavailableWithoutLookup() {
        MonthlyAvailabilityResponse response = service.getMonthlyAvailability(
                new MonthlyAvailabilityQuery(2024, 12, PlanType.DIY, 1));

        assertThat(response.getDates()).hasSize(31).allSatisfy(d -> {
            assertThat(d.isHasAvailability()).isFalse();
            assertThat(d.getResourceCounts()).isNull();
        });
        verifyNoInteractions(repository);
    }

    @Test
    void monthly_secondCall_isServedFromCache() {
        when(repository.countResourcesByDayOfWeek(any(), any()))
                .thenReturn(new WeeklyResourceCounts(Map.of(), Map.of(DayOfWeek.FRIDAY, 1)));
        MonthlyAvailabilityQuery query = new MonthlyAvailabilityQuery(2025, 2, PlanType.DIY, 1);

        MonthlyAvailabilityResponse first = service.getMonthlyAvailability(query);
        MonthlyAvailabilityResponse second = service.getMonthlyAvailability(query);

        verify(repository, times(1)).countResourcesByDayOfWeek(any(), any());
        assertThat(second.getMetadata().isCacheHit()).isTrue();
        assertThat(second.getDates()).isEqualTo(first.getDates());
    }

    @Test
    void monthly_invalidMonth_isRejected() {
        assertThatThrownBy(() -> service.getMonthlyAvailability(new MonthlyAvailabilityQuery(2025, 13, PlanType.DIY, 1)))
                .isInstanceOf(AvailabilityValidationException.class);
        assertThatThrownBy(() -> service.getMonthlyAvailability(new MonthlyAvailabilityQuery(2025, 1, PlanType.DIY, -1)))
                .isInstanceOf(AvailabilityValidationException.class);
        verifyNoInteractions(repository);
    }

    /* === maintenance === */

    @Test
    void warmCache_computesEveryPlanTypeAndSkipsFailures() {
        LocalDate tuesday = MONDAY.plusDays(1);
        when(repository.loadDateAvailability(eq(MONDAY), any(), isNull()))
                .thenReturn(data(List.of(), List.of(resource(10, ResourceType.DRIVER)), Map.of()));
        when(repository.loadDateAvailability(eq(tuesday), any(), isNull()))
                .thenThrow(new UpstreamDataException("db down"));

        int warmed = service.warmCache(List.of(MONDAY, tuesday), null);

        assertThat(warmed).isEqualTo(2);
        assertThat(service.getCacheStats().getSize()).isEqualTo(2);
    }

    @Test
    void warmCache_withoutDates_warmsNothing() {
        assertThat(service.warmCache(null, null)).isZero();
        assertThat(service.warmCache(List.of(), List.of(PlanType.DIY))).isZero();
        verifyNoInteractions(repository);
    }

    @Test
    void warmCache_pastDatesCountButAreNotStored() {
        List<LocalDate> dates = IntStream.rangeClosed(1, 3).mapToObj(i -> LocalDate.of(2024, 12, 27 + i)).toList();

        int warmed = service.warmCache(dates, List.of(PlanType.DIY));

        assertThat(warmed).isEqualTo(3);
        assertThat(service.getCacheStats().getSize()).isZero();
        verifyNoInteractions(repository);
    }
}
