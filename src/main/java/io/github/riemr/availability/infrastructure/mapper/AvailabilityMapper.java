package io.github.riemr.availability.infrastructure.mapper;

import io.github.riemr.availability.infrastructure.persistence.entity.AvailabilityWindowRow;
import io.github.riemr.availability.infrastructure.persistence.entity.BlockedDateRow;
import io.github.riemr.availability.infrastructure.persistence.entity.BookingRow;
import io.github.riemr.availability.infrastructure.persistence.entity.DayOfWeekCountRow;
import io.github.riemr.availability.infrastructure.persistence.entity.ExternalTaskRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * Read-only queries behind the availability engine.
 * Day of week columns hold English labels ("Monday"), times hold "HH:mm".
 */
@Mapper
public interface AvailabilityMapper {

    /* === Weekly counts (monthly view) === */

    @Select({"<script>",
            "SELECT a.day_of_week AS day_of_week, COUNT(DISTINCT m.id) AS resource_count",
            "FROM moving_partner m JOIN moving_partner_availability a ON a.moving_partner_id = m.id",
            "WHERE m.status = 'ACTIVE' AND a.is_blocked = false",
            "AND a.day_of_week IN <foreach collection='days' item='d' open='(' separator=',' close=')'>#{d}</foreach>",
            "GROUP BY a.day_of_week",
            "</script>"})
    List<DayOfWeekCountRow> countActiveMoversByDayOfWeek(@Param("days") Collection<String> days);

    @Select({"<script>",
            "SELECT a.day_of_week AS day_of_week, COUNT(DISTINCT d.id) AS resource_count",
            "FROM driver d JOIN driver_availability a ON a.driver_id = d.id",
            "WHERE d.status = 'Active' AND a.is_blocked = false",
            "AND a.day_of_week IN <foreach collection='days' item='d' open='(' separator=',' close=')'>#{d}</foreach>",
            "GROUP BY a.day_of_week",
            "</script>"})
    List<DayOfWeekCountRow> countActiveDriversByDayOfWeek(@Param("days") Collection<String> days);

    /* === Rosters (daily view) === */

    @Select("SELECT m.id AS resource_id, a.day_of_week, a.start_time, a.end_time " +
            "FROM moving_partner m JOIN moving_partner_availability a ON a.moving_partner_id = m.id " +
            "WHERE m.status = 'ACTIVE' AND a.is_blocked = false AND a.day_of_week = #{dayOfWeek} " +
            "ORDER BY m.id, a.start_time")
    List<AvailabilityWindowRow> selectActiveMoverWindows(@Param("dayOfWeek") String dayOfWeek);

    @Select("SELECT d.id AS resource_id, a.day_of_week, a.start_time, a.end_time " +
            "FROM driver d JOIN driver_availability a ON a.driver_id = d.id " +
            "WHERE d.status = 'Active' AND a.is_blocked = false AND a.day_of_week = #{dayOfWeek} " +
            "ORDER BY d.id, a.start_time")
    List<AvailabilityWindowRow> selectActiveDriverWindows(@Param("dayOfWeek") String dayOfWeek);

    @Select("SELECT user_id, user_type FROM blocked_date " +
            "WHERE blocked_date >= #{from} AND blocked_date < #{to}")
    List<BlockedDateRow> selectBlockedUsers(@Param("from") Date from, @Param("to") Date to);

    /* === Conflicts === */

    @Select({"<script>",
            "SELECT a.moving_partner_id AS resource_id, b.appointment_id, b.booking_date, b.end_date",
            "FROM time_slot_booking b JOIN moving_partner_availability a ON a.id = b.moving_partner_availability_id",
            "WHERE b.booking_date &lt; #{to} AND b.end_date &gt; #{from}",
            "<if test='excludeAppointmentId != null'>AND b.appointment_id &lt;&gt; #{excludeAppointmentId}</if>",
            "</script>"})
    List<BookingRow> selectMoverBookings(@Param("from") Date from,
                                         @Param("to") Date to,
                                         @Param("excludeAppointmentId") Long excludeAppointmentId);

    @Select({"<script>",
            "SELECT a.driver_id AS resource_id, b.appointment_id, b.booking_date, b.end_date",
            "FROM driver_time_slot_booking b JOIN driver_availability a ON a.id = b.driver_availability_id",
            "WHERE b.booking_date &lt; #{to} AND b.end_date &gt; #{from}",
            "<if test='excludeAppointmentId != null'>AND b.appointment_id &lt;&gt; #{excludeAppointmentId}</if>",
            "</script>"})
    List<BookingRow> selectDriverBookings(@Param("from") Date from,
                                          @Param("to") Date to,
                                          @Param("excludeAppointmentId") Long excludeAppointmentId);

    /** One row per driver and appointment; an appointment may own several tasks. */
    @Select({"<script>",
            "SELECT DISTINCT t.driver_id, t.appointment_id, ap.time AS appointment_time",
            "FROM onfleet_task t JOIN appointment ap ON ap.id = t.appointment_id",
            "WHERE t.driver_id IS NOT NULL",
            "AND ap.time &gt;= #{from} AND ap.time &lt; #{to}",
            "AND ap.status NOT IN ('Completed', 'Canceled')",
            "<if test='excludeAppointmentId != null'>AND t.appointment_id &lt;&gt; #{excludeAppointmentId}</if>",
            "</script>"})
    List<ExternalTaskRow> selectDriverTasks(@Param("from") Date from,
                                            @Param("to") Date to,
                                            @Param("excludeAppointmentId") Long excludeAppointmentId);
}
