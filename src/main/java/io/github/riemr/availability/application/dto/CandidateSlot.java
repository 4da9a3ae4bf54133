package io.github.riemr.availability.application.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/** Candidate appointment window within a day's business hours. Recomputed per query. */
@Value
@Builder
public class CandidateSlot {
    LocalDate date;
    LocalTime startTime;
    LocalTime endTime;
    Instant slotStart;
    Instant slotEnd;
    String startLabel;
    String endLabel;
    String displayLabel;
}
