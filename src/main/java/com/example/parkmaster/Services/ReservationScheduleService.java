package com.example.parkmaster.Services;

import com.example.parkmaster.DTOs.ReservationRequestDTO;
import com.example.parkmaster.Enum.Reservation.RepeatPattern;
import com.example.parkmaster.Exceptions.InvalidDataException;
import com.example.parkmaster.Models.ReservationOccurrence;
import com.example.parkmaster.Utils.TimeOfDayParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Expands a reservation request into its concrete occurrences. Dates and times
 * are wall-clock values in the configured parking zone; recurring steps are
 * taken in local time so an occurrence keeps its hour across DST changes.
 */
@Service
public class ReservationScheduleService {

    private static final Logger logger = LoggerFactory.getLogger(ReservationScheduleService.class);
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    private final ZoneId parkingZone;

    @Autowired
    public ReservationScheduleService(ZoneId parkingZone) {
        this.parkingZone = parkingZone;
    }

    public List<ReservationOccurrence> buildOccurrences(ReservationRequestDTO request) {
        validateRequiredFields(request);

        LocalTime startTime = TimeOfDayParser.parse(request.getStartTime());
        LocalTime endTime = TimeOfDayParser.parse(request.getEndTime());

        ZonedDateTime baseDate = request.getDate().atStartOfDay(parkingZone);
        ZonedDateTime currentStart = baseDate.with(startTime);
        // End before start is passed through unchanged
        ZonedDateTime currentEnd = baseDate.with(endTime);

        List<ReservationOccurrence> occurrences = new ArrayList<>();
        RepeatPattern pattern = resolvePattern(request);

        if (pattern == RepeatPattern.NONE) {
            occurrences.add(toOccurrence(request, currentStart, currentEnd));
            return occurrences;
        }

        if (request.getEndDate() == null) {
            throw new InvalidDataException("End date is required for recurring reservations.");
        }
        ZonedDateTime endLimit = request.getEndDate().atTime(END_OF_DAY).atZone(parkingZone);

        while (!currentStart.isAfter(endLimit)) {
            occurrences.add(toOccurrence(request, currentStart, currentEnd));
            if (pattern == null) {
                break;
            }
            currentStart = currentStart.plusDays(pattern.getStepDays());
            currentEnd = currentEnd.plusDays(pattern.getStepDays());
        }

        logger.debug("Expanded {} reservation for space {} in lot {} into {} occurrences",
                pattern != null ? pattern.getValue() : "unrecognized", request.getSpaceId(),
                request.getParkingLotId(), occurrences.size());
        return occurrences;
    }

    /**
     * NONE for one-off requests, null for a recurring request whose pattern is
     * unknown (the expansion then stops after the first occurrence).
     */
    private RepeatPattern resolvePattern(ReservationRequestDTO request) {
        if (!request.isRecurring()) {
            return RepeatPattern.NONE;
        }
        if (!StringUtils.hasText(request.getRepeatPattern())) {
            logger.warn("Recurring reservation for space {} has no repeat pattern. Falling back to daily.",
                    request.getSpaceId());
            return RepeatPattern.DAILY;
        }
        Optional<RepeatPattern> pattern = RepeatPattern.find(request.getRepeatPattern());
        if (pattern.isEmpty()) {
            logger.warn("Unrecognized repeat pattern '{}' for space {}. Only the first occurrence will be scheduled.",
                    request.getRepeatPattern(), request.getSpaceId());
            return null;
        }
        return pattern.get();
    }

    private void validateRequiredFields(ReservationRequestDTO request) {
        if (request == null) {
            throw new InvalidDataException("Reservation request is required.");
        }
        List<String> missing = new ArrayList<>();
        if (request.getDate() == null) {
            missing.add("date");
        }
        if (!StringUtils.hasText(request.getStartTime())) {
            missing.add("startTime");
        }
        if (!StringUtils.hasText(request.getEndTime())) {
            missing.add("endTime");
        }
        if (!StringUtils.hasText(request.getUserId())) {
            missing.add("userId");
        }
        if (request.getSpaceId() == null) {
            missing.add("spaceId");
        }
        if (!StringUtils.hasText(request.getParkingLotId())) {
            missing.add("parkingLotId");
        }
        if (!missing.isEmpty()) {
            throw new InvalidDataException("Missing required reservation fields: " + String.join(", ", missing));
        }
    }

    private ReservationOccurrence toOccurrence(ReservationRequestDTO request, ZonedDateTime start, ZonedDateTime end) {
        return ReservationOccurrence.builder()
                .userId(request.getUserId())
                .userName(StringUtils.hasText(request.getUserName()) ? request.getUserName().trim() : null)
                .parkingLotId(request.getParkingLotId())
                .spaceId(request.getSpaceId())
                .startsAt(start.toOffsetDateTime())
                .endsAt(end.toOffsetDateTime())
                .build();
    }
}
