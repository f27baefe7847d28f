package com.example.parkmaster.Services;

import com.example.parkmaster.DTOs.ReservationRequestDTO;
import com.example.parkmaster.Exceptions.InvalidDataException;
import com.example.parkmaster.Models.ReservationOccurrence;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReservationScheduleServiceTest {

    private final ReservationScheduleService scheduleService = new ReservationScheduleService(ZoneId.of("UTC"));

    @Test
    void buildOccurrences_oneOffRequest_returnsSingleOccurrence() {
        List<ReservationOccurrence> occurrences = scheduleService.buildOccurrences(request().build());

        assertThat(occurrences).hasSize(1);
        ReservationOccurrence occurrence = occurrences.get(0);
        assertThat(occurrence.getStartsAt()).isEqualTo(OffsetDateTime.of(2025, 10, 20, 9, 0, 0, 0, ZoneOffset.UTC));
        assertThat(occurrence.getEndsAt()).isEqualTo(OffsetDateTime.of(2025, 10, 20, 17, 0, 0, 0, ZoneOffset.UTC));
        assertThat(occurrence.getUserId()).isEqualTo("u-1");
        assertThat(occurrence.getParkingLotId()).isEqualTo("lot-1");
        assertThat(occurrence.getSpaceId()).isEqualTo(3);
    }

    @Test
    void buildOccurrences_weekly_includesOccurrenceOnEndDate() {
        ReservationRequestDTO request = request()
                .recurring(true)
                .repeatPattern("weekly")
                .endDate(LocalDate.of(2025, 11, 3))
                .build();

        List<ReservationOccurrence> occurrences = scheduleService.buildOccurrences(request);

        assertThat(occurrences).extracting(occurrence -> occurrence.getStartsAt().toLocalDate())
                .containsExactly(LocalDate.of(2025, 10, 20), LocalDate.of(2025, 10, 27), LocalDate.of(2025, 11, 3));
        assertThat(occurrences).allMatch(occurrence -> occurrence.getStartsAt().getHour() == 9
                && occurrence.getEndsAt().getHour() == 17);
    }

    @Test
    void buildOccurrences_daily_stepsOneDay() {
        ReservationRequestDTO request = request()
                .recurring(true)
                .repeatPattern("Daily")
                .endDate(LocalDate.of(2025, 10, 22))
                .build();

        assertThat(scheduleService.buildOccurrences(request)).hasSize(3);
    }

    @Test
    void buildOccurrences_recurringWithoutPattern_defaultsToDaily() {
        ReservationRequestDTO request = request()
                .recurring(true)
                .endDate(LocalDate.of(2025, 10, 21))
                .build();

        assertThat(scheduleService.buildOccurrences(request)).hasSize(2);
    }

    @Test
    void buildOccurrences_unknownPattern_stopsAfterFirstOccurrence() {
        ReservationRequestDTO request = request()
                .recurring(true)
                .repeatPattern("monthly")
                .endDate(LocalDate.of(2025, 12, 31))
                .build();

        assertThat(scheduleService.buildOccurrences(request)).hasSize(1);
    }

    @Test
    void buildOccurrences_patternNone_isOneOff() {
        ReservationRequestDTO request = request()
                .recurring(true)
                .repeatPattern("none")
                .build();

        assertThat(scheduleService.buildOccurrences(request)).hasSize(1);
    }

    @Test
    void buildOccurrences_endDateBeforeDate_returnsNothing() {
        ReservationRequestDTO request = request()
                .recurring(true)
                .repeatPattern("daily")
                .endDate(LocalDate.of(2025, 10, 19))
                .build();

        assertThat(scheduleService.buildOccurrences(request)).isEmpty();
    }

    @Test
    void buildOccurrences_recurringWithoutEndDate_throws() {
        ReservationRequestDTO request = request()
                .recurring(true)
                .repeatPattern("daily")
                .build();

        assertThatThrownBy(() -> scheduleService.buildOccurrences(request))
                .isInstanceOf(InvalidDataException.class)
                .hasMessage("End date is required for recurring reservations.");
    }

    @Test
    void buildOccurrences_missingFields_listsEveryMissingField() {
        ReservationRequestDTO request = request()
                .date(null)
                .startTime(" ")
                .spaceId(null)
                .build();

        assertThatThrownBy(() -> scheduleService.buildOccurrences(request))
                .isInstanceOf(InvalidDataException.class)
                .hasMessage("Missing required reservation fields: date, startTime, spaceId");
    }

    @Test
    void buildOccurrences_unreadableStartTime_fallsBackToEightOClock() {
        ReservationRequestDTO request = request().startTime("sometime").build();

        ReservationOccurrence occurrence = scheduleService.buildOccurrences(request).get(0);

        assertThat(occurrence.getStartsAt().getHour()).isEqualTo(8);
        assertThat(occurrence.getStartsAt().getMinute()).isZero();
    }

    @Test
    void buildOccurrences_endBeforeStart_isKeptAsEntered() {
        ReservationRequestDTO request = request().startTime("18:00").endTime("07:00").build();

        ReservationOccurrence occurrence = scheduleService.buildOccurrences(request).get(0);

        assertThat(occurrence.getEndsAt()).isBefore(occurrence.getStartsAt());
    }

    @Test
    void buildOccurrences_acrossDstChange_keepsWallClockHour() {
        ZoneId bucharest = ZoneId.of("Europe/Bucharest");
        ReservationScheduleService localService = new ReservationScheduleService(bucharest);
        ReservationRequestDTO request = request()
                .recurring(true)
                .repeatPattern("weekly")
                .endDate(LocalDate.of(2025, 11, 3))
                .build();

        List<ReservationOccurrence> occurrences = localService.buildOccurrences(request);

        assertThat(occurrences).hasSize(3);
        assertThat(occurrences.get(0).getStartsAt().getOffset()).isEqualTo(ZoneOffset.ofHours(3));
        assertThat(occurrences.get(2).getStartsAt().getOffset()).isEqualTo(ZoneOffset.ofHours(2));
        assertThat(occurrences).allMatch(occurrence ->
                occurrence.getStartsAt().atZoneSameInstant(bucharest).getHour() == 9);
    }

    private static ReservationRequestDTO.ReservationRequestDTOBuilder request() {
        return ReservationRequestDTO.builder()
                .userId("u-1")
                .userName("Alice")
                .parkingLotId("lot-1")
                .spaceId(3)
                .date(LocalDate.of(2025, 10, 20))
                .startTime("09:00")
                .endTime("17:00");
    }
}
