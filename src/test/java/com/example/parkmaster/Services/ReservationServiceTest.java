package com.example.parkmaster.Services;

import com.example.parkmaster.DTOs.ReservationDTO;
import com.example.parkmaster.DTOs.ReservationOccurrenceDTO;
import com.example.parkmaster.DTOs.ReservationRequestDTO;
import com.example.parkmaster.Enum.Reservation.RepeatPattern;
import com.example.parkmaster.Enum.Reservation.ReservationStatus;
import com.example.parkmaster.Exceptions.InvalidDataException;
import com.example.parkmaster.Exceptions.ResourceNotFoundException;
import com.example.parkmaster.Mappers.ReservationMapper;
import com.example.parkmaster.Models.ParkingLot;
import com.example.parkmaster.Models.Reservation;
import com.example.parkmaster.Repositories.ParkingLotRepository;
import com.example.parkmaster.Repositories.ReservationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReservationServiceTest {

    @Mock
    private ReservationRepository reservationRepository;

    @Mock
    private ParkingLotRepository parkingLotRepository;

    @Captor
    private ArgumentCaptor<List<Reservation>> reservationsCaptor;

    private ReservationService reservationService;
    private ParkingLot parkingLot;

    @BeforeEach
    void setUp() {
        reservationService = new ReservationService(reservationRepository, parkingLotRepository,
                new ReservationScheduleService(ZoneId.of("UTC")), new ReservationMapper());

        parkingLot = new ParkingLot();
        parkingLot.setId("lot-1");
        parkingLot.setName("North Garage");
        parkingLot.setRows(2);
        parkingLot.setCols(2);
        parkingLot.setSpaces(new SpaceRegistryService().generate(2, 2));
    }

    @Test
    void previewOccurrences_doesNotTouchRepositories() {
        List<ReservationOccurrenceDTO> preview = reservationService.previewOccurrences(weeklyRequest());

        assertThat(preview).hasSize(3);
        assertThat(preview.get(2).getStartsAt()).isEqualTo(OffsetDateTime.of(2025, 11, 3, 9, 0, 0, 0, ZoneOffset.UTC));
        verify(parkingLotRepository, never()).findById(any());
        verify(reservationRepository, never()).saveAll(anyList());
    }

    @Test
    void createReservations_weekly_storesOneRowPerOccurrenceInOneSeries() {
        when(parkingLotRepository.findById("lot-1")).thenReturn(Optional.of(parkingLot));
        when(reservationRepository.findOverlapping(any(), any(), any(), any(), any())).thenReturn(List.of());
        when(reservationRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        List<ReservationDTO> created = reservationService.createReservations(weeklyRequest());

        assertThat(created).hasSize(3);
        assertThat(created).extracting(ReservationDTO::getSeriesId).doesNotContainNull().containsOnly(created.get(0).getSeriesId());
        assertThat(created).allMatch(reservation -> reservation.getRepeatPattern() == RepeatPattern.WEEKLY
                && reservation.getStatus() == ReservationStatus.ACTIVE
                && "lot-1".equals(reservation.getParkingLotId())
                && "Alice".equals(reservation.getUserName()));
    }

    @Test
    void createReservations_unknownSpace_throws() {
        when(parkingLotRepository.findById("lot-1")).thenReturn(Optional.of(parkingLot));
        ReservationRequestDTO request = oneOffRequest();
        request.setSpaceId(9);

        assertThatThrownBy(() -> reservationService.createReservations(request))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("Space 9");

        verify(reservationRepository, never()).saveAll(anyList());
    }

    @Test
    void createReservations_unknownLot_throws() {
        when(parkingLotRepository.findById("lot-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reservationService.createReservations(oneOffRequest()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void createReservations_endDateBeforeDate_throws() {
        when(parkingLotRepository.findById("lot-1")).thenReturn(Optional.of(parkingLot));
        ReservationRequestDTO request = weeklyRequest();
        request.setEndDate(LocalDate.of(2025, 10, 1));

        assertThatThrownBy(() -> reservationService.createReservations(request))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("no occurrences");
    }

    @Test
    void createReservations_overlapAllowedByDefault_savesAnyway() {
        when(parkingLotRepository.findById("lot-1")).thenReturn(Optional.of(parkingLot));
        when(reservationRepository.findOverlapping(any(), any(), any(), any(), any()))
                .thenReturn(List.of(reservation("r-0", ReservationStatus.ACTIVE)));
        when(reservationRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        assertThat(reservationService.createReservations(oneOffRequest())).hasSize(1);
    }

    @Test
    void createReservations_overlapWhenRejecting_throws() {
        ReflectionTestUtils.setField(reservationService, "rejectOverlapping", true);
        when(parkingLotRepository.findById("lot-1")).thenReturn(Optional.of(parkingLot));
        when(reservationRepository.findOverlapping(any(), any(), any(), any(), any()))
                .thenReturn(List.of(reservation("r-0", ReservationStatus.ACTIVE)));

        assertThatThrownBy(() -> reservationService.createReservations(oneOffRequest()))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("already reserved");

        verify(reservationRepository, never()).saveAll(anyList());
    }

    @Test
    void createReservations_unknownPattern_storesSingleNonRecurringRow() {
        when(parkingLotRepository.findById("lot-1")).thenReturn(Optional.of(parkingLot));
        when(reservationRepository.findOverlapping(any(), any(), any(), any(), any())).thenReturn(List.of());
        when(reservationRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
        ReservationRequestDTO request = weeklyRequest();
        request.setRepeatPattern("fortnightly");

        List<ReservationDTO> created = reservationService.createReservations(request);

        assertThat(created).hasSize(1);
        assertThat(created.get(0).getRepeatPattern()).isEqualTo(RepeatPattern.NONE);
    }

    @Test
    void cancelReservation_active_marksCancelled() {
        when(reservationRepository.findById("r-1")).thenReturn(Optional.of(reservation("r-1", ReservationStatus.ACTIVE)));
        when(reservationRepository.save(any(Reservation.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ReservationDTO cancelled = reservationService.cancelReservation("r-1");

        assertThat(cancelled.getStatus()).isEqualTo(ReservationStatus.CANCELLED);
    }

    @Test
    void cancelReservation_notActive_throws() {
        when(reservationRepository.findById("r-1")).thenReturn(Optional.of(reservation("r-1", ReservationStatus.COMPLETED)));

        assertThatThrownBy(() -> reservationService.cancelReservation("r-1"))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("completed");

        verify(reservationRepository, never()).save(any());
    }

    @Test
    void cancelReservation_unknown_throws() {
        when(reservationRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reservationService.cancelReservation("missing"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void cancelSeries_cancelsOnlyActiveOccurrences() {
        Reservation past = reservation("r-1", ReservationStatus.COMPLETED);
        Reservation upcoming = reservation("r-2", ReservationStatus.ACTIVE);
        when(reservationRepository.findBySeriesIdOrderByStartTimeAsc("s-1")).thenReturn(List.of(past, upcoming));

        List<ReservationDTO> series = reservationService.cancelSeries("s-1");

        verify(reservationRepository).saveAll(reservationsCaptor.capture());
        assertThat(reservationsCaptor.getValue()).containsExactly(upcoming);
        assertThat(series).extracting(ReservationDTO::getStatus)
                .containsExactly(ReservationStatus.COMPLETED, ReservationStatus.CANCELLED);
    }

    @Test
    void cancelSeries_nothingActive_throws() {
        when(reservationRepository.findBySeriesIdOrderByStartTimeAsc("s-1"))
                .thenReturn(List.of(reservation("r-1", ReservationStatus.CANCELLED)));

        assertThatThrownBy(() -> reservationService.cancelSeries("s-1"))
                .isInstanceOf(InvalidDataException.class);
    }

    @Test
    void cancelSeries_unknown_throws() {
        when(reservationRepository.findBySeriesIdOrderByStartTimeAsc("s-9")).thenReturn(List.of());

        assertThatThrownBy(() -> reservationService.cancelSeries("s-9"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void getReservationsForParkingLot_unknownLot_throws() {
        when(parkingLotRepository.existsById("missing")).thenReturn(false);

        assertThatThrownBy(() -> reservationService.getReservationsForParkingLot("missing", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void getReservationsForParkingLot_withStatus_filtersByStatus() {
        when(parkingLotRepository.existsById("lot-1")).thenReturn(true);
        when(reservationRepository.findByParkingLotIdAndStatusOrderByStartTimeAsc("lot-1", ReservationStatus.ACTIVE))
                .thenReturn(List.of(reservation("r-1", ReservationStatus.ACTIVE)));

        List<ReservationDTO> reservations = reservationService.getReservationsForParkingLot("lot-1", ReservationStatus.ACTIVE);

        assertThat(reservations).extracting(ReservationDTO::getId).containsExactly("r-1");
    }

    @Test
    void completeFinishedReservations_marksEndedReservationsCompleted() {
        OffsetDateTime now = OffsetDateTime.of(2025, 10, 21, 0, 0, 0, 0, ZoneOffset.UTC);
        Reservation first = reservation("r-1", ReservationStatus.ACTIVE);
        Reservation second = reservation("r-2", ReservationStatus.ACTIVE);
        when(reservationRepository.findByStatusAndEndTimeBefore(ReservationStatus.ACTIVE, now))
                .thenReturn(List.of(first, second));

        int completed = reservationService.completeFinishedReservations(now);

        assertThat(completed).isEqualTo(2);
        assertThat(first.getStatus()).isEqualTo(ReservationStatus.COMPLETED);
        assertThat(second.getStatus()).isEqualTo(ReservationStatus.COMPLETED);
    }

    private Reservation reservation(String id, ReservationStatus status) {
        Reservation reservation = new Reservation();
        reservation.setId(id);
        reservation.setParkingLot(parkingLot);
        reservation.setUserId("u-1");
        reservation.setSpaceId(1);
        reservation.setStartTime(OffsetDateTime.of(2025, 10, 20, 9, 0, 0, 0, ZoneOffset.UTC));
        reservation.setEndTime(OffsetDateTime.of(2025, 10, 20, 17, 0, 0, 0, ZoneOffset.UTC));
        reservation.setStatus(status);
        reservation.setSeriesId("s-1");
        return reservation;
    }

    private static ReservationRequestDTO oneOffRequest() {
        return ReservationRequestDTO.builder()
                .userId("u-1")
                .userName("Alice")
                .parkingLotId("lot-1")
                .spaceId(2)
                .date(LocalDate.of(2025, 10, 20))
                .startTime("09:00")
                .endTime("17:00")
                .build();
    }

    private static ReservationRequestDTO weeklyRequest() {
        ReservationRequestDTO request = oneOffRequest();
        request.setRecurring(true);
        request.setRepeatPattern("weekly");
        request.setEndDate(LocalDate.of(2025, 11, 3));
        return request;
    }
}
