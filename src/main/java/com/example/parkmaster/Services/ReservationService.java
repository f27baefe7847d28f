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
import com.example.parkmaster.Models.ReservationOccurrence;
import com.example.parkmaster.Repositories.ParkingLotRepository;
import com.example.parkmaster.Repositories.ReservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
public class ReservationService {

    private static final Logger logger = LoggerFactory.getLogger(ReservationService.class);

    private final ReservationRepository reservationRepository;
    private final ParkingLotRepository parkingLotRepository;
    private final ReservationScheduleService reservationScheduleService;
    private final ReservationMapper reservationMapper;

    @Value("${app.reservations.reject-overlapping:false}")
    private boolean rejectOverlapping;

    @Autowired
    public ReservationService(ReservationRepository reservationRepository,
                              ParkingLotRepository parkingLotRepository,
                              ReservationScheduleService reservationScheduleService,
                              ReservationMapper reservationMapper) {
        this.reservationRepository = reservationRepository;
        this.parkingLotRepository = parkingLotRepository;
        this.reservationScheduleService = reservationScheduleService;
        this.reservationMapper = reservationMapper;
    }

    public List<ReservationOccurrenceDTO> previewOccurrences(ReservationRequestDTO request) {
        return reservationScheduleService.buildOccurrences(request).stream()
                .map(reservationMapper::toDTO)
                .collect(Collectors.toList());
    }

    /**
     * Stores one reservation per occurrence of the request. All of them share a
     * series id so a recurring booking can be cancelled as a whole.
     */
    @Transactional
    public List<ReservationDTO> createReservations(ReservationRequestDTO request) {
        List<ReservationOccurrence> occurrences = reservationScheduleService.buildOccurrences(request);

        ParkingLot parkingLot = parkingLotRepository.findById(request.getParkingLotId())
                .orElseThrow(() -> new ResourceNotFoundException("Parking Lot not found: " + request.getParkingLotId()));

        boolean spaceExists = parkingLot.getSpaces().stream()
                .anyMatch(space -> request.getSpaceId().equals(space.getId()));
        if (!spaceExists) {
            throw new InvalidDataException("Space " + request.getSpaceId() + " does not exist in parking lot "
                    + parkingLot.getName() + ".");
        }

        if (occurrences.isEmpty()) {
            throw new InvalidDataException("The reservation has no occurrences. End date must not be before the reservation date.");
        }

        checkOverlaps(occurrences);

        RepeatPattern pattern = storedPattern(request);
        String seriesId = UUID.randomUUID().toString();

        List<Reservation> reservations = new ArrayList<>(occurrences.size());
        for (ReservationOccurrence occurrence : occurrences) {
            Reservation reservation = new Reservation();
            reservation.setParkingLot(parkingLot);
            reservation.setUserId(request.getUserId());
            reservation.setUserName(StringUtils.hasText(request.getUserName()) ? request.getUserName().trim() : null);
            reservation.setSpaceId(occurrence.getSpaceId());
            reservation.setStartTime(occurrence.getStartsAt());
            reservation.setEndTime(occurrence.getEndsAt());
            reservation.setStatus(ReservationStatus.ACTIVE);
            reservation.setSeriesId(seriesId);
            reservation.setRepeatPattern(pattern);
            reservations.add(reservation);
        }

        List<Reservation> savedReservations = reservationRepository.saveAll(reservations);
        logger.info("Created {} reservation(s) in series {} for user {} on space {} of parking lot {}",
                savedReservations.size(), seriesId, request.getUserId(), request.getSpaceId(), parkingLot.getId());

        return savedReservations.stream()
                .map(reservationMapper::toDTO)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ReservationDTO getReservationById(String id) {
        return reservationMapper.toDTO(findReservation(id));
    }

    @Transactional(readOnly = true)
    public List<ReservationDTO> getReservationsForParkingLot(String parkingLotId, ReservationStatus status) {
        if (!parkingLotRepository.existsById(parkingLotId)) {
            throw new ResourceNotFoundException("Parking Lot not found: " + parkingLotId);
        }
        List<Reservation> reservations = status == null
                ? reservationRepository.findByParkingLotIdOrderByStartTimeAsc(parkingLotId)
                : reservationRepository.findByParkingLotIdAndStatusOrderByStartTimeAsc(parkingLotId, status);
        return reservations.stream()
                .map(reservationMapper::toDTO)
                .collect(Collectors.toList());
    }

    @Transactional
    public ReservationDTO cancelReservation(String id) {
        Reservation reservation = findReservation(id);
        if (reservation.getStatus() != ReservationStatus.ACTIVE) {
            throw new InvalidDataException("Only active reservations can be cancelled. Reservation " + id
                    + " is " + reservation.getStatus().getValue() + ".");
        }
        reservation.setStatus(ReservationStatus.CANCELLED);
        Reservation savedReservation = reservationRepository.save(reservation);
        logger.info("Cancelled reservation {} on space {} of parking lot {}",
                id, reservation.getSpaceId(), reservation.getParkingLot().getId());
        return reservationMapper.toDTO(savedReservation);
    }

    /**
     * Cancels every still-active occurrence of a series. Occurrences that were
     * already completed or cancelled are left as they are.
     */
    @Transactional
    public List<ReservationDTO> cancelSeries(String seriesId) {
        List<Reservation> series = reservationRepository.findBySeriesIdOrderByStartTimeAsc(seriesId);
        if (series.isEmpty()) {
            throw new ResourceNotFoundException("Reservation series not found: " + seriesId);
        }

        List<Reservation> cancelled = series.stream()
                .filter(reservation -> reservation.getStatus() == ReservationStatus.ACTIVE)
                .peek(reservation -> reservation.setStatus(ReservationStatus.CANCELLED))
                .collect(Collectors.toList());
        if (cancelled.isEmpty()) {
            throw new InvalidDataException("Reservation series " + seriesId + " has no active reservations to cancel.");
        }

        reservationRepository.saveAll(cancelled);
        logger.info("Cancelled {} of {} reservations in series {}", cancelled.size(), series.size(), seriesId);
        return series.stream()
                .map(reservationMapper::toDTO)
                .collect(Collectors.toList());
    }

    @Transactional
    public int completeFinishedReservations(OffsetDateTime now) {
        List<Reservation> finished = reservationRepository.findByStatusAndEndTimeBefore(ReservationStatus.ACTIVE, now);
        if (finished.isEmpty()) {
            logger.debug("No finished reservations to complete at {}", now);
            return 0;
        }
        finished.forEach(reservation -> reservation.setStatus(ReservationStatus.COMPLETED));
        reservationRepository.saveAll(finished);
        logger.info("Marked {} finished reservations as completed", finished.size());
        return finished.size();
    }

    private Reservation findReservation(String id) {
        return reservationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation not found: " + id));
    }

    // Mirrors the expander: no pattern means daily, an unknown one means a single occurrence
    private RepeatPattern storedPattern(ReservationRequestDTO request) {
        if (!request.isRecurring()) {
            return RepeatPattern.NONE;
        }
        if (!StringUtils.hasText(request.getRepeatPattern())) {
            return RepeatPattern.DAILY;
        }
        return RepeatPattern.find(request.getRepeatPattern()).orElse(RepeatPattern.NONE);
    }

    private void checkOverlaps(List<ReservationOccurrence> occurrences) {
        for (ReservationOccurrence occurrence : occurrences) {
            List<Reservation> overlapping = reservationRepository.findOverlapping(
                    occurrence.getParkingLotId(), occurrence.getSpaceId(), ReservationStatus.ACTIVE,
                    occurrence.getStartsAt(), occurrence.getEndsAt());
            if (overlapping.isEmpty()) {
                continue;
            }
            logger.warn("Space {} of parking lot {} is already reserved between {} and {} by reservation {}",
                    occurrence.getSpaceId(), occurrence.getParkingLotId(),
                    occurrence.getStartsAt(), occurrence.getEndsAt(), overlapping.get(0).getId());
            if (rejectOverlapping) {
                throw new InvalidDataException("Space " + occurrence.getSpaceId()
                        + " is already reserved between " + occurrence.getStartsAt() + " and " + occurrence.getEndsAt() + ".");
            }
        }
    }
}
