package com.example.parkmaster.Services;

import com.example.parkmaster.DTOs.LotOccupancyDTO;
import com.example.parkmaster.DTOs.LotOccupancySummaryDTO;
import com.example.parkmaster.DTOs.OccupancyDashboardDTO;
import com.example.parkmaster.DTOs.SpaceOccupancyDTO;
import com.example.parkmaster.Enum.Reservation.ReservationStatus;
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
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Live occupancy views. Loads a lot and its active reservations and hands them
 * to {@link OccupancyService}; the query instant defaults to the injected clock.
 */
@Service
public class AvailabilityService {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityService.class);

    private final ParkingLotRepository parkingLotRepository;
    private final ReservationRepository reservationRepository;
    private final OccupancyService occupancyService;
    private final ReservationMapper reservationMapper;
    private final Clock clock;

    @Autowired
    public AvailabilityService(ParkingLotRepository parkingLotRepository,
                               ReservationRepository reservationRepository,
                               OccupancyService occupancyService,
                               ReservationMapper reservationMapper,
                               Clock clock) {
        this.parkingLotRepository = parkingLotRepository;
        this.reservationRepository = reservationRepository;
        this.occupancyService = occupancyService;
        this.reservationMapper = reservationMapper;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public LotOccupancyDTO getLotOccupancy(String parkingLotId, OffsetDateTime at) {
        ParkingLot parkingLot = findParkingLot(parkingLotId);
        List<Reservation> reservations = activeReservations(parkingLotId);
        OffsetDateTime queryTime = at != null ? at : OffsetDateTime.now(clock);

        LotOccupancyDTO occupancy = occupancyService.resolve(parkingLot, toOccurrences(reservations), queryTime,
                occupantNames());
        logger.info("Parking lot {} at {}: {} occupied, {} available of {}", parkingLotId, queryTime,
                occupancy.getOccupiedSpots(), occupancy.getAvailableSpots(), occupancy.getTotalSpots());
        return occupancy;
    }

    @Transactional(readOnly = true)
    public SpaceOccupancyDTO getSpaceOccupancy(String parkingLotId, int spaceId, OffsetDateTime at) {
        ParkingLot parkingLot = findParkingLot(parkingLotId);
        boolean known = parkingLot.getSpaces().stream()
                .anyMatch(space -> space.getId() != null && space.getId() == spaceId);
        if (!known) {
            throw new ResourceNotFoundException("Space " + spaceId + " not found in parking lot " + parkingLotId);
        }

        List<Reservation> reservations = activeReservations(parkingLotId);
        OffsetDateTime queryTime = at != null ? at : OffsetDateTime.now(clock);
        return occupancyService.resolveSpace(parkingLot, spaceId, toOccurrences(reservations), queryTime,
                occupantNames());
    }

    /**
     * Occupancy of every lot at one instant, for the admin dashboard.
     */
    @Transactional(readOnly = true)
    public OccupancyDashboardDTO getOccupancySummary(OffsetDateTime at) {
        OffsetDateTime queryTime = at != null ? at : OffsetDateTime.now(clock);
        List<ParkingLot> parkingLots = parkingLotRepository.findAllByOrderByNameAsc();

        Map<String, List<Reservation>> reservationsByLot = parkingLots.isEmpty()
                ? Map.of()
                : reservationRepository.findByParkingLotIdInAndStatus(
                                parkingLots.stream().map(ParkingLot::getId).collect(Collectors.toList()),
                                ReservationStatus.ACTIVE)
                        .stream()
                        .collect(Collectors.groupingBy(reservation -> reservation.getParkingLot().getId()));

        List<LotOccupancySummaryDTO> summaries = new ArrayList<>(parkingLots.size());
        int totalSpots = 0;
        int occupiedSpots = 0;
        for (ParkingLot parkingLot : parkingLots) {
            List<Reservation> reservations = reservationsByLot.getOrDefault(parkingLot.getId(), List.of());
            LotOccupancyDTO occupancy = occupancyService.resolve(parkingLot, toOccurrences(reservations), queryTime,
                    occupantNames());
            LotOccupancySummaryDTO summary = summarize(occupancy);
            summaries.add(summary);
            totalSpots += summary.getTotalSpots();
            occupiedSpots += summary.getOccupiedSpots();
        }

        logger.debug("Built occupancy summary for {} parking lots at {}", parkingLots.size(), queryTime);
        return OccupancyDashboardDTO.builder()
                .at(queryTime)
                .totalSpots(totalSpots)
                .occupiedSpots(occupiedSpots)
                .availableSpots(totalSpots - occupiedSpots)
                .lots(summaries)
                .build();
    }

    private LotOccupancySummaryDTO summarize(LotOccupancyDTO occupancy) {
        int total = occupancy.getTotalSpots();
        int available = occupancy.getAvailableSpots();
        if (available < 0 || available > total) {
            logger.warn("Available spots ({}) for parking lot {} are outside [0, {}]. Clamping.",
                    available, occupancy.getParkingLotId(), total);
            available = Math.max(0, Math.min(available, total));
        }
        double occupancyRate = total > 0
                ? BigDecimal.valueOf(occupancy.getOccupiedSpots() * 100.0 / total).setScale(1, RoundingMode.HALF_UP).doubleValue()
                : 0.0;

        return LotOccupancySummaryDTO.builder()
                .parkingLotId(occupancy.getParkingLotId())
                .name(occupancy.getName())
                .totalSpots(total)
                .occupiedSpots(occupancy.getOccupiedSpots())
                .availableSpots(available)
                .occupancyRate(occupancyRate)
                .build();
    }

    private ParkingLot findParkingLot(String parkingLotId) {
        return parkingLotRepository.findById(parkingLotId)
                .orElseThrow(() -> new ResourceNotFoundException("Parking Lot not found with ID: " + parkingLotId));
    }

    private List<Reservation> activeReservations(String parkingLotId) {
        return reservationRepository.findByParkingLotIdAndStatusOrderByStartTimeAsc(parkingLotId, ReservationStatus.ACTIVE);
    }

    private List<ReservationOccurrence> toOccurrences(List<Reservation> reservations) {
        return reservations.stream()
                .map(reservationMapper::toOccurrence)
                .collect(Collectors.toList());
    }

    // Each occurrence carries the name stored on its own reservation; this covers the rest
    private Function<String, String> occupantNames() {
        return userId -> "User " + userId;
    }
}
