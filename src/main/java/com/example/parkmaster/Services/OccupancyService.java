package com.example.parkmaster.Services;

import com.example.parkmaster.DTOs.LotOccupancyDTO;
import com.example.parkmaster.DTOs.SpaceOccupancyDTO;
import com.example.parkmaster.Enum.ParkingLot.SpaceStatus;
import com.example.parkmaster.Exceptions.InconsistentStateException;
import com.example.parkmaster.Models.ParkingLot;
import com.example.parkmaster.Models.ReservationOccurrence;
import com.example.parkmaster.Models.Space;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Works out which spaces of a lot are taken at a given instant. Callers pass
 * only occurrences of reservations that are still active; this class does
 * nothing but interval containment.
 */
@Service
public class OccupancyService {

    private static final Logger logger = LoggerFactory.getLogger(OccupancyService.class);
    private static final DateTimeFormatter UNTIL_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final SpaceRegistryService spaceRegistryService;
    private final ZoneId parkingZone;

    @Autowired
    public OccupancyService(SpaceRegistryService spaceRegistryService, ZoneId parkingZone) {
        this.spaceRegistryService = spaceRegistryService;
        this.parkingZone = parkingZone;
    }

    /**
     * @param occupantNames display name for an occupant whose reservation carries no name of its own
     * @throws InconsistentStateException if the lot's spaces do not match its dimensions
     */
    public LotOccupancyDTO resolve(ParkingLot parkingLot,
                                   Collection<ReservationOccurrence> occurrences,
                                   OffsetDateTime at,
                                   Function<String, String> occupantNames) {
        Objects.requireNonNull(at, "Query instant is required");
        spaceRegistryService.verify(parkingLot);

        List<SpaceOccupancyDTO> spaces = new ArrayList<>(parkingLot.getSpaces().size());
        for (Space space : parkingLot.getSpaces()) {
            spaces.add(resolveSpace(parkingLot, space, occurrences, at, occupantNames));
        }

        int totalSpots = parkingLot.getRows() * parkingLot.getCols();
        int occupiedSpots = (int) spaces.stream()
                .filter(space -> space.getStatus() == SpaceStatus.OCCUPIED)
                .count();

        logger.debug("Resolved occupancy for parking lot {} at {}: {} of {} spots occupied",
                parkingLot.getId(), at, occupiedSpots, totalSpots);

        return LotOccupancyDTO.builder()
                .parkingLotId(parkingLot.getId())
                .name(parkingLot.getName())
                .at(at)
                .totalSpots(totalSpots)
                .occupiedSpots(occupiedSpots)
                .availableSpots(totalSpots - occupiedSpots)
                .spaces(spaces)
                .build();
    }

    /**
     * @throws InconsistentStateException if {@code spaceId} is not one of the lot's spaces
     */
    public SpaceOccupancyDTO resolveSpace(ParkingLot parkingLot,
                                          int spaceId,
                                          Collection<ReservationOccurrence> occurrences,
                                          OffsetDateTime at,
                                          Function<String, String> occupantNames) {
        Objects.requireNonNull(at, "Query instant is required");
        Space space = parkingLot.getSpaces().stream()
                .filter(candidate -> candidate.getId() != null && candidate.getId() == spaceId)
                .findFirst()
                .orElseThrow(() -> new InconsistentStateException("Space " + spaceId
                        + " is not registered in parking lot " + parkingLot.getId() + "."));
        return resolveSpace(parkingLot, space, occurrences, at, occupantNames);
    }

    private SpaceOccupancyDTO resolveSpace(ParkingLot parkingLot,
                                           Space space,
                                           Collection<ReservationOccurrence> occurrences,
                                           OffsetDateTime at,
                                           Function<String, String> occupantNames) {
        SpaceOccupancyDTO.SpaceOccupancyDTOBuilder result = SpaceOccupancyDTO.builder()
                .spaceId(space.getId())
                .row(space.getRow())
                .col(space.getCol())
                .type(space.getType());

        // Double bookings are not resolved here; the first match wins
        Optional<ReservationOccurrence> match = occurrences.stream()
                .filter(occurrence -> Objects.equals(occurrence.getParkingLotId(), parkingLot.getId()))
                .filter(occurrence -> Objects.equals(occurrence.getSpaceId(), space.getId()))
                .filter(occurrence -> occurrence.covers(at))
                .findFirst();

        if (match.isEmpty()) {
            return result.status(SpaceStatus.AVAILABLE).build();
        }

        ReservationOccurrence occurrence = match.get();
        return result.status(SpaceStatus.OCCUPIED)
                .occupiedBy(StringUtils.hasText(occurrence.getUserName())
                        ? occurrence.getUserName()
                        : occupantNames.apply(occurrence.getUserId()))
                .occupiedUntil(occurrence.getEndsAt().atZoneSameInstant(parkingZone).format(UNTIL_FORMAT))
                .occupiedUntilTime(occurrence.getEndsAt())
                .build();
    }
}
