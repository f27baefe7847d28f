package com.example.parkmaster.Services;

import com.example.parkmaster.DTOs.LotOccupancyDTO;
import com.example.parkmaster.DTOs.SpaceOccupancyDTO;
import com.example.parkmaster.Enum.ParkingLot.SpaceStatus;
import com.example.parkmaster.Exceptions.InconsistentStateException;
import com.example.parkmaster.Models.ParkingLot;
import com.example.parkmaster.Models.ReservationOccurrence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OccupancyServiceTest {

    private static final Function<String, String> NAMES = userId -> "u-1".equals(userId) ? "Alice" : "User " + userId;

    private final SpaceRegistryService spaceRegistryService = new SpaceRegistryService();
    private final OccupancyService occupancyService = new OccupancyService(spaceRegistryService, ZoneId.of("UTC"));

    private ParkingLot parkingLot;
    private List<ReservationOccurrence> occurrences;

    @BeforeEach
    void setUp() {
        parkingLot = new ParkingLot();
        parkingLot.setId("lot-1");
        parkingLot.setName("North Garage");
        parkingLot.setRows(2);
        parkingLot.setCols(2);
        parkingLot.setSpaces(spaceRegistryService.generate(2, 2));

        occurrences = List.of(occurrence("lot-1", 1, "u-1"));
    }

    @Test
    void resolve_duringReservation_marksSpaceOccupied() {
        LotOccupancyDTO occupancy = occupancyService.resolve(parkingLot, occurrences, at(12, 0), NAMES);

        SpaceOccupancyDTO space = occupancy.getSpaces().get(0);
        assertThat(space.getStatus()).isEqualTo(SpaceStatus.OCCUPIED);
        assertThat(space.getOccupiedBy()).isEqualTo("Alice");
        assertThat(space.getOccupiedUntil()).isEqualTo("17:00");
        assertThat(occupancy.getTotalSpots()).isEqualTo(4);
        assertThat(occupancy.getOccupiedSpots()).isEqualTo(1);
        assertThat(occupancy.getAvailableSpots()).isEqualTo(3);
    }

    @Test
    void resolve_atEndInstant_isStillOccupied() {
        LotOccupancyDTO occupancy = occupancyService.resolve(parkingLot, occurrences, at(17, 0), NAMES);

        assertThat(occupancy.getSpaces().get(0).getStatus()).isEqualTo(SpaceStatus.OCCUPIED);
    }

    @Test
    void resolve_atStartInstant_isOccupied() {
        LotOccupancyDTO occupancy = occupancyService.resolve(parkingLot, occurrences, at(9, 0), NAMES);

        assertThat(occupancy.getOccupiedSpots()).isEqualTo(1);
    }

    @Test
    void resolve_afterReservation_isAvailable() {
        LotOccupancyDTO occupancy = occupancyService.resolve(parkingLot, occurrences, at(18, 0), NAMES);

        SpaceOccupancyDTO space = occupancy.getSpaces().get(0);
        assertThat(space.getStatus()).isEqualTo(SpaceStatus.AVAILABLE);
        assertThat(space.getOccupiedBy()).isNull();
        assertThat(space.getOccupiedUntil()).isNull();
        assertThat(occupancy.getOccupiedSpots()).isZero();
    }

    @Test
    void resolve_ignoresOccurrencesOfOtherLots() {
        List<ReservationOccurrence> mixed = List.of(occurrence("lot-2", 1, "u-2"), occurrence("lot-1", 4, "u-3"));

        LotOccupancyDTO occupancy = occupancyService.resolve(parkingLot, mixed, at(12, 0), NAMES);

        assertThat(occupancy.getOccupiedSpots()).isEqualTo(1);
        assertThat(occupancy.getSpaces().get(0).getStatus()).isEqualTo(SpaceStatus.AVAILABLE);
        assertThat(occupancy.getSpaces().get(3).getOccupiedBy()).isEqualTo("User u-3");
    }

    @Test
    void resolve_occupiedPlusAvailableEqualsTotal() {
        List<ReservationOccurrence> all = List.of(
                occurrence("lot-1", 1, "u-1"),
                occurrence("lot-1", 2, "u-2"),
                occurrence("lot-1", 2, "u-3"));

        LotOccupancyDTO occupancy = occupancyService.resolve(parkingLot, all, at(10, 30), NAMES);

        assertThat(occupancy.getOccupiedSpots()).isEqualTo(2);
        assertThat(occupancy.getOccupiedSpots() + occupancy.getAvailableSpots()).isEqualTo(occupancy.getTotalSpots());
        assertThat(occupancy.getSpaces().get(1).getOccupiedBy()).isEqualTo("User u-2");
    }

    @Test
    void resolve_spacesOutOfStepWithDimensions_throws() {
        parkingLot.setRows(3);

        assertThatThrownBy(() -> occupancyService.resolve(parkingLot, occurrences, at(12, 0), NAMES))
                .isInstanceOf(InconsistentStateException.class);
    }

    @Test
    void resolveSpace_knownSpace_returnsItsStatus() {
        SpaceOccupancyDTO space = occupancyService.resolveSpace(parkingLot, 1, occurrences, at(12, 0), NAMES);

        assertThat(space.getSpaceId()).isEqualTo(1);
        assertThat(space.getStatus()).isEqualTo(SpaceStatus.OCCUPIED);
        assertThat(space.getOccupiedUntilTime()).isEqualTo(at(17, 0));
    }

    @Test
    void resolveSpace_unknownSpace_throws() {
        assertThatThrownBy(() -> occupancyService.resolveSpace(parkingLot, 99, occurrences, at(12, 0), NAMES))
                .isInstanceOf(InconsistentStateException.class)
                .hasMessageContaining("99");
    }

    @Test
    void resolve_noOccurrences_allAvailable() {
        LotOccupancyDTO occupancy = occupancyService.resolve(parkingLot, new ArrayList<>(), at(12, 0), NAMES);

        assertThat(occupancy.getSpaces()).allMatch(space -> space.getStatus() == SpaceStatus.AVAILABLE);
        assertThat(occupancy.getAvailableSpots()).isEqualTo(4);
    }

    @Test
    void resolve_doubleBooking_firstListedOccurrenceWins() {
        ReservationOccurrence first = occurrence("lot-1", 1, "u-1");
        ReservationOccurrence second = ReservationOccurrence.builder()
                .userId("u-2")
                .parkingLotId("lot-1")
                .spaceId(1)
                .startsAt(at(8, 0))
                .endsAt(at(18, 0))
                .build();

        LotOccupancyDTO occupancy = occupancyService.resolve(parkingLot, List.of(first, second), at(12, 0), NAMES);

        SpaceOccupancyDTO space = occupancy.getSpaces().get(0);
        assertThat(space.getOccupiedBy()).isEqualTo("Alice");
        assertThat(space.getOccupiedUntil()).isEqualTo("17:00");
        assertThat(occupancy.getOccupiedSpots()).isEqualTo(1);

        SpaceOccupancyDTO reversed = occupancyService
                .resolve(parkingLot, List.of(second, first), at(12, 0), NAMES).getSpaces().get(0);
        assertThat(reversed.getOccupiedBy()).isEqualTo("User u-2");
        assertThat(reversed.getOccupiedUntil()).isEqualTo("18:00");
    }

    @Test
    void resolve_occurrenceWithOwnName_prefersItOverFallback() {
        ReservationOccurrence named = ReservationOccurrence.builder()
                .userId("u-1")
                .userName("Alice Smith")
                .parkingLotId("lot-1")
                .spaceId(1)
                .startsAt(at(9, 0))
                .endsAt(at(17, 0))
                .build();

        SpaceOccupancyDTO space = occupancyService
                .resolve(parkingLot, List.of(named), at(12, 0), NAMES).getSpaces().get(0);

        assertThat(space.getOccupiedBy()).isEqualTo("Alice Smith");
    }

    private static OffsetDateTime at(int hour, int minute) {
        return OffsetDateTime.of(2025, 10, 20, hour, minute, 0, 0, ZoneOffset.UTC);
    }

    private static ReservationOccurrence occurrence(String parkingLotId, int spaceId, String userId) {
        return ReservationOccurrence.builder()
                .userId(userId)
                .parkingLotId(parkingLotId)
                .spaceId(spaceId)
                .startsAt(at(9, 0))
                .endsAt(at(17, 0))
                .build();
    }
}
