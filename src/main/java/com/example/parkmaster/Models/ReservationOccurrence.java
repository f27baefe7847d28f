package com.example.parkmaster.Models;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * One concrete, time-bounded instance of a (possibly recurring) reservation.
 */
@Value
@Builder
public class ReservationOccurrence {
    String userId;
    String userName;
    String parkingLotId;
    Integer spaceId;
    OffsetDateTime startsAt;
    OffsetDateTime endsAt;

    /** Both bounds inclusive. */
    public boolean covers(OffsetDateTime instant) {
        return !instant.isBefore(startsAt) && !instant.isAfter(endsAt);
    }

    public boolean overlaps(OffsetDateTime otherStart, OffsetDateTime otherEnd) {
        return !otherStart.isAfter(endsAt) && !otherEnd.isBefore(startsAt);
    }
}
