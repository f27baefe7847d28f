package com.example.parkmaster.DTOs;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReservationOccurrenceDTO {
    private String userId;
    private String parkingLotId;
    private Integer spaceId;
    private OffsetDateTime startsAt;
    private OffsetDateTime endsAt;
}
