package com.example.parkmaster.DTOs;

import com.example.parkmaster.Enum.ParkingLot.SpaceStatus;
import com.example.parkmaster.Enum.ParkingLot.SpaceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpaceOccupancyDTO {
    private Integer spaceId;
    private Integer row;
    private Integer col;
    private SpaceType type;
    private SpaceStatus status;
    private String occupiedBy;
    private String occupiedUntil; // HH:mm in the lot time zone
    private OffsetDateTime occupiedUntilTime;
}
