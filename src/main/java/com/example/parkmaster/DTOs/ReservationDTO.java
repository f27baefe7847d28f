package com.example.parkmaster.DTOs;

import com.example.parkmaster.Enum.Reservation.RepeatPattern;
import com.example.parkmaster.Enum.Reservation.ReservationStatus;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class ReservationDTO {
    private String id;
    private String parkingLotId;
    private String userId;
    private String userName;
    private Integer spaceId;
    private OffsetDateTime startTime;
    private OffsetDateTime endTime;
    private ReservationStatus status;
    private String seriesId;
    private RepeatPattern repeatPattern;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
