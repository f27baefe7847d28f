package com.example.parkmaster.Mappers;

import com.example.parkmaster.DTOs.ReservationDTO;
import com.example.parkmaster.DTOs.ReservationOccurrenceDTO;
import com.example.parkmaster.Models.Reservation;
import com.example.parkmaster.Models.ReservationOccurrence;
import org.springframework.stereotype.Service;

@Service
public class ReservationMapper {

    public ReservationDTO toDTO(Reservation reservation) {
        if (reservation == null) {
            return null;
        }

        ReservationDTO dto = new ReservationDTO();
        dto.setId(reservation.getId());
        if (reservation.getParkingLot() != null) {
            dto.setParkingLotId(reservation.getParkingLot().getId());
        }
        dto.setUserId(reservation.getUserId());
        dto.setUserName(reservation.getUserName());
        dto.setSpaceId(reservation.getSpaceId());
        dto.setStartTime(reservation.getStartTime());
        dto.setEndTime(reservation.getEndTime());
        dto.setStatus(reservation.getStatus());
        dto.setSeriesId(reservation.getSeriesId());
        dto.setRepeatPattern(reservation.getRepeatPattern());
        dto.setCreatedAt(reservation.getCreatedAt());
        dto.setUpdatedAt(reservation.getUpdatedAt());

        return dto;
    }

    public ReservationOccurrenceDTO toDTO(ReservationOccurrence occurrence) {
        if (occurrence == null) {
            return null;
        }
        return new ReservationOccurrenceDTO(
                occurrence.getUserId(),
                occurrence.getParkingLotId(),
                occurrence.getSpaceId(),
                occurrence.getStartsAt(),
                occurrence.getEndsAt());
    }

    /**
     * The stored reservation seen as an occurrence, for the occupancy resolver.
     */
    public ReservationOccurrence toOccurrence(Reservation reservation) {
        return ReservationOccurrence.builder()
                .userId(reservation.getUserId())
                .userName(reservation.getUserName())
                .parkingLotId(reservation.getParkingLot().getId())
                .spaceId(reservation.getSpaceId())
                .startsAt(reservation.getStartTime())
                .endsAt(reservation.getEndTime())
                .build();
    }
}
