package com.example.parkmaster.DTOs;

import com.example.parkmaster.Enum.ParkingLot.SpaceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpacePositionDTO {
    private Integer id;
    private Integer row;
    private Integer col;
    private SpaceType type;
    private double x;
    private double y;
    private double width;
    private double depth;
}
