package com.example.parkmaster.DTOs;

import com.example.parkmaster.Enum.ParkingLot.SpaceType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpaceDTO {
    private Integer id;
    private Integer row;
    private Integer col;
    private SpaceType type;
}
