package com.example.parkmaster.DTOs;

import com.example.parkmaster.Enum.ParkingLot.SpaceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotLayoutDTO {
    private String parkingLotId;
    private String name;
    private int rows;
    private int cols;
    private double width;
    private double height;
    private List<Double> rowPositions;
    private List<Integer> mergedAisles;
    private List<SpacePositionDTO> spaces;
    private Map<SpaceType, Long> spaceTypeCounts;
}
