package com.example.parkmaster.DTOs;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotOccupancySummaryDTO {
    private String parkingLotId;
    private String name;
    private int totalSpots;
    private int occupiedSpots;
    private int availableSpots;
    private double occupancyRate;
}
