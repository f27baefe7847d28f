package com.example.parkmaster.DTOs;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OccupancyDashboardDTO {
    private OffsetDateTime at;
    private int totalSpots;
    private int occupiedSpots;
    private int availableSpots;
    private List<LotOccupancySummaryDTO> lots;
}
