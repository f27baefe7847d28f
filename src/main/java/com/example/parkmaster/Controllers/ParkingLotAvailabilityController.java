package com.example.parkmaster.Controllers;

import com.example.parkmaster.DTOs.ApiResponse;
import com.example.parkmaster.DTOs.LotOccupancyDTO;
import com.example.parkmaster.DTOs.OccupancyDashboardDTO;
import com.example.parkmaster.DTOs.SpaceOccupancyDTO;
import com.example.parkmaster.Services.AvailabilityService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;

@RestController
@RequestMapping("/api/availability")
public class ParkingLotAvailabilityController {

    private final AvailabilityService availabilityService;

    @Autowired
    public ParkingLotAvailabilityController(AvailabilityService availabilityService) {
        this.availabilityService = availabilityService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<OccupancyDashboardDTO>> getOccupancySummary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime at) {
        ApiResponse<OccupancyDashboardDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Occupancy summary retrieved successfully",
                availabilityService.getOccupancySummary(at)
        );
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{parkingLotId}")
    public ResponseEntity<ApiResponse<LotOccupancyDTO>> getLotOccupancy(
            @PathVariable String parkingLotId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime at) {
        ApiResponse<LotOccupancyDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Parking lot occupancy retrieved successfully",
                availabilityService.getLotOccupancy(parkingLotId, at)
        );
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{parkingLotId}/spaces/{spaceId}")
    public ResponseEntity<ApiResponse<SpaceOccupancyDTO>> getSpaceOccupancy(
            @PathVariable String parkingLotId,
            @PathVariable int spaceId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime at) {
        ApiResponse<SpaceOccupancyDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Space occupancy retrieved successfully",
                availabilityService.getSpaceOccupancy(parkingLotId, spaceId, at)
        );
        return ResponseEntity.ok(response);
    }
}
