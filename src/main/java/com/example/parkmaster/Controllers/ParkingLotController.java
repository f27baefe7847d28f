package com.example.parkmaster.Controllers;

import com.example.parkmaster.DTOs.ApiResponse;
import com.example.parkmaster.DTOs.LotLayoutDTO;
import com.example.parkmaster.DTOs.MergeRowsRequestDTO;
import com.example.parkmaster.DTOs.ParkingLotDTO;
import com.example.parkmaster.DTOs.UpdateParkingLotRequestDTO;
import com.example.parkmaster.DTOs.UpdateSpaceTypeRequestDTO;
import com.example.parkmaster.Mappers.ParkingLotMapper;
import com.example.parkmaster.Models.ParkingLot;
import com.example.parkmaster.Services.ParkingLotService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/parking-lots")
public class ParkingLotController {

    private static final Logger logger = LoggerFactory.getLogger(ParkingLotController.class);

    private final ParkingLotService parkingLotService;
    private final ParkingLotMapper parkingLotMapper;

    @Autowired
    public ParkingLotController(ParkingLotService parkingLotService, ParkingLotMapper parkingLotMapper) {
        this.parkingLotService = parkingLotService;
        this.parkingLotMapper = parkingLotMapper;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ParkingLotDTO>> createParkingLot(@Valid @RequestBody ParkingLotDTO parkingLotDTO) {
        logger.info("Request received to create parking lot '{}' ({}x{})",
                parkingLotDTO.getName(), parkingLotDTO.getRows(), parkingLotDTO.getCols());
        ParkingLot parkingLot = parkingLotService.createParkingLot(parkingLotDTO);
        ApiResponse<ParkingLotDTO> response = new ApiResponse<>(
                true,
                HttpStatus.CREATED.value(),
                "Parking lot created successfully",
                parkingLotMapper.toDTO(parkingLot)
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> getAllParkingLots(
            @RequestParam(required = false) String name,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size,
            @RequestParam(defaultValue = "name") String sortBy,
            @RequestParam(defaultValue = "asc") String direction) {

        Sort.Direction sortDirection = direction.equalsIgnoreCase("desc") ? Sort.Direction.DESC : Sort.Direction.ASC;
        Pageable pageable = PageRequest.of(page, size, Sort.by(sortDirection, sortBy));
        Page<ParkingLot> parkingLots = parkingLotService.getAllParkingLots(name, pageable);

        List<ParkingLotDTO> parkingLotDTOs = parkingLots.getContent().stream()
                .map(parkingLotMapper::toDTO)
                .collect(Collectors.toList());

        Map<String, Object> responseData = new HashMap<>();
        responseData.put("parkingLots", parkingLotDTOs);
        responseData.put("currentPage", parkingLots.getNumber());
        responseData.put("totalItems", parkingLots.getTotalElements());
        responseData.put("totalPages", parkingLots.getTotalPages());

        ApiResponse<Map<String, Object>> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Parking lots retrieved successfully",
                responseData
        );
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ParkingLotDTO>> getParkingLotById(@PathVariable String id) {
        ParkingLot parkingLot = parkingLotService.getParkingLotById(id);
        ApiResponse<ParkingLotDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Parking lot retrieved successfully",
                parkingLotMapper.toDTO(parkingLot)
        );
        return ResponseEntity.ok(response);
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ParkingLotDTO>> updateParkingLot(
            @PathVariable String id,
            @Valid @RequestBody UpdateParkingLotRequestDTO request) {
        logger.info("Request received to update parking lot {}", id);
        ParkingLot parkingLot = parkingLotService.updateParkingLot(id, request);
        ApiResponse<ParkingLotDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Parking lot updated successfully",
                parkingLotMapper.toDTO(parkingLot)
        );
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteParkingLot(@PathVariable String id) {
        logger.info("Request received to delete parking lot {}", id);
        parkingLotService.deleteParkingLot(id);
        ApiResponse<Void> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Parking lot deleted successfully",
                (Void) null
        );
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}/layout")
    public ResponseEntity<ApiResponse<LotLayoutDTO>> getLayout(@PathVariable String id) {
        ApiResponse<LotLayoutDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Parking lot layout retrieved successfully",
                parkingLotService.getLayout(id)
        );
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{id}/merge-rows")
    public ResponseEntity<ApiResponse<ParkingLotDTO>> mergeRows(
            @PathVariable String id,
            @Valid @RequestBody MergeRowsRequestDTO request) {
        logger.info("Request received to merge rows {} and {} of parking lot {}", request.getRow1(), request.getRow2(), id);
        ParkingLot parkingLot = parkingLotService.mergeRows(id, request);
        ApiResponse<ParkingLotDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Successfully merged rows " + request.getRow1().trim() + " and " + request.getRow2().trim() + "!",
                parkingLotMapper.toDTO(parkingLot)
        );
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{id}/merged-aisles")
    public ResponseEntity<ApiResponse<ParkingLotDTO>> resetMerges(@PathVariable String id) {
        logger.info("Request received to reset row merges of parking lot {}", id);
        ParkingLot parkingLot = parkingLotService.resetMerges(id);
        ApiResponse<ParkingLotDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "All row merges have been reset.",
                parkingLotMapper.toDTO(parkingLot)
        );
        return ResponseEntity.ok(response);
    }

    @PatchMapping("/{id}/spaces/{spaceId}")
    public ResponseEntity<ApiResponse<ParkingLotDTO>> updateSpaceType(
            @PathVariable String id,
            @PathVariable int spaceId,
            @Valid @RequestBody UpdateSpaceTypeRequestDTO request) {
        ParkingLot parkingLot = parkingLotService.updateSpaceType(id, spaceId, request.getType());
        ApiResponse<ParkingLotDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Space type updated successfully",
                parkingLotMapper.toDTO(parkingLot)
        );
        return ResponseEntity.ok(response);
    }
}
