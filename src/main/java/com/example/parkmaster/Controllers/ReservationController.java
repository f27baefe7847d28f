package com.example.parkmaster.Controllers;

import com.example.parkmaster.DTOs.ApiResponse;
import com.example.parkmaster.DTOs.ReservationDTO;
import com.example.parkmaster.DTOs.ReservationOccurrenceDTO;
import com.example.parkmaster.DTOs.ReservationRequestDTO;
import com.example.parkmaster.Enum.Reservation.ReservationStatus;
import com.example.parkmaster.Services.ReservationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/reservations")
public class ReservationController {

    private static final Logger logger = LoggerFactory.getLogger(ReservationController.class);

    private final ReservationService reservationService;

    @Autowired
    public ReservationController(ReservationService reservationService) {
        this.reservationService = reservationService;
    }

    @PostMapping("/preview")
    public ResponseEntity<ApiResponse<List<ReservationOccurrenceDTO>>> previewReservation(
            @RequestBody ReservationRequestDTO request) {
        List<ReservationOccurrenceDTO> occurrences = reservationService.previewOccurrences(request);
        ApiResponse<List<ReservationOccurrenceDTO>> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                occurrences.size() + " occurrence(s) generated",
                occurrences
        );
        return ResponseEntity.ok(response);
    }

    @PostMapping
    public ResponseEntity<ApiResponse<List<ReservationDTO>>> createReservation(
            @RequestBody ReservationRequestDTO request) {
        logger.info("Request received to reserve space {} of parking lot {} for user {}",
                request.getSpaceId(), request.getParkingLotId(), request.getUserId());
        List<ReservationDTO> reservations = reservationService.createReservations(request);
        ApiResponse<List<ReservationDTO>> response = new ApiResponse<>(
                true,
                HttpStatus.CREATED.value(),
                "Reservation created successfully",
                reservations
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ReservationDTO>> getReservationById(@PathVariable String id) {
        ApiResponse<ReservationDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Reservation retrieved successfully",
                reservationService.getReservationById(id)
        );
        return ResponseEntity.ok(response);
    }

    @GetMapping("/parking-lot/{parkingLotId}")
    public ResponseEntity<ApiResponse<List<ReservationDTO>>> getReservationsForParkingLot(
            @PathVariable String parkingLotId,
            @RequestParam(required = false) ReservationStatus status) {
        List<ReservationDTO> reservations = reservationService.getReservationsForParkingLot(parkingLotId, status);
        ApiResponse<List<ReservationDTO>> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Reservations retrieved successfully",
                reservations
        );
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<ReservationDTO>> cancelReservation(@PathVariable String id) {
        logger.info("Request received to cancel reservation {}", id);
        ApiResponse<ReservationDTO> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Reservation cancelled successfully",
                reservationService.cancelReservation(id)
        );
        return ResponseEntity.ok(response);
    }

    @PostMapping("/series/{seriesId}/cancel")
    public ResponseEntity<ApiResponse<List<ReservationDTO>>> cancelSeries(@PathVariable String seriesId) {
        logger.info("Request received to cancel reservation series {}", seriesId);
        ApiResponse<List<ReservationDTO>> response = new ApiResponse<>(
                true,
                HttpStatus.OK.value(),
                "Reservation series cancelled successfully",
                reservationService.cancelSeries(seriesId)
        );
        return ResponseEntity.ok(response);
    }
}
