package com.example.parkmaster.Services;

import com.example.parkmaster.DTOs.LotLayoutDTO;
import com.example.parkmaster.DTOs.MergeRowsRequestDTO;
import com.example.parkmaster.DTOs.ParkingLotDTO;
import com.example.parkmaster.DTOs.UpdateParkingLotRequestDTO;
import com.example.parkmaster.Enum.ParkingLot.SpaceType;
import com.example.parkmaster.Exceptions.InvalidDataException;
import com.example.parkmaster.Exceptions.ResourceNotFoundException;
import com.example.parkmaster.Mappers.ParkingLotMapper;
import com.example.parkmaster.Models.ParkingLot;
import com.example.parkmaster.Repositories.ParkingLotRepository;
import com.example.parkmaster.Repositories.ReservationRepository;
import com.example.parkmaster.Utils.LotGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

@Service
public class ParkingLotService {

    private static final Logger logger = LoggerFactory.getLogger(ParkingLotService.class);

    private final ParkingLotRepository parkingLotRepository;
    private final ReservationRepository reservationRepository;
    private final SpaceRegistryService spaceRegistryService;
    private final ParkingLotMapper parkingLotMapper;

    @Autowired
    public ParkingLotService(
            ParkingLotRepository parkingLotRepository,
            ReservationRepository reservationRepository,
            SpaceRegistryService spaceRegistryService,
            ParkingLotMapper parkingLotMapper) {
        this.parkingLotRepository = parkingLotRepository;
        this.reservationRepository = reservationRepository;
        this.spaceRegistryService = spaceRegistryService;
        this.parkingLotMapper = parkingLotMapper;
    }

    @Transactional
    public ParkingLot createParkingLot(ParkingLotDTO dto) {
        validateDimensions(dto.getRows(), dto.getCols());
        Set<Integer> mergedAisles = dto.getMergedAisles() != null ? new HashSet<>(dto.getMergedAisles()) : new HashSet<>();
        LotGeometry.validateMergedAisles(mergedAisles, dto.getRows());

        ParkingLot parkingLot = new ParkingLot();
        parkingLot.setName(dto.getName());
        parkingLot.setRows(dto.getRows());
        parkingLot.setCols(dto.getCols());
        parkingLot.setSpaces(spaceRegistryService.regenerate(
                parkingLotMapper.toSpaceTemplates(dto.getSpaces()), dto.getRows(), dto.getCols()));
        parkingLot.setMergedAisles(mergedAisles);

        ParkingLot savedParkingLot = parkingLotRepository.save(parkingLot);
        logger.info("Created parking lot {} ({}) with {}x{} spaces and {} merged aisles",
                savedParkingLot.getId(), savedParkingLot.getName(), dto.getRows(), dto.getCols(), mergedAisles.size());
        return savedParkingLot;
    }

    /**
     * Renames and/or resizes a lot. A resize regenerates the spaces, keeping the
     * type of every position that still exists, and forgets merged aisles that
     * no longer sit between two rows.
     */
    @Transactional
    public ParkingLot updateParkingLot(String parkingLotId, UpdateParkingLotRequestDTO dto) {
        ParkingLot parkingLot = getParkingLotById(parkingLotId);
        validateDimensions(dto.getRows(), dto.getCols());

        if (dto.getName() != null) {
            parkingLot.setName(dto.getName());
        }

        boolean resized = !Objects.equals(parkingLot.getRows(), dto.getRows())
                || !Objects.equals(parkingLot.getCols(), dto.getCols());
        if (resized) {
            logger.info("Resizing parking lot {} from {}x{} to {}x{}",
                    parkingLotId, parkingLot.getRows(), parkingLot.getCols(), dto.getRows(), dto.getCols());
            parkingLot.setSpaces(spaceRegistryService.regenerate(parkingLot.getSpaces(), dto.getRows(), dto.getCols()));
            parkingLot.setRows(dto.getRows());
            parkingLot.setCols(dto.getCols());

            Set<Integer> retained = LotGeometry.retainExistingAisles(parkingLot.getMergedAisles(), dto.getRows());
            if (retained.size() != parkingLot.getMergedAisles().size()) {
                logger.info("Removed {} merged aisles that no longer exist in parking lot {}",
                        parkingLot.getMergedAisles().size() - retained.size(), parkingLotId);
            }
            parkingLot.setMergedAisles(new HashSet<>(retained));
        }

        return parkingLotRepository.save(parkingLot);
    }

    @Transactional
    public ParkingLot mergeRows(String parkingLotId, MergeRowsRequestDTO request) {
        ParkingLot parkingLot = getParkingLotById(parkingLotId);

        // Fails before anything on the lot is touched
        Set<Integer> merged = LotGeometry.mergeRows(
                parkingLot.getMergedAisles(), request.getRow1(), request.getRow2(), parkingLot.getRows());

        parkingLot.setMergedAisles(new HashSet<>(merged));
        logger.info("Merged rows {} and {} of parking lot {}. Merged aisles: {}",
                request.getRow1(), request.getRow2(), parkingLotId, merged);
        return parkingLotRepository.save(parkingLot);
    }

    @Transactional
    public ParkingLot resetMerges(String parkingLotId) {
        ParkingLot parkingLot = getParkingLotById(parkingLotId);
        parkingLot.setMergedAisles(new HashSet<>());
        logger.info("Reset all row merges of parking lot {}", parkingLotId);
        return parkingLotRepository.save(parkingLot);
    }

    @Transactional
    public ParkingLot updateSpaceType(String parkingLotId, int spaceId, SpaceType type) {
        ParkingLot parkingLot = getParkingLotById(parkingLotId);
        parkingLot.setSpaces(spaceRegistryService.updateSpaceType(parkingLot.getSpaces(), spaceId, type));
        logger.info("Space {} of parking lot {} is now {}", spaceId, parkingLotId, type.getValue());
        return parkingLotRepository.save(parkingLot);
    }

    @Transactional
    public void deleteParkingLot(String parkingLotId) {
        ParkingLot parkingLot = getParkingLotById(parkingLotId);
        int deletedReservations = reservationRepository.deleteByParkingLotId(parkingLotId);
        parkingLotRepository.delete(parkingLot);
        logger.info("Deleted parking lot {} and {} of its reservations", parkingLotId, deletedReservations);
    }

    @Transactional(readOnly = true)
    public ParkingLot getParkingLotById(String id) {
        return parkingLotRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Parking lot not found with ID: " + id));
    }

    @Transactional(readOnly = true)
    public Page<ParkingLot> getAllParkingLots(String name, Pageable pageable) {
        if (name != null && !name.isBlank()) {
            return parkingLotRepository.findByNameContainingIgnoreCase(name.trim(), pageable);
        }
        return parkingLotRepository.findAll(pageable);
    }

    @Transactional(readOnly = true)
    public LotLayoutDTO getLayout(String parkingLotId) {
        ParkingLot parkingLot = getParkingLotById(parkingLotId);
        spaceRegistryService.verify(parkingLot);
        return parkingLotMapper.toLayoutDTO(parkingLot);
    }

    private void validateDimensions(Integer rows, Integer cols) {
        if (rows == null || cols == null) {
            throw new InvalidDataException("Rows and columns are required.");
        }
        if (rows < 1 || cols < 1) {
            throw new InvalidDataException("Rows and columns must be at least 1.");
        }
    }
}
