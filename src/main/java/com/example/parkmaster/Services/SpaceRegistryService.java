package com.example.parkmaster.Services;

import com.example.parkmaster.Enum.ParkingLot.SpaceType;
import com.example.parkmaster.Exceptions.InconsistentStateException;
import com.example.parkmaster.Exceptions.InvalidDataException;
import com.example.parkmaster.Exceptions.ResourceNotFoundException;
import com.example.parkmaster.Models.ParkingLot;
import com.example.parkmaster.Models.Space;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps a lot's space list in step with its dimensions. Space types are keyed
 * by grid position; ids are handed out only when the grid is written back as
 * an ordered list, so they always follow row-major order starting at 1.
 */
@Service
public class SpaceRegistryService {

    private static final Logger logger = LoggerFactory.getLogger(SpaceRegistryService.class);

    @Value
    private static class Cell {
        int row;
        int col;
    }

    public List<Space> generate(int rows, int cols) {
        return regenerate(List.of(), rows, cols);
    }

    /**
     * Rebuilds the space list for a {@code rows x cols} lot. Positions that
     * existed in {@code previous} keep their type, new positions are regular and
     * positions outside the new bounds are dropped.
     */
    public List<Space> regenerate(List<Space> previous, int rows, int cols) {
        if (rows < 1 || cols < 1) {
            throw new InvalidDataException("A parking lot needs at least one row and one column.");
        }

        Map<Cell, SpaceType> typesByCell = new HashMap<>();
        if (previous != null) {
            for (Space space : previous) {
                if (space.getRow() != null && space.getCol() != null && space.getType() != null) {
                    typesByCell.put(new Cell(space.getRow(), space.getCol()), space.getType());
                }
            }
        }

        List<Space> spaces = new ArrayList<>(rows * cols);
        int id = 1;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                SpaceType type = typesByCell.getOrDefault(new Cell(r, c), SpaceType.REGULAR);
                spaces.add(new Space(id++, r, c, type));
            }
        }

        int dropped = (int) typesByCell.keySet().stream()
                .filter(cell -> cell.getRow() >= rows || cell.getCol() >= cols)
                .count();
        if (dropped > 0) {
            logger.info("Dropped {} spaces outside the new {}x{} bounds", dropped, rows, cols);
        }
        return spaces;
    }

    /**
     * Returns a copy of {@code spaces} with the type of {@code spaceId} replaced.
     */
    public List<Space> updateSpaceType(List<Space> spaces, int spaceId, SpaceType type) {
        if (type == null) {
            throw new InvalidDataException("Space type cannot be null.");
        }
        boolean found = false;
        List<Space> updated = new ArrayList<>(spaces.size());
        for (Space space : spaces) {
            if (space.getId() != null && space.getId() == spaceId) {
                updated.add(new Space(space.getId(), space.getRow(), space.getCol(), type));
                found = true;
            } else {
                updated.add(space);
            }
        }
        if (!found) {
            throw new ResourceNotFoundException("Space not found with ID: " + spaceId);
        }
        return updated;
    }

    /**
     * @throws InconsistentStateException if the spaces do not cover the lot's grid exactly once
     */
    public void verify(ParkingLot parkingLot) {
        int rows = parkingLot.getRows();
        int cols = parkingLot.getCols();
        List<Space> spaces = parkingLot.getSpaces() != null ? parkingLot.getSpaces() : List.of();

        if (spaces.size() != rows * cols) {
            throw new InconsistentStateException("Parking lot " + parkingLot.getId() + " has " + spaces.size()
                    + " spaces but its " + rows + "x" + cols + " grid needs " + (rows * cols) + ".");
        }

        Set<Cell> seen = new HashSet<>();
        for (Space space : spaces) {
            Cell cell = new Cell(space.getRow(), space.getCol());
            if (space.getRow() < 0 || space.getRow() >= rows || space.getCol() < 0 || space.getCol() >= cols
                    || !seen.add(cell)) {
                throw new InconsistentStateException("Parking lot " + parkingLot.getId()
                        + " has a missing or duplicate space at row " + space.getRow() + ", column " + space.getCol() + ".");
            }
        }
    }
}
