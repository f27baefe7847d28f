package com.example.parkmaster.Validators;

import com.example.parkmaster.DTOs.ParkingLotDTO;
import com.example.parkmaster.DTOs.SpaceDTO;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cross-field checks of a submitted layout. Per-field constraints (blank name,
 * rows/cols below 1) are left to the field annotations.
 */
public class ParkingLotValidator implements ConstraintValidator<ParkingLotConstraint, ParkingLotDTO> {

    @Override
    public boolean isValid(ParkingLotDTO parkingLot, ConstraintValidatorContext context) {
        if (parkingLot == null || parkingLot.getRows() == null || parkingLot.getCols() == null
                || parkingLot.getRows() < 1 || parkingLot.getCols() < 1) {
            return true;
        }

        List<String> validationErrors = new ArrayList<>();
        context.disableDefaultConstraintViolation();

        int rows = parkingLot.getRows();
        int cols = parkingLot.getCols();

        // 1. Merged aisles must sit between two existing rows
        if (parkingLot.getMergedAisles() != null) {
            for (Integer aisle : parkingLot.getMergedAisles()) {
                if (aisle == null || aisle < 0 || aisle >= rows - 1) {
                    validationErrors.add("Merged aisle " + aisle + " does not exist; aisle indices must be between 0 and "
                            + (rows - 2));
                }
            }
        }

        // 2. Space types are matched by position, so each position may appear once
        if (parkingLot.getSpaces() != null) {
            Set<String> seenPositions = new HashSet<>();
            for (SpaceDTO space : parkingLot.getSpaces()) {
                if (space.getRow() == null || space.getCol() == null) {
                    validationErrors.add("Space row and column are required");
                    continue;
                }
                if (space.getRow() < 0 || space.getRow() >= rows || space.getCol() < 0 || space.getCol() >= cols) {
                    validationErrors.add("Space at row " + space.getRow() + ", column " + space.getCol()
                            + " is outside the " + rows + "x" + cols + " lot");
                }
                if (!seenPositions.add(space.getRow() + ":" + space.getCol())) {
                    validationErrors.add("Duplicate space at row " + space.getRow() + ", column " + space.getCol());
                }
            }
        }

        for (String errorMessage : validationErrors) {
            context.buildConstraintViolationWithTemplate(errorMessage)
                    .addConstraintViolation();
        }

        return validationErrors.isEmpty();
    }
}
