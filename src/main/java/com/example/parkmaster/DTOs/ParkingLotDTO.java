package com.example.parkmaster.DTOs;

import com.example.parkmaster.Validators.ParkingLotConstraint;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@ParkingLotConstraint
public class ParkingLotDTO {

    private String id;

    @NotBlank(message = "Lot name cannot be blank")
    @Size(min = 3, max = 100, message = "Lot name must be between 3 and 100 characters")
    private String name;

    @NotNull(message = "Rows cannot be null")
    @Min(value = 1, message = "Rows must be at least 1")
    private Integer rows;

    @NotNull(message = "Columns cannot be null")
    @Min(value = 1, message = "Columns must be at least 1")
    private Integer cols;

    // On input only the type of each (row, col) is used; ids are regenerated
    @Valid
    private List<SpaceDTO> spaces = new ArrayList<>();

    private List<Integer> mergedAisles = new ArrayList<>();

    private Integer totalSpots;

    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
