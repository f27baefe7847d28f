package com.example.parkmaster.DTOs;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rename and/or resize. Layout fields sent along (for instance a lot echoed
 * back from a GET) are ignored; a resize regenerates the spaces.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateParkingLotRequestDTO {

    @Size(min = 3, max = 100, message = "Lot name must be between 3 and 100 characters")
    private String name;

    @NotNull(message = "Rows cannot be null")
    @Min(value = 1, message = "Rows must be at least 1")
    private Integer rows;

    @NotNull(message = "Columns cannot be null")
    @Min(value = 1, message = "Columns must be at least 1")
    private Integer cols;
}
