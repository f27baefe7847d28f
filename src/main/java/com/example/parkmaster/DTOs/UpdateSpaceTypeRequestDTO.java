package com.example.parkmaster.DTOs;

import com.example.parkmaster.Enum.ParkingLot.SpaceType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSpaceTypeRequestDTO {

    @NotNull(message = "Space type cannot be null")
    private SpaceType type;
}
