package com.example.parkmaster.Models;

import com.example.parkmaster.Enum.ParkingLot.SpaceType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Space {

    // Positional, reassigned whenever the lot is regenerated
    @Column(name = "space_id", nullable = false)
    private Integer id;

    @Column(name = "row_index", nullable = false)
    private Integer row;

    @Column(name = "col_index", nullable = false)
    private Integer col;

    @Enumerated(EnumType.STRING)
    @Column(name = "space_type", nullable = false)
    private SpaceType type = SpaceType.REGULAR;
}
