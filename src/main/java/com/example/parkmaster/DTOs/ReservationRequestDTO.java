package com.example.parkmaster.DTOs;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A reservation as entered by the user. Required fields are checked by the
 * schedule expander rather than bean validation, so the same rules apply to
 * every caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationRequestDTO {
    private String userId;
    private String userName;
    private String parkingLotId;
    private Integer spaceId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;

    private String startTime;
    private String endTime;
    private boolean recurring;
    private String repeatPattern;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate endDate;
}
