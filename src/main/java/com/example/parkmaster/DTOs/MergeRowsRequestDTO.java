package com.example.parkmaster.DTOs;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeRowsRequestDTO {

    @NotBlank(message = "First row cannot be blank")
    private String row1;

    @NotBlank(message = "Second row cannot be blank")
    private String row2;
}
