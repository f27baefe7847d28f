package com.example.parkmaster.Mappers;

import com.example.parkmaster.DTOs.LotLayoutDTO;
import com.example.parkmaster.DTOs.ParkingLotDTO;
import com.example.parkmaster.DTOs.SpaceDTO;
import com.example.parkmaster.DTOs.SpacePositionDTO;
import com.example.parkmaster.Enum.ParkingLot.SpaceType;
import com.example.parkmaster.Models.ParkingLot;
import com.example.parkmaster.Models.Space;
import com.example.parkmaster.Utils.LotGeometry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Service
public class ParkingLotMapper {

    public ParkingLotDTO toDTO(ParkingLot parkingLot) {
        if (parkingLot == null) {
            return null;
        }

        ParkingLotDTO dto = new ParkingLotDTO();
        dto.setId(parkingLot.getId());
        dto.setName(parkingLot.getName());
        dto.setRows(parkingLot.getRows());
        dto.setCols(parkingLot.getCols());
        dto.setSpaces(parkingLot.getSpaces().stream()
                .map(this::toSpaceDTO)
                .collect(Collectors.toList()));
        dto.setMergedAisles(sortedAisles(parkingLot.getMergedAisles()));
        dto.setTotalSpots(parkingLot.getRows() * parkingLot.getCols());
        dto.setCreatedAt(parkingLot.getCreatedAt());
        dto.setUpdatedAt(parkingLot.getUpdatedAt());

        return dto;
    }

    public SpaceDTO toSpaceDTO(Space space) {
        return new SpaceDTO(space.getId(), space.getRow(), space.getCol(), space.getType());
    }

    /**
     * Space types submitted with a lot, as a list the registry can carry forward.
     * Submitted ids are ignored.
     */
    public List<Space> toSpaceTemplates(List<SpaceDTO> spaces) {
        List<Space> templates = new ArrayList<>();
        if (spaces == null) {
            return templates;
        }
        for (SpaceDTO space : spaces) {
            if (space.getRow() != null && space.getCol() != null && space.getType() != null) {
                templates.add(new Space(null, space.getRow(), space.getCol(), space.getType()));
            }
        }
        return templates;
    }

    public LotLayoutDTO toLayoutDTO(ParkingLot parkingLot) {
        Set<Integer> mergedAisles = parkingLot.getMergedAisles();
        int rows = parkingLot.getRows();

        List<Double> rowPositions = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            rowPositions.add(LotGeometry.rowYPosition(r, mergedAisles));
        }

        List<SpacePositionDTO> spaces = parkingLot.getSpaces().stream()
                .map(space -> SpacePositionDTO.builder()
                        .id(space.getId())
                        .row(space.getRow())
                        .col(space.getCol())
                        .type(space.getType())
                        .x(LotGeometry.spaceXPosition(space.getCol()))
                        .y(rowPositions.get(space.getRow()))
                        .width(LotGeometry.SPACE_WIDTH)
                        .depth(LotGeometry.SPACE_DEPTH)
                        .build())
                .collect(Collectors.toList());

        Map<SpaceType, Long> spaceTypeCounts = new EnumMap<>(SpaceType.class);
        for (SpaceType type : SpaceType.values()) {
            spaceTypeCounts.put(type, 0L);
        }
        parkingLot.getSpaces().forEach(space -> spaceTypeCounts.merge(space.getType(), 1L, Long::sum));

        return LotLayoutDTO.builder()
                .parkingLotId(parkingLot.getId())
                .name(parkingLot.getName())
                .rows(rows)
                .cols(parkingLot.getCols())
                .width(LotGeometry.lotWidth(parkingLot.getCols()))
                .height(LotGeometry.lotHeight(rows, mergedAisles))
                .rowPositions(rowPositions)
                .mergedAisles(sortedAisles(mergedAisles))
                .spaces(spaces)
                .spaceTypeCounts(spaceTypeCounts)
                .build();
    }

    private List<Integer> sortedAisles(Set<Integer> mergedAisles) {
        return mergedAisles == null ? new ArrayList<>() : new ArrayList<>(new TreeSet<>(mergedAisles));
    }
}
