package com.example.parkmaster.Enum.ParkingLot;

import com.example.parkmaster.Exceptions.InvalidDataException;
import com.fasterxml.jackson.annotation.JsonCreator;

public enum SpaceType {
    REGULAR("regular"),
    VISITOR("visitor"),
    HANDICAPPED("handicapped"),
    AUTHORIZED("authorized");

    private static final String LEGACY_AUTHORIZED_LABEL = "authorized personnel";

    private final String value;

    SpaceType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SpaceType fromString(String value) {
        if (value == null) {
            throw new InvalidDataException("Invalid space type: null");
        }
        String trimmedValue = value.trim();
        if (LEGACY_AUTHORIZED_LABEL.equalsIgnoreCase(trimmedValue)) {
            return AUTHORIZED;
        }
        for (SpaceType type : SpaceType.values()) {
            if (type.name().equalsIgnoreCase(trimmedValue) || type.getValue().equalsIgnoreCase(trimmedValue)) {
                return type;
            }
        }
        throw new InvalidDataException("Invalid space type: " + value);
    }
}
