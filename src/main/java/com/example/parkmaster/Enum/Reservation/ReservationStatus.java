package com.example.parkmaster.Enum.Reservation;

import com.example.parkmaster.Exceptions.InvalidDataException;
import com.fasterxml.jackson.annotation.JsonCreator;

public enum ReservationStatus {
    ACTIVE("active"),
    CANCELLED("cancelled"),
    COMPLETED("completed");

    private final String value;

    ReservationStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ReservationStatus fromString(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        for (ReservationStatus status : ReservationStatus.values()) {
            if (status.name().equalsIgnoreCase(value) || status.getValue().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new InvalidDataException("Invalid reservation status: " + value);
    }
}
