package com.example.parkmaster.Enum.ParkingLot;

public enum SpaceStatus {
    AVAILABLE,
    OCCUPIED
}
