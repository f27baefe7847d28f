package com.example.parkmaster.ConverterComponents;

import com.example.parkmaster.Enum.Reservation.ReservationStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

@Component
public class StringToReservationStatusConverter implements Converter<String, ReservationStatus> {
    @Override
    public ReservationStatus convert(String source) {
        return ReservationStatus.fromString(source.trim());
    }
}
