package com.example.parkmaster.Services;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

@Service
public class ScheduledTasksService {

    private final ReservationService reservationService;
    private final Clock clock;

    @Autowired
    public ScheduledTasksService(ReservationService reservationService, Clock clock) {
        this.reservationService = reservationService;
        this.clock = clock;
    }

    // every 15 minutes by default
    @Scheduled(cron = "${app.reservations.completion-cron:0 */15 * * * *}")
    public void completeFinishedReservations() {
        reservationService.completeFinishedReservations(OffsetDateTime.now(clock));
    }
}
