package com.example.parkmaster.Config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class TimeConfig {

    private static final Logger logger = LoggerFactory.getLogger(TimeConfig.class);

    @Value("${app.reservations.time-zone:UTC}")
    private String timeZone;

    // Local reservation dates and times are interpreted in this zone
    @Bean
    public ZoneId parkingZone() {
        ZoneId zone = ZoneId.of(timeZone);
        logger.info("Using time zone {} for reservation dates and occupancy display", zone);
        return zone;
    }

    @Bean
    public Clock clock(ZoneId parkingZone) {
        return Clock.system(parkingZone);
    }
}
