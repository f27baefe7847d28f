package com.example.parkmaster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ParkmasterApplication {

	public static void main(String[] args) {
		SpringApplication.run(ParkmasterApplication.class, args);
	}
}
