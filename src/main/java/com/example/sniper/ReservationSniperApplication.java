package com.example.sniper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReservationSniperApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReservationSniperApplication.class, args);
	}

}
