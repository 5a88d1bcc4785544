package com.deuceleague.deuce_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DeuceApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(DeuceApiApplication.class, args);
	}

}
