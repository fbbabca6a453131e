package com.updown;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UpDownEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(UpDownEngineApplication.class, args);
	}
}
