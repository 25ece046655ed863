package com.rabs.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RabsApplication {

	public static void main(String[] args) {
		// Keep the JVM on UTC; program dates are resolved through the loom clock zone.
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(RabsApplication.class, args);
	}

}
