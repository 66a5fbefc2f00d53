package com.al.medreportz;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedReportzApplication {

	public static void main(String[] args) {
		SpringApplication.run(MedReportzApplication.class, args);
	}

}
