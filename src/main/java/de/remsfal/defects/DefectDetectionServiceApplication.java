package de.remsfal.defects;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DefectDetectionServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(DefectDetectionServiceApplication.class, args);
	}

}
