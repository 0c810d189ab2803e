package com.al.clinicalconverter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClinicalConverterApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClinicalConverterApplication.class, args);
	}

}
