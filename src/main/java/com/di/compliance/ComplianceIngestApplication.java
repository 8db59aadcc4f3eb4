package com.di.compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ComplianceIngestApplication {

	public static void main(String[] args) {
		SpringApplication.run(ComplianceIngestApplication.class, args);
	}
}
