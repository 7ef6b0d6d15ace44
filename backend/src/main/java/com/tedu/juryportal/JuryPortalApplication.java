package com.tedu.juryportal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JuryPortalApplication {

	public static void main(String[] args) {
		SpringApplication.run(JuryPortalApplication.class, args);
	}
}
