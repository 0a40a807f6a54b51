package com.solusoft.ai.healthsim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HealthSimServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(HealthSimServerApplication.class, args);
	}

}
