package com.example.memegen_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MemegenBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(MemegenBackendApplication.class, args);
	}

}
