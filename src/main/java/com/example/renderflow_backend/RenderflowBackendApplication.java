package com.example.renderflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class RenderflowBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(RenderflowBackendApplication.class, args);
	}

}
