package com.example.highlight_planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HighlightPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(HighlightPlannerApplication.class, args);
	}

}
