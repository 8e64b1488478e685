package com.uiplan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * UiPlan - deterministic natural-language to UI plan compiler.
 */
@SpringBootApplication
public class UiPlanApplication {

	public static void main(String[] args) {
		SpringApplication.run(UiPlanApplication.class, args);
	}

}
