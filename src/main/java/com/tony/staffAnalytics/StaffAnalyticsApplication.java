package com.tony.staffAnalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StaffAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(StaffAnalyticsApplication.class, args);
	}

}
