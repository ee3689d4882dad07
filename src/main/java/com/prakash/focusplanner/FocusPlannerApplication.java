package com.prakash.focusplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.config.EnableMongoAuditing; // Fills @CreatedDate / @LastModifiedDate

@SpringBootApplication
@EnableMongoAuditing
public class FocusPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(FocusPlannerApplication.class, args);
	}

}
