package com.yerin.openshow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OpenshowJobqApplication {

	public static void main(String[] args) {
		SpringApplication.run(OpenshowJobqApplication.class, args);
	}

}
