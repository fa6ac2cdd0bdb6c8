package com.sessionelo.sessionelo_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SessionEloApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(SessionEloApiApplication.class, args);
	}

}
