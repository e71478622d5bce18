package com.specmock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpecMockApplication {

	public static void main(String[] args) {
        SpringApplication app = new SpringApplication(SpecMockApplication.class);
        app.setWebApplicationType(WebApplicationType.REACTIVE);
        app.run(args);
	}

}
