package com.daniel.feedarr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
// Used to start app.
@ConfigurationPropertiesScan
// Binds feedarr.* from application.properties / environment into FeedarrProperties.

public class FeedarrApplication {

	public static void main(String[] args) {
		SpringApplication.run(FeedarrApplication.class, args);
	}

}
