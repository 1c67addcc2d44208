package com.signalserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling // idle session sweep and metrics summary
public class SignalServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SignalServerApplication.class, args);
	}

}
