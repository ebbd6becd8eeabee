package com.example.signal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SignalServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalServerApplication.class, args);
    }
}
