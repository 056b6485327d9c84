package com.pumainbox.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InboxApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(InboxApiApplication.class, args);
    }

}
