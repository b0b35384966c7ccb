package com.example.roofpanel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RoofPanelApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoofPanelApplication.class, args);
    }
}
