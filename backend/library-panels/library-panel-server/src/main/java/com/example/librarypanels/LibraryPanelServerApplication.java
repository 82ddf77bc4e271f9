package com.example.librarypanels;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LibraryPanelServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibraryPanelServerApplication.class, args);
    }
}
