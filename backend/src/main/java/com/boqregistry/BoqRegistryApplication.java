package com.boqregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BoqRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoqRegistryApplication.class, args);
    }
}
