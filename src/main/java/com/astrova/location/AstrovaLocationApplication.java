package com.astrova.location;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AstrovaLocationApplication {

    public static void main(String[] args) {
        SpringApplication.run(AstrovaLocationApplication.class, args);
    }
}
