package com.propertyprice.map;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PropertyPriceMapApplication {

    public static void main(String[] args) {
        SpringApplication.run(PropertyPriceMapApplication.class, args);
    }
}
