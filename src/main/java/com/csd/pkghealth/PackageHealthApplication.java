package com.csd.pkghealth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PackageHealthApplication {

    public static void main(String[] args) {
        SpringApplication.run(PackageHealthApplication.class, args);
    }
}
