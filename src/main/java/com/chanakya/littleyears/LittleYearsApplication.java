package com.chanakya.littleyears;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LittleYearsApplication {

    public static void main(String[] args) {
        SpringApplication.run(LittleYearsApplication.class, args);
    }

}
