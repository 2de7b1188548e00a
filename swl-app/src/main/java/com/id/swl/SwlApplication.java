package com.id.swl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwlApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwlApplication.class, args);
    }

}
