package com.purchasingpower.lahk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LahkFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(LahkFlowApplication.class, args);
    }
}
