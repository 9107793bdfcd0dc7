package com.synthetic.cycleengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CycleEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CycleEngineApplication.class, args);
    }
}
