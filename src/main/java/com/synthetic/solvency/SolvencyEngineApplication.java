package com.synthetic.solvency;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SolvencyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SolvencyEngineApplication.class, args);
    }
}
