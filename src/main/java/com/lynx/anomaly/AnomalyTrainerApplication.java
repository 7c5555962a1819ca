package com.lynx.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnomalyTrainerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AnomalyTrainerApplication.class, args)));
    }
}
