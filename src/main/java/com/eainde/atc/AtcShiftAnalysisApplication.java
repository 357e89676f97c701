package com.eainde.atc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AtcShiftAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(AtcShiftAnalysisApplication.class, args);
    }
}
