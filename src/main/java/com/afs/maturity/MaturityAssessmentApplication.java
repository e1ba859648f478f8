package com.afs.maturity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MaturityAssessmentApplication {
    public static void main(String[] args) {
        SpringApplication.run(MaturityAssessmentApplication.class, args);
    }
}
