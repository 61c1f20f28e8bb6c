package org.example.assessment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssessmentLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssessmentLedgerApplication.class, args);
    }
}
