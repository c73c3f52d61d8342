package uk.gegc.learnerstate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LearnerStateApplication {

    public static void main(String[] args) {
        SpringApplication.run(LearnerStateApplication.class, args);
    }

}
