package com.residencepark.visitorparking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Visitor Parking Registration & Occupancy Assistant
 */
@SpringBootApplication
public class VisitorParkingApplication {

    public static void main(String[] args) {
        SpringApplication.run(VisitorParkingApplication.class, args);
    }

}
