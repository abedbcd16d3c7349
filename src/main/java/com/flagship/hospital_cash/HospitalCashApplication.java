package com.flagship.hospital_cash;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HospitalCashApplication {

    public static void main(String[] args) {
        SpringApplication.run(HospitalCashApplication.class, args);
    }
}
