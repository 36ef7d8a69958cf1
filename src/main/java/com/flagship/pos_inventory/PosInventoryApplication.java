package com.flagship.pos_inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PosInventoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(PosInventoryApplication.class, args);
    }
}
