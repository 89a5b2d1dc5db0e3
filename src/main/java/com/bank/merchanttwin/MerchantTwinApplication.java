package com.bank.merchanttwin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MerchantTwinApplication {

    public static void main(String[] args) {
        SpringApplication.run(MerchantTwinApplication.class, args);
    }
}
