package com.demo.multisig;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MultiSigApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultiSigApplication.class, args);
    }
}
