package com.streamfirst.sheetgrid.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetGridApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetGridApplication.class, args);
    }
}
