package com.tabulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TabulatorApplication {
    public static void main(String[] args) {
        SpringApplication.run(TabulatorApplication.class, args);
    }
}
