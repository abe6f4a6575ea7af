package com.nhnacademy.booknotionsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookNotionSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookNotionSyncApplication.class, args);
    }
}
