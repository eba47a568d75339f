package com.tournamenttables;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TournamentTablesApplication {
    public static void main(String[] args) {
        SpringApplication.run(TournamentTablesApplication.class, args);
    }
}
