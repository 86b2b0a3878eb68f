package com.tablewrite.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Tablewrite backend entry point: hosts the Foundry bridge endpoint and the
 * REST API over it.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.tablewrite")
public class TablewriteApplication {

    public static void main(String[] args) {
        SpringApplication.run(TablewriteApplication.class, args);
    }
}
