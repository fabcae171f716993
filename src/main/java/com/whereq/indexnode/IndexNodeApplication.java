package com.whereq.indexnode;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the WhereQ index node.
 * The node runs index-build and data-analysis tasks handed to it by a coordinator
 * and keeps track of their state until the coordinator collects the results.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class IndexNodeApplication {

    public static void main(String[] args) {
        SpringApplication.run(IndexNodeApplication.class, args);
    }
}
