package com.vidnyan.archgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ArchGate - Architecture Conformance Gate.
 * Static checker for role-prefixed layered source trees.
 */
@SpringBootApplication
public class ArchGateApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ArchGateApplication.class, args)));
    }
}
