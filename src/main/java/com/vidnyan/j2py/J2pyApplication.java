package com.vidnyan.j2py;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * j2py - Java to Python structural migration engine.
 *
 * Uses JavaParser for source parsing; method bodies are carried, never translated.
 */
@SpringBootApplication
public class J2pyApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(J2pyApplication.class, args)));
    }
}
