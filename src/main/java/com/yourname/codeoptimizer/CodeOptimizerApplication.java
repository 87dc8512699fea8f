package com.yourname.codeoptimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeOptimizerApplication.class, args);
    }
}
