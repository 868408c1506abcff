package com.kitchenlab.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecipeSearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(RecipeSearchApplication.class, args);
    }
}
