package com.mco;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class McoApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(McoApplication.class)
                .properties("spring.main.banner-mode=off")
                .run(args);
    }
}
