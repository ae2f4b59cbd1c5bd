package com.example.fieldkb.router;

import com.example.fieldkb.router.config.RouterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RouterProperties.class)
public class KbRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(KbRouterApplication.class, args);
    }

}
