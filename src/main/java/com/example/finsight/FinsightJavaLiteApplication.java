package com.example.finsight;

import com.example.finsight.config.FinanceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
@SpringBootApplication
@EnableConfigurationProperties(FinanceProperties.class)
public class FinsightJavaLiteApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinsightJavaLiteApplication.class, args);
    }

}
