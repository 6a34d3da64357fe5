package com.example.phoneshop.lisa;

import com.example.phoneshop.lisa.config.LisaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// the datasource is only built when the corpus is read from pgvector
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(LisaProperties.class)
public class LisaApplication {

    public static void main(String[] args) {
        SpringApplication.run(LisaApplication.class, args);
    }

}
