package com.formulas.app;

import com.formulas.app.config.FormulaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FormulaProperties.class)
public class FormulaApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormulaApplication.class, args);
    }
}
