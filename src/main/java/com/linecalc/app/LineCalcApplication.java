package com.linecalc.app;

import com.linecalc.app.config.CalculatorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CalculatorProperties.class)
public class LineCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(LineCalcApplication.class, args);
    }
}
