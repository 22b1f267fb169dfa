package com.mdtodo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MdTodoApplication {

    public static void main(String[] args) {
        SpringApplication.run(MdTodoApplication.class, args);
    }

}
