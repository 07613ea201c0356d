package edu.northeastern.hanafeng.matrixreloaded;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class MatrixReloadedApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(MatrixReloadedApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(args)));
    }
}
