package com.stepwise;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class StepwiseApplication {

    public static void main(String[] args) {
        // CLI-only: no web server
        ApplicationContext ctx = new SpringApplicationBuilder(StepwiseApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);

        // CLI app: exit after command execution
        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }
}
