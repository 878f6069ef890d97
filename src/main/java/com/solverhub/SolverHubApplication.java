package com.solverhub;

import com.solverhub.exception.ConfigurationException;
import com.solverhub.spring.EnableSolverHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Solver hub entry point. Serves the plan endpoint, solves a single problem,
 * or runs the validation harness, depending on the command line.
 */
@SpringBootApplication
@EnableSolverHub
public class SolverHubApplication {

    private static final Logger log = LoggerFactory.getLogger(SolverHubApplication.class);

    public static void main(String[] args) {
        LaunchArguments launch;
        try {
            launch = LaunchArguments.parse(args);
        } catch (ConfigurationException e) {
            log.error("{}", e.getMessage());
            System.exit(1);
            return;
        }

        SpringApplication app = new SpringApplication(SolverHubApplication.class);
        app.setDefaultProperties(launch.toProperties());
        app.setWebApplicationType(launch.mode() == LaunchMode.SERVE
                ? WebApplicationType.SERVLET
                : WebApplicationType.NONE);

        ConfigurableApplicationContext context = app.run();
        if (launch.mode() != LaunchMode.SERVE) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
