package com.wpanther.memorygateway;

import com.wpanther.memorygateway.cli.ClientAdminRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point. Client administration commands run without the embedded web server.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class MemoryGatewayOAuthApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(MemoryGatewayOAuthApplication.class);
        if (ClientAdminRunner.isAdminCommand(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            application.setLogStartupInfo(false);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }
}
