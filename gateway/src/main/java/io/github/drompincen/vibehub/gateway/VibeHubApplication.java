package io.github.drompincen.vibehub.gateway;

import io.github.drompincen.vibehub.gateway.config.GatewayProperties;
import io.github.drompincen.vibehub.runtime.agent.AgentProperties;
import io.github.drompincen.vibehub.runtime.session.SessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.vibehub")
@EnableMongoRepositories(basePackages = "io.github.drompincen.vibehub.persistence.repository")
@EnableConfigurationProperties({SessionProperties.class, AgentProperties.class, GatewayProperties.class})
public class VibeHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(VibeHubApplication.class, args);
    }
}
