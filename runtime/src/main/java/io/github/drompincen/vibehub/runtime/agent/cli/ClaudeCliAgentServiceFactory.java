package io.github.drompincen.vibehub.runtime.agent.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.vibehub.runtime.agent.AgentCallbacks;
import io.github.drompincen.vibehub.runtime.agent.AgentOptions;
import io.github.drompincen.vibehub.runtime.agent.AgentProperties;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceAdapter;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceFactory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Default agent provider. Activate the scripted one with {@code vibehub.agent.provider=fake}.
 */
@Component
@ConditionalOnProperty(name = "vibehub.agent.provider", havingValue = "claude-cli", matchIfMissing = true)
public class ClaudeCliAgentServiceFactory implements AgentServiceFactory {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliAgentServiceFactory.class);

    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "agent-cli");
        t.setDaemon(true);
        return t;
    });

    public ClaudeCliAgentServiceFactory(AgentProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        log.info("Agent provider: Claude Code CLI at {}", properties.getCliPath());
    }

    @Override
    public AgentServiceAdapter create(AgentOptions options, AgentCallbacks callbacks) {
        return new ClaudeCliAgentService(options, callbacks, properties, objectMapper, executor);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
