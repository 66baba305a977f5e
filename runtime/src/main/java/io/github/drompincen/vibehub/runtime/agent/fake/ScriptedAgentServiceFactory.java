package io.github.drompincen.vibehub.runtime.agent.fake;

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
 * Activate with: VIBEHUB_AGENT_PROVIDER=fake
 */
@Component
@ConditionalOnProperty(name = "vibehub.agent.provider", havingValue = "fake")
public class ScriptedAgentServiceFactory implements AgentServiceFactory {

    private static final Logger log = LoggerFactory.getLogger(ScriptedAgentServiceFactory.class);

    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "fake-agent");
        t.setDaemon(true);
        return t;
    });

    public ScriptedAgentServiceFactory(AgentProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        log.info("Agent provider: scripted fake");
    }

    @Override
    public AgentServiceAdapter create(AgentOptions options, AgentCallbacks callbacks) {
        return new ScriptedAgentService(options, callbacks, objectMapper, executor, properties.getFakeDelayMillis());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
