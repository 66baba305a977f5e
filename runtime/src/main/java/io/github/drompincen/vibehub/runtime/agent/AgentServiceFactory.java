package io.github.drompincen.vibehub.runtime.agent;

public interface AgentServiceFactory {

    /**
     * Creates an idle adapter. Must not launch anything; the first {@code start} does.
     */
    AgentServiceAdapter create(AgentOptions options, AgentCallbacks callbacks);
}
