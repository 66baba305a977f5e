package io.github.drompincen.vibehub.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "vibehub.gateway")
public class GatewayProperties {

    /** Endpoint the session socket is mounted on. */
    private String websocketPath = "/ws";
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    /** Tool results and replayed history can be large; frames up to this size are accepted. */
    private int maxTextMessageBytes = 1024 * 1024;
    /** Idle socket timeout; zero keeps the container default. */
    private long idleTimeoutMillis = 0L;

    public String getWebsocketPath() { return websocketPath; }
    public void setWebsocketPath(String websocketPath) { this.websocketPath = websocketPath; }
    public List<String> getAllowedOrigins() { return allowedOrigins; }
    public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    public int getMaxTextMessageBytes() { return maxTextMessageBytes; }
    public void setMaxTextMessageBytes(int maxTextMessageBytes) { this.maxTextMessageBytes = maxTextMessageBytes; }
    public long getIdleTimeoutMillis() { return idleTimeoutMillis; }
    public void setIdleTimeoutMillis(long idleTimeoutMillis) { this.idleTimeoutMillis = idleTimeoutMillis; }
}
