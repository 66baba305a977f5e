package io.github.drompincen.vibehub.runtime.session;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "vibehub.session")
public class SessionProperties {

    /** Number of most recent history entries kept in memory per active session. */
    private int historyWindow = 50;
    /** Context window assumed when the agent does not report one. */
    private long defaultContextWindow = 200_000L;

    public int getHistoryWindow() { return historyWindow; }
    public void setHistoryWindow(int historyWindow) { this.historyWindow = historyWindow; }
    public long getDefaultContextWindow() { return defaultContextWindow; }
    public void setDefaultContextWindow(long defaultContextWindow) { this.defaultContextWindow = defaultContextWindow; }
}
