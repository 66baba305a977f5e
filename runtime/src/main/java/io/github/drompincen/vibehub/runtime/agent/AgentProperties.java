package io.github.drompincen.vibehub.runtime.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "vibehub.agent")
public class AgentProperties {

    /** claude-cli or fake */
    private String provider = "claude-cli";
    private String cliPath = "claude";
    private String model;
    private List<String> extraArgs = new ArrayList<>();
    /** Delay between scripted events of the fake provider. */
    private long fakeDelayMillis = 30;

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getCliPath() { return cliPath; }
    public void setCliPath(String cliPath) { this.cliPath = cliPath; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public List<String> getExtraArgs() { return extraArgs; }
    public void setExtraArgs(List<String> extraArgs) { this.extraArgs = extraArgs; }
    public long getFakeDelayMillis() { return fakeDelayMillis; }
    public void setFakeDelayMillis(long fakeDelayMillis) { this.fakeDelayMillis = fakeDelayMillis; }
}
