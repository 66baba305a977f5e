package io.github.drompincen.vibehub.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "global_settings")
public class GlobalSettingsDocument {

    public static final String GLOBAL_ID = "global";

    @Id
    private String settingsId;

    private List<String> allowedTools = new ArrayList<>();
    private Instant updatedAt;

    public GlobalSettingsDocument() {}

    public String getSettingsId() { return settingsId; }
    public void setSettingsId(String settingsId) { this.settingsId = settingsId; }

    public List<String> getAllowedTools() { return allowedTools; }
    public void setAllowedTools(List<String> allowedTools) { this.allowedTools = allowedTools; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
