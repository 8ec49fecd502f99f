package com.williamcallahan.scholarly_dashboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.database")
public class DatabaseProperties {
    private boolean ensureSchemaOnStartup = true;
    private boolean createIfMissing = false;
    // Connection used to create the target database; typically points at the "postgres" maintenance db
    private String adminUrl;

    public boolean isEnsureSchemaOnStartup() { return ensureSchemaOnStartup; }
    public void setEnsureSchemaOnStartup(boolean ensureSchemaOnStartup) { this.ensureSchemaOnStartup = ensureSchemaOnStartup; }

    public boolean isCreateIfMissing() { return createIfMissing; }
    public void setCreateIfMissing(boolean createIfMissing) { this.createIfMissing = createIfMissing; }

    public String getAdminUrl() { return adminUrl; }
    public void setAdminUrl(String adminUrl) { this.adminUrl = adminUrl; }
}
