package com.williamcallahan.scholarly_dashboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Startup harvest settings bound from {@code app.harvest.*}. Command line options such
 * as {@code --app.harvest.ror=...} override them.
 */
@Component
@ConfigurationProperties(prefix = "app.harvest")
public class HarvestProperties {
    private boolean enabled = false;
    private String ror;
    private Integer startYear;
    private Integer endYear;
    private Integer perPage;
    private Integer maxPages;
    private String jsonlPath;
    private boolean storeInDatabase = true;
    private String startCursor;
    private String replayFile;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getRor() { return ror; }
    public void setRor(String ror) { this.ror = ror; }

    public Integer getStartYear() { return startYear; }
    public void setStartYear(Integer startYear) { this.startYear = startYear; }

    public Integer getEndYear() { return endYear; }
    public void setEndYear(Integer endYear) { this.endYear = endYear; }

    public Integer getPerPage() { return perPage; }
    public void setPerPage(Integer perPage) { this.perPage = perPage; }

    public Integer getMaxPages() { return maxPages; }
    public void setMaxPages(Integer maxPages) { this.maxPages = maxPages; }

    public String getJsonlPath() { return jsonlPath; }
    public void setJsonlPath(String jsonlPath) { this.jsonlPath = jsonlPath; }

    public boolean isStoreInDatabase() { return storeInDatabase; }
    public void setStoreInDatabase(boolean storeInDatabase) { this.storeInDatabase = storeInDatabase; }

    public String getStartCursor() { return startCursor; }
    public void setStartCursor(String startCursor) { this.startCursor = startCursor; }

    public String getReplayFile() { return replayFile; }
    public void setReplayFile(String replayFile) { this.replayFile = replayFile; }
}
