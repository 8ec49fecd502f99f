package com.williamcallahan.scholarly_dashboard.runner;

import com.williamcallahan.scholarly_dashboard.config.HarvestProperties;
import com.williamcallahan.scholarly_dashboard.repository.DatabaseHandler;
import com.williamcallahan.scholarly_dashboard.service.HarvestRequest;
import com.williamcallahan.scholarly_dashboard.service.HarvestResult;
import com.williamcallahan.scholarly_dashboard.service.JsonlReplayService;
import com.williamcallahan.scholarly_dashboard.service.OpenAlexWorksHarvester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs a harvest (and/or a JSON lines replay) at startup when configured, e.g.
 * {@code --app.harvest.enabled=true --app.harvest.ror=03yrm5c26 --app.harvest.start-year=2020}.
 *
 * A failed harvest fails startup so batch invocations exit with a non-zero status.
 */
@Component
@Order(100)
public class OpenAlexHarvestRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(OpenAlexHarvestRunner.class);

    private final HarvestProperties properties;
    private final OpenAlexWorksHarvester harvester;
    private final JsonlReplayService replayService;
    private final ObjectProvider<DatabaseHandler> databaseHandlerProvider;

    public OpenAlexHarvestRunner(HarvestProperties properties,
                                 OpenAlexWorksHarvester harvester,
                                 JsonlReplayService replayService,
                                 ObjectProvider<DatabaseHandler> databaseHandlerProvider) {
        this.properties = properties;
        this.harvester = harvester;
        this.replayService = replayService;
        this.databaseHandlerProvider = databaseHandlerProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        DatabaseHandler handler = databaseHandlerProvider.getIfAvailable();

        if (hasText(properties.getReplayFile())) {
            if (handler == null) {
                throw new IllegalStateException("Replaying " + properties.getReplayFile() + " requires spring.datasource.url");
            }
            replayService.replay(Path.of(properties.getReplayFile()), handler);
        }

        if (!properties.isEnabled()) {
            log.debug("Startup harvest disabled (app.harvest.enabled=false)");
            return;
        }

        HarvestResult result = harvester.harvest(toRequest(handler));
        if (!result.isSuccess()) {
            throw new IllegalStateException("Harvest failed after " + result.pagesFetched()
                + " page(s); resume with --app.harvest.start-cursor=" + result.nextCursor(), result.failure());
        }
        if (result.isTruncated()) {
            log.info("Harvest stopped at the page cap; resume with --app.harvest.start-cursor={}", result.nextCursor());
        }
    }

    HarvestRequest toRequest(DatabaseHandler handler) {
        DatabaseHandler target = null;
        if (properties.isStoreInDatabase()) {
            if (handler == null) {
                log.warn("app.harvest.store-in-database is set but no datasource is configured; writing to the sink only");
            } else {
                target = handler;
            }
        }
        return HarvestRequest.builder()
            .ror(properties.getRor())
            .startYear(properties.getStartYear())
            .endYear(properties.getEndYear())
            .perPage(properties.getPerPage())
            .maxPages(properties.getMaxPages())
            .jsonlPath(hasText(properties.getJsonlPath()) ? Path.of(properties.getJsonlPath()) : null)
            .databaseHandler(target)
            .startCursor(properties.getStartCursor())
            .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
