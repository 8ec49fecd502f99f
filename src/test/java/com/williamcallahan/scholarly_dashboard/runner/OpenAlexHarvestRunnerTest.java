package com.williamcallahan.scholarly_dashboard.runner;

import com.williamcallahan.scholarly_dashboard.config.HarvestProperties;
import com.williamcallahan.scholarly_dashboard.exception.CatalogApiException;
import com.williamcallahan.scholarly_dashboard.repository.DatabaseHandler;
import com.williamcallahan.scholarly_dashboard.repository.InsertSummary;
import com.williamcallahan.scholarly_dashboard.service.HarvestRequest;
import com.williamcallahan.scholarly_dashboard.service.HarvestResult;
import com.williamcallahan.scholarly_dashboard.service.HarvestState;
import com.williamcallahan.scholarly_dashboard.service.JsonlReplayService;
import com.williamcallahan.scholarly_dashboard.service.OpenAlexWorksHarvester;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenAlexHarvestRunnerTest {

    @Mock
    private OpenAlexWorksHarvester harvester;

    @Mock
    private JsonlReplayService replayService;

    @Mock
    private ObjectProvider<DatabaseHandler> handlerProvider;

    @Mock
    private DatabaseHandler handler;

    private HarvestProperties properties;
    private OpenAlexHarvestRunner runner;

    @BeforeEach
    void setUp() {
        properties = new HarvestProperties();
        runner = new OpenAlexHarvestRunner(properties, harvester, replayService, handlerProvider);
    }

    @Test
    void run_doesNothingWhenDisabled() {
        when(handlerProvider.getIfAvailable()).thenReturn(null);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(harvester, replayService);
    }

    @Test
    void run_buildsRequestFromProperties() {
        properties.setEnabled(true);
        properties.setRor("03490as77");
        properties.setStartYear(2020);
        properties.setEndYear(2024);
        properties.setPerPage(100);
        properties.setJsonlPath("target/works.jsonl");
        when(handlerProvider.getIfAvailable()).thenReturn(handler);
        when(harvester.harvest(any(HarvestRequest.class)))
            .thenReturn(new HarvestResult(HarvestState.DONE, 3, 250, InsertSummary.EMPTY, null, null));

        runner.run(new DefaultApplicationArguments());

        ArgumentCaptor<HarvestRequest> captor = ArgumentCaptor.forClass(HarvestRequest.class);
        verify(harvester).harvest(captor.capture());
        HarvestRequest request = captor.getValue();
        assertThat(request.ror()).isEqualTo("03490as77");
        assertThat(request.startYear()).isEqualTo(2020);
        assertThat(request.endYear()).isEqualTo(2024);
        assertThat(request.perPage()).isEqualTo(100);
        assertThat(request.jsonlPath()).isEqualTo(Path.of("target/works.jsonl"));
        assertThat(request.databaseHandler()).isSameAs(handler);
    }

    @Test
    void toRequest_leavesDatabaseOutWhenStorageDisabled() {
        properties.setRor("03490as77");
        properties.setStoreInDatabase(false);

        HarvestRequest request = runner.toRequest(handler);

        assertThat(request.databaseHandler()).isNull();
        assertThat(request.jsonlPath()).isNull();
    }

    @Test
    void run_failsStartupWhenHarvestFails() {
        properties.setEnabled(true);
        properties.setRor("03490as77");
        CatalogApiException cause = new CatalogApiException("down", 503, "https://api.openalex.org/works");
        when(handlerProvider.getIfAvailable()).thenReturn(handler);
        when(harvester.harvest(any(HarvestRequest.class)))
            .thenReturn(new HarvestResult(HarvestState.FAILED, 1, 200, InsertSummary.EMPTY, "c1", cause));

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("start-cursor=c1")
            .hasCause(cause);
    }

    @Test
    void run_replayRequiresDatabase() {
        properties.setReplayFile("works.jsonl");
        when(handlerProvider.getIfAvailable()).thenReturn(null);

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
            .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(replayService);
    }

    @Test
    void run_replaysConfiguredFile() {
        properties.setReplayFile("works.jsonl");
        when(handlerProvider.getIfAvailable()).thenReturn(handler);

        runner.run(new DefaultApplicationArguments());

        verify(replayService).replay(Path.of("works.jsonl"), handler);
        verifyNoInteractions(harvester);
    }
}
