package com.williamcallahan.scholarly_dashboard.service;

import com.williamcallahan.scholarly_dashboard.mapper.OpenAlexWorkParser;
import com.williamcallahan.scholarly_dashboard.repository.DatabaseHandler;
import com.williamcallahan.scholarly_dashboard.repository.InsertSummary;
import com.williamcallahan.scholarly_dashboard.repository.schema.OpenAlexSchema;
import com.williamcallahan.scholarly_dashboard.testutil.OpenAlexFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JsonlReplayServiceTest {

    @Mock
    private DatabaseHandler handler;

    @TempDir
    Path tempDir;

    private JsonlReplayService service;

    @BeforeEach
    void setUp() {
        service = new JsonlReplayService(new OpenAlexWorkParser());
    }

    @Test
    void replay_insertsValidLinesAndSkipsBrokenOnes() throws Exception {
        Path file = tempDir.resolve("works.jsonl");
        Files.writeString(file, String.join("\n",
            OpenAlexFixtures.minimalWork("W1", 2022).toString(),
            "{broken",
            "",
            OpenAlexFixtures.minimalWork("W2", 2023).toString()) + "\n");
        when(handler.insertionOrder()).thenReturn(OpenAlexSchema.insertionOrder());
        when(handler.insertIfAbsent(anyString(), any(Collection.class))).thenReturn(new InsertSummary(0, 1, 0));

        JsonlReplayService.ReplayResult result = service.replay(file, handler);

        assertThat(result.linesRead()).isEqualTo(4);
        assertThat(result.linesSkipped()).isEqualTo(2);
        assertThat(result.inserts().alreadyPresent()).isEqualTo(16);
        verify(handler, times(2)).insertIfAbsent(eq("works"), any(Collection.class));
    }

    @Test
    void replay_rejectsMissingFileAndHandler() {
        assertThatThrownBy(() -> service.replay(tempDir.resolve("nope.jsonl"), handler))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.replay(Files.createFile(tempDir.resolve("x.jsonl")), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
