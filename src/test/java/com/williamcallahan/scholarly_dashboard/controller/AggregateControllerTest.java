package com.williamcallahan.scholarly_dashboard.controller;

import com.williamcallahan.scholarly_dashboard.dto.CountryCollaboration;
import com.williamcallahan.scholarly_dashboard.dto.DomainYearValue;
import com.williamcallahan.scholarly_dashboard.dto.PrimaryTopicCount;
import com.williamcallahan.scholarly_dashboard.dto.TopicSummary;
import com.williamcallahan.scholarly_dashboard.dto.YearCount;
import com.williamcallahan.scholarly_dashboard.service.aggregate.GroupBy;
import com.williamcallahan.scholarly_dashboard.service.aggregate.TopicLevel;
import com.williamcallahan.scholarly_dashboard.service.aggregate.WorksAggregateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AggregateControllerTest {

    @Mock
    private WorksAggregateService aggregateService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AggregateController(aggregateService)).build();
    }

    @Test
    @DisplayName("GET /api/aggregates/publications-by-year returns grouped counts")
    void publicationsByYear() throws Exception {
        when(aggregateService.publicationsByYear(2020, 2024, GroupBy.OA_STATUS))
            .thenReturn(List.of(new YearCount(2021, "gold", 3)));

        performAsync(get("/api/aggregates/publications-by-year")
            .param("from", "2020")
            .param("to", "2024")
            .param("groupBy", "oa-status"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].year", equalTo(2021)))
            .andExpect(jsonPath("$[0].group", equalTo("gold")))
            .andExpect(jsonPath("$[0].count", equalTo(3)));
    }

    @Test
    @DisplayName("GET /api/aggregates/collaborations-by-country passes exclusion and zero-fill flags")
    void collaborationsByCountry() throws Exception {
        when(aggregateService.collaborationsByCountry("I122140584", true))
            .thenReturn(List.of(new CountryCollaboration("GBR", 4, Math.log1p(4))));

        performAsync(get("/api/aggregates/collaborations-by-country")
            .param("excludeInstitution", "I122140584")
            .param("includeAll", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].countryCode", equalTo("GBR")))
            .andExpect(jsonPath("$[0].works", equalTo(4)))
            .andExpect(jsonPath("$[0].logWorks", closeTo(1.609, 0.001)));
    }

    @Test
    @DisplayName("GET /api/aggregates/primary-topics and domain series")
    void topicAndDomainSeries() throws Exception {
        when(aggregateService.primaryTopics()).thenReturn(List.of(
            new PrimaryTopicCount("Air Quality", "Toxicology", "Environmental Science", "Physical Sciences", 2)));
        when(aggregateService.domainCitationsByYear()).thenReturn(List.of(
            new DomainYearValue("Physical Sciences", 2023, 5, 8)));
        when(aggregateService.domainWorksByYear()).thenReturn(List.of());

        performAsync(get("/api/aggregates/primary-topics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].topicName", equalTo("Air Quality")))
            .andExpect(jsonPath("$[0].works", equalTo(2)));
        performAsync(get("/api/aggregates/domain-citations"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].cumulative", equalTo(8)));
        performAsync(get("/api/aggregates/domain-works"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("GET /api/aggregates/topic-summary accepts column-style level names")
    void topicSummary() throws Exception {
        when(aggregateService.topicSummary(TopicLevel.FIELD))
            .thenReturn(List.of(new TopicSummary("Medicine", 3, 2, null, "Health Sciences")));

        performAsync(get("/api/aggregates/topic-summary").param("level", "field_name"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name", equalTo("Medicine")))
            .andExpect(jsonPath("$[0].hIndex", equalTo(2)))
            .andExpect(jsonPath("$[0].meanReferencedWorks", nullValue()));
    }

    @Test
    @DisplayName("invalid parameters answer 400 without touching the service")
    void invalidParameters() throws Exception {
        mockMvc.perform(get("/api/aggregates/publications-by-year").param("groupBy", "country"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", equalTo("Invalid request")));
        mockMvc.perform(get("/api/aggregates/publications-by-year").param("from", "2024").param("to", "2020"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/aggregates/topic-summary").param("level", "galaxy"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(aggregateService);
    }

    @Test
    @DisplayName("a failing aggregate answers 500")
    void failingAggregate() throws Exception {
        when(aggregateService.primaryTopics()).thenThrow(new IllegalStateException("boom"));

        performAsync(get("/api/aggregates/primary-topics"))
            .andExpect(status().isInternalServerError());
    }

    private ResultActions performAsync(MockHttpServletRequestBuilder builder) throws Exception {
        MvcResult result = mockMvc.perform(builder)
            .andExpect(request().asyncStarted())
            .andReturn();
        return mockMvc.perform(asyncDispatch(result));
    }
}
