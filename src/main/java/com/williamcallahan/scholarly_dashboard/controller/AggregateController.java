package com.williamcallahan.scholarly_dashboard.controller;

import com.williamcallahan.scholarly_dashboard.controller.support.ErrorResponseUtils;
import com.williamcallahan.scholarly_dashboard.dto.CountryCollaboration;
import com.williamcallahan.scholarly_dashboard.dto.DomainYearValue;
import com.williamcallahan.scholarly_dashboard.dto.PrimaryTopicCount;
import com.williamcallahan.scholarly_dashboard.dto.TopicSummary;
import com.williamcallahan.scholarly_dashboard.dto.YearCount;
import com.williamcallahan.scholarly_dashboard.service.aggregate.GroupBy;
import com.williamcallahan.scholarly_dashboard.service.aggregate.TopicLevel;
import com.williamcallahan.scholarly_dashboard.service.aggregate.WorksAggregateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Read-only aggregate endpoints consumed by the dashboard.
 *
 * Every endpoint answers 200 with a (possibly empty) list; bad parameters give 400.
 */
@RestController
@RequestMapping("/api/aggregates")
@Slf4j
public class AggregateController {

    private final WorksAggregateService aggregateService;

    public AggregateController(WorksAggregateService aggregateService) {
        this.aggregateService = aggregateService;
    }

    @GetMapping("/publications-by-year")
    public Mono<ResponseEntity<List<YearCount>>> publicationsByYear(@RequestParam(name = "from", required = false) Integer from,
                                                                    @RequestParam(name = "to", required = false) Integer to,
                                                                    @RequestParam(name = "groupBy", defaultValue = "none") String groupBy) {
        if (from != null && to != null && from > to) {
            throw new IllegalArgumentException("from must not be after to");
        }
        GroupBy split = GroupBy.fromParameter(groupBy);
        return respond("publications-by-year", () -> aggregateService.publicationsByYear(from, to, split));
    }

    @GetMapping("/collaborations-by-country")
    public Mono<ResponseEntity<List<CountryCollaboration>>> collaborationsByCountry(
            @RequestParam(name = "excludeInstitution", required = false) String excludeInstitution,
            @RequestParam(name = "includeAll", defaultValue = "false") boolean includeAll) {
        return respond("collaborations-by-country",
            () -> aggregateService.collaborationsByCountry(excludeInstitution, includeAll));
    }

    @GetMapping("/primary-topics")
    public Mono<ResponseEntity<List<PrimaryTopicCount>>> primaryTopics() {
        return respond("primary-topics", aggregateService::primaryTopics);
    }

    @GetMapping("/domain-citations")
    public Mono<ResponseEntity<List<DomainYearValue>>> domainCitations() {
        return respond("domain-citations", aggregateService::domainCitationsByYear);
    }

    @GetMapping("/domain-works")
    public Mono<ResponseEntity<List<DomainYearValue>>> domainWorks() {
        return respond("domain-works", aggregateService::domainWorksByYear);
    }

    @GetMapping("/topic-summary")
    public Mono<ResponseEntity<List<TopicSummary>>> topicSummary(@RequestParam(name = "level", defaultValue = "topic") String level) {
        TopicLevel topicLevel = TopicLevel.fromParameter(level);
        return respond("topic-summary", () -> aggregateService.topicSummary(topicLevel));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ErrorResponseUtils.invalidParameter(ex);
    }

    private <T> Mono<ResponseEntity<List<T>>> respond(String name, Callable<List<T>> loader) {
        return Mono.fromCallable(loader)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok)
            .onErrorResume(ex -> {
                log.error("Aggregate '{}' failed: {}", name, ex.getMessage(), ex);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).<List<T>>build());
            });
    }
}
