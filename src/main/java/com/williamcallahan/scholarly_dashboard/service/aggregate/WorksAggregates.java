package com.williamcallahan.scholarly_dashboard.service.aggregate;

import com.williamcallahan.scholarly_dashboard.dto.CountryCollaboration;
import com.williamcallahan.scholarly_dashboard.dto.DomainYearValue;
import com.williamcallahan.scholarly_dashboard.dto.PrimaryTopicCount;
import com.williamcallahan.scholarly_dashboard.dto.TopicSummary;
import com.williamcallahan.scholarly_dashboard.dto.YearCount;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Pure functions from schema snapshots to the aggregates the dashboard renders.
 * Nothing here touches the database; empty input yields empty output.
 */
public final class WorksAggregates {

    public static final String UNKNOWN = "Unknown";
    static final Set<String> RESEARCH_WORK_TYPES = Set.of("article", "review");

    private WorksAggregates() {
    }

    /**
     * Works per publication year in {@code [fromYear, toYear]} (either bound optional), split by {@code groupBy}.
     * Works without a year are left out; a null group value is reported as {@link #UNKNOWN}.
     */
    public static List<YearCount> publicationsByYear(List<WorkSnapshot> works, Integer fromYear, Integer toYear, GroupBy groupBy) {
        GroupBy split = groupBy == null ? GroupBy.NONE : groupBy;
        Map<Integer, Map<String, Long>> counts = new TreeMap<>();
        for (WorkSnapshot work : works) {
            Integer year = work.publicationYear();
            if (year == null || (fromYear != null && year < fromYear) || (toYear != null && year > toYear)) {
                continue;
            }
            String group = split == GroupBy.NONE ? "" : Objects.requireNonNullElse(split.valueOf(work), UNKNOWN);
            counts.computeIfAbsent(year, y -> new TreeMap<>()).merge(group, 1L, Long::sum);
        }
        List<YearCount> result = new ArrayList<>();
        counts.forEach((year, groups) -> groups.forEach((group, count) ->
            result.add(new YearCount(year, split == GroupBy.NONE ? null : group, count))));
        return result;
    }

    /**
     * Distinct works per partner country, leaving out the home institution (matched by id or
     * name, case-insensitive). Affiliations without a country are ignored.
     *
     * @param includeAllCountries when true every ISO country is listed, with zero when absent
     */
    public static List<CountryCollaboration> collaborationsByCountry(List<AffiliationSnapshot> affiliations,
                                                                     String homeInstitution,
                                                                     boolean includeAllCountries) {
        Set<String> seen = new HashSet<>();
        Map<String, Long> counts = new TreeMap<>();
        for (AffiliationSnapshot affiliation : affiliations) {
            if (isHomeInstitution(affiliation, homeInstitution) || affiliation.countryCode() == null
                || affiliation.countryCode().isBlank()) {
                continue;
            }
            String countryCode = affiliation.countryCode().strip().toUpperCase(Locale.ROOT);
            if (seen.add(affiliation.workId() + "|" + countryCode)) {
                counts.merge(toIso3(countryCode), 1L, Long::sum);
            }
        }
        if (includeAllCountries) {
            for (String iso2 : Locale.getISOCountries()) {
                counts.putIfAbsent(toIso3(iso2), 0L);
            }
        }
        return counts.entrySet().stream()
            .map(e -> new CountryCollaboration(e.getKey(), e.getValue(), Math.log1p(e.getValue())))
            .sorted(Comparator.comparingLong(CountryCollaboration::works).reversed()
                .thenComparing(CountryCollaboration::countryCode))
            .toList();
    }

    /**
     * For each work, its primary topic is the assignment with the highest score (first one on
     * ties); rows without a domain or score do not compete. Returns works per primary topic name.
     */
    public static List<PrimaryTopicCount> primaryTopics(List<WorkTopicSnapshot> rows) {
        Map<String, WorkTopicSnapshot> primaryByWork = new LinkedHashMap<>();
        for (WorkTopicSnapshot row : rows) {
            if (row.domainName() == null || row.score() == null || row.topicName() == null) {
                continue;
            }
            WorkTopicSnapshot current = primaryByWork.get(row.workId());
            if (current == null || row.score() > current.score()) {
                primaryByWork.put(row.workId(), row);
            }
        }

        Map<String, WorkTopicSnapshot> firstByTopic = new LinkedHashMap<>();
        Map<String, Long> counts = new LinkedHashMap<>();
        for (WorkTopicSnapshot primary : primaryByWork.values()) {
            firstByTopic.putIfAbsent(primary.topicName(), primary);
            counts.merge(primary.topicName(), 1L, Long::sum);
        }
        return counts.entrySet().stream()
            .map(e -> {
                WorkTopicSnapshot first = firstByTopic.get(e.getKey());
                return new PrimaryTopicCount(e.getKey(), first.subfieldName(), first.fieldName(),
                    first.domainName(), e.getValue());
            })
            .sorted(Comparator.comparingLong(PrimaryTopicCount::works).reversed()
                .thenComparing(PrimaryTopicCount::topicName))
            .toList();
    }

    /**
     * Citations received per domain and year with a running total per domain. A work counts
     * once per domain it is assigned to; works without topics fall into {@link #UNKNOWN}.
     */
    public static List<DomainYearValue> domainCitationsByYear(List<WorkTopicSnapshot> rows, List<CitationSnapshot> citations) {
        Map<String, Set<String>> domainsByWork = domainsByWork(rows);
        Map<String, List<CitationSnapshot>> citationsByWork = new LinkedHashMap<>();
        for (CitationSnapshot citation : citations) {
            if (citation.year() != null) {
                citationsByWork.computeIfAbsent(citation.workId(), w -> new ArrayList<>()).add(citation);
            }
        }

        Map<String, Map<Integer, Long>> totals = new TreeMap<>();
        Set<String> seen = new HashSet<>();
        domainsByWork.forEach((workId, domains) -> {
            for (CitationSnapshot citation : citationsByWork.getOrDefault(workId, List.of())) {
                for (String domain : domains) {
                    if (seen.add(workId + "|" + domain + "|" + citation.year())) {
                        long cited = citation.citedCount() == null ? 0L : citation.citedCount();
                        totals.computeIfAbsent(domain, d -> new TreeMap<>()).merge(citation.year(), cited, Long::sum);
                    }
                }
            }
        });
        return withCumulative(totals);
    }

    /**
     * Works per publication year and domain, zero-filled across every (year, domain) pair seen,
     * with a running total per domain.
     */
    public static List<DomainYearValue> domainWorksByYear(List<WorkTopicSnapshot> rows) {
        Map<String, Integer> yearByWork = new LinkedHashMap<>();
        for (WorkTopicSnapshot row : rows) {
            if (row.publicationYear() != null) {
                yearByWork.putIfAbsent(row.workId(), row.publicationYear());
            }
        }
        Map<String, Set<String>> domainsByWork = domainsByWork(rows);

        Set<Integer> years = new TreeSet<>();
        Set<String> domains = new TreeSet<>();
        Map<String, Map<Integer, Long>> totals = new TreeMap<>();
        domainsByWork.forEach((workId, workDomains) -> {
            Integer year = yearByWork.get(workId);
            if (year == null) {
                return;
            }
            years.add(year);
            for (String domain : workDomains) {
                domains.add(domain);
                totals.computeIfAbsent(domain, d -> new TreeMap<>()).merge(year, 1L, Long::sum);
            }
        });
        for (String domain : domains) {
            Map<Integer, Long> perYear = totals.computeIfAbsent(domain, d -> new TreeMap<>());
            years.forEach(year -> perYear.putIfAbsent(year, 0L));
        }
        return withCumulative(totals);
    }

    /**
     * Article/review summary per value of {@code level}: distinct works, h-index of their
     * citation counts, mean reference count (two decimals) and the first domain seen.
     * Rows without a domain or without a value at that level are ignored.
     */
    public static List<TopicSummary> topicSummary(List<WorkTopicSnapshot> rows, TopicLevel level) {
        TopicLevel by = level == null ? TopicLevel.TOPIC : level;
        Map<String, List<WorkTopicSnapshot>> byValue = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (WorkTopicSnapshot row : rows) {
            String value = by.valueOf(row);
            if (row.domainName() == null || value == null || row.workType() == null
                || !RESEARCH_WORK_TYPES.contains(row.workType().toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (seen.add(row.workId() + "|" + value)) {
                byValue.computeIfAbsent(value, v -> new ArrayList<>()).add(row);
            }
        }

        List<TopicSummary> result = new ArrayList<>();
        byValue.forEach((value, works) -> {
            List<Integer> citations = works.stream()
                .map(w -> w.citedByCount() == null ? 0 : w.citedByCount())
                .toList();
            List<Integer> references = works.stream()
                .map(WorkTopicSnapshot::referencedWorksCount)
                .filter(Objects::nonNull)
                .toList();
            result.add(new TopicSummary(value, works.size(), hIndex(citations), mean(references),
                works.get(0).domainName()));
        });
        result.sort(Comparator.comparing(TopicSummary::domainName).thenComparing(TopicSummary::name));
        return result;
    }

    /**
     * Largest h such that at least h of the counts are {@code >= h}.
     */
    public static int hIndex(List<Integer> citationCounts) {
        List<Integer> sorted = new ArrayList<>(citationCounts);
        sorted.removeIf(Objects::isNull);
        sorted.sort(Comparator.reverseOrder());
        int h = 0;
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i) >= i + 1) {
                h = i + 1;
            } else {
                break;
            }
        }
        return h;
    }

    /**
     * ISO 3166 alpha-2 to alpha-3; {@link #UNKNOWN} when the code is not recognised.
     */
    public static String toIso3(String iso2) {
        if (iso2 == null || iso2.length() != 2) {
            return UNKNOWN;
        }
        try {
            String iso3 = new Locale("", iso2.toUpperCase(Locale.ROOT)).getISO3Country();
            return iso3.isEmpty() ? UNKNOWN : iso3;
        } catch (MissingResourceException e) {
            return UNKNOWN;
        }
    }

    private static boolean isHomeInstitution(AffiliationSnapshot affiliation, String homeInstitution) {
        if (homeInstitution == null || homeInstitution.isBlank()) {
            return false;
        }
        String home = homeInstitution.strip();
        return home.equalsIgnoreCase(affiliation.institutionId() == null ? "" : affiliation.institutionId())
            || home.equalsIgnoreCase(affiliation.institutionName() == null ? "" : affiliation.institutionName());
    }

    private static Map<String, Set<String>> domainsByWork(List<WorkTopicSnapshot> rows) {
        Map<String, Set<String>> domainsByWork = new LinkedHashMap<>();
        for (WorkTopicSnapshot row : rows) {
            String domain = row.domainName() == null ? UNKNOWN : row.domainName();
            domainsByWork.computeIfAbsent(row.workId(), w -> new LinkedHashSet<>()).add(domain);
        }
        // A work with some classified topics is not also counted as Unknown
        domainsByWork.values().forEach(domains -> {
            if (domains.size() > 1) {
                domains.remove(UNKNOWN);
            }
        });
        return domainsByWork;
    }

    private static List<DomainYearValue> withCumulative(Map<String, Map<Integer, Long>> totals) {
        List<DomainYearValue> result = new ArrayList<>();
        totals.forEach((domain, perYear) -> {
            long running = 0;
            for (Map.Entry<Integer, Long> entry : perYear.entrySet()) {
                running += entry.getValue();
                result.add(new DomainYearValue(domain, entry.getKey(), entry.getValue(), running));
            }
        });
        return result;
    }

    private static Double mean(List<Integer> values) {
        if (values.isEmpty()) {
            return null;
        }
        double average = values.stream().mapToInt(Integer::intValue).average().orElse(0);
        return BigDecimal.valueOf(average).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
