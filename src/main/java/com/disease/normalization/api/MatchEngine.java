package com.disease.normalization.api;

import com.disease.normalization.core.model.LookupField;
import com.disease.normalization.core.model.MatchType;
import com.disease.normalization.core.model.MergeGroup;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceMetadata;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourcePriority;
import com.disease.normalization.core.model.SourceRecord;
import com.disease.normalization.merge.RecordMerger;
import com.disease.normalization.store.ConceptStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Answers search and normalize queries against a {@link ConceptStore}.
 *
 * <p>Matching is exact after case-folding with {@link Locale#ROOT}; nothing is
 * trimmed, stemmed or fuzzily compared. Tiers are tried in {@link MatchType}
 * order and a hit at an earlier tier always wins.</p>
 *
 * <p>The engine holds no mutable state; concurrent queries are safe as long as
 * the store's reads are.</p>
 */
public class MatchEngine {
    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private static final List<MatchType> TIERS = List.of(
            MatchType.CONCEPT_ID, MatchType.LABEL, MatchType.ALIAS,
            MatchType.XREF, MatchType.ASSOCIATED_WITH);

    private final ConceptStore store;
    private final RecordMerger recordMerger;

    public MatchEngine(ConceptStore store) {
        this(store, new RecordMerger());
    }

    public MatchEngine(ConceptStore store, RecordMerger recordMerger) {
        this.store = store;
        this.recordMerger = recordMerger;
    }

    /**
     * Searches each selected source independently. Every source reports the
     * best tier it reached, together with all of its records at that tier.
     */
    public SearchResult search(String query, SourceFilter filter) {
        List<QueryWarning> warnings = detectWarnings(query);
        Map<SourceName, SourceMatches> matches = new EnumMap<>(SourceName.class);

        if (query != null && !query.isEmpty()) {
            for (MatchType tier : TIERS) {
                Map<SourceName, List<SourceRecord>> hits = new EnumMap<>(SourceName.class);
                for (SourceRecord record : findCandidates(tier, query)) {
                    SourceName source = record.getSourceName();
                    if (filter.includes(source) && !matches.containsKey(source)) {
                        hits.computeIfAbsent(source, s -> new ArrayList<>()).add(record);
                    }
                }
                hits.forEach((source, records) -> {
                    records.sort(Comparator.comparing(SourceRecord::getConceptId));
                    matches.put(source, new SourceMatches(source, tier, records,
                            store.getSourceMetadata(source).orElse(null)));
                });
                if (matches.size() == filter.sources().size()) {
                    break;
                }
            }
        }

        for (SourceName source : filter.sources()) {
            matches.computeIfAbsent(source,
                    s -> SourceMatches.noMatch(s, store.getSourceMetadata(s).orElse(null)));
        }
        log.debug("search.completed query={} sources={}", query, filter.sources().size());
        return new SearchResult(query, matches, warnings);
    }

    /**
     * Searches a single source.
     */
    public SourceMatches search(SourceName source, String query) {
        return search(query, SourceFilter.only(source)).forSource(source);
    }

    /**
     * Resolves a query to the merged record of the best-matching concept.
     *
     * <p>The first tier with any hit across all sources wins. Its candidates are
     * ordered by source priority then concept id and the first is resolved
     * through its merge pointer; a record without a pointer stands alone and its
     * one-member merged form is built on the fly. When the candidates span more
     * than one group an {@link QueryWarning.Type#AMBIGUOUS_MATCH} warning lists
     * the competing merge refs.</p>
     */
    public NormalizationResult normalize(String query) {
        List<QueryWarning> warnings = detectWarnings(query);
        if (query == null || query.isEmpty()) {
            return NormalizationResult.noMatch(warnings);
        }

        for (MatchType tier : TIERS) {
            List<SourceRecord> candidates = findCandidates(tier, query);
            if (candidates.isEmpty()) {
                continue;
            }
            candidates.sort(SourcePriority.RECORD_ORDER);

            List<String> groupRefs = distinctGroupRefs(candidates);
            if (groupRefs.size() > 1) {
                warnings.add(QueryWarning.ambiguousMatch(groupRefs));
                log.debug("normalize.ambiguous query={} tier={} groups={}", query, tier, groupRefs);
            }

            SourceRecord best = candidates.get(0);
            Optional<MergedRecord> normalized = resolve(best);
            if (normalized.isEmpty()) {
                return NormalizationResult.noMatch(warnings);
            }
            MergedRecord record = normalized.get();
            return new NormalizationResult(tier, record, best.getConceptId(), warnings, sourceMetadata(record));
        }
        return NormalizationResult.noMatch(warnings);
    }

    private Optional<MergedRecord> resolve(SourceRecord record) {
        String conceptId = record.getConceptId();
        Optional<MergedRecord> group = store.getMergedRecordForMember(conceptId);
        if (group.isPresent()) {
            return group;
        }
        SourceRecord current = record;
        if (record.getMergeRef().isPresent()) {
            // The pointer was read before the group lookup; a rebuild may have committed in between.
            current = store.getSourceRecord(conceptId).orElse(record);
            if (current.getMergeRef().isPresent()) {
                group = store.getMergedRecordForMember(conceptId);
                if (group.isEmpty()) {
                    log.error("normalize.merged.missing conceptId={} mergeRef={}",
                            conceptId, current.getMergeRef().get());
                }
                return group;
            }
        }
        return Optional.of(recordMerger.merge(MergeGroup.singleton(conceptId), List.of(current)));
    }

    /**
     * Collects metadata of the source owning the merged concept id, then of each
     * source named by its xref and associated_with prefixes. Sources without
     * stored metadata and external namespaces are skipped.
     */
    private Map<SourceName, SourceMetadata> sourceMetadata(MergedRecord record) {
        List<String> references = new ArrayList<>();
        references.add(record.conceptId());
        references.addAll(record.xrefs());
        references.addAll(record.associatedWith());

        Map<SourceName, SourceMetadata> metadata = new LinkedHashMap<>();
        for (String reference : references) {
            SourceName.fromConceptId(reference)
                    .filter(source -> !metadata.containsKey(source))
                    .ifPresent(source -> store.getSourceMetadata(source)
                            .ifPresent(meta -> metadata.put(source, meta)));
        }
        return metadata;
    }

    private List<SourceRecord> findCandidates(MatchType tier, String query) {
        Set<String> ids = store.lookup(tier.getLookupField(), query);
        if (ids.isEmpty() && tier == MatchType.CONCEPT_ID && isBareNcitId(query)) {
            ids = store.lookup(LookupField.CONCEPT_ID,
                    SourceName.NCIT.getNamespacePrefix() + ":" + query);
        }
        List<SourceRecord> records = new ArrayList<>(ids.size());
        for (String id : ids) {
            store.getSourceRecord(id).ifPresent(records::add);
        }
        return records;
    }

    private static boolean isBareNcitId(String query) {
        return query.indexOf(':') < 0 && query.toLowerCase(Locale.ROOT).startsWith("c");
    }

    private static List<String> distinctGroupRefs(List<SourceRecord> candidates) {
        Map<String, String> refs = new LinkedHashMap<>();
        for (SourceRecord candidate : candidates) {
            String ref = candidate.getMergeRef().orElse(candidate.getConceptId());
            refs.putIfAbsent(ref.toLowerCase(Locale.ROOT), ref);
        }
        return new ArrayList<>(refs.values());
    }

    static List<QueryWarning> detectWarnings(String query) {
        List<QueryWarning> warnings = new ArrayList<>();
        if (query != null && (query.indexOf('\u00A0') >= 0 || query.toLowerCase(Locale.ROOT).contains("&nbsp;"))) {
            warnings.add(QueryWarning.nonBreakingSpace());
        }
        return warnings;
    }
}
