package com.entity.reconciliation.merge;

import com.entity.reconciliation.audit.ConflictLogEntry;
import com.entity.reconciliation.config.CodeMappingTable;
import com.entity.reconciliation.config.FieldPolicy;
import com.entity.reconciliation.config.FieldRule;
import com.entity.reconciliation.config.PipelineConfig;
import com.entity.reconciliation.config.SystemOfRecordPolicy;
import com.entity.reconciliation.core.hash.Fingerprints;
import com.entity.reconciliation.core.model.CrosswalkEntry;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MergedRecord;
import com.entity.reconciliation.core.model.SourceRecord;
import com.entity.reconciliation.core.model.SourceSide;
import com.entity.reconciliation.crosswalk.SourceRecordOrdering;
import com.entity.reconciliation.error.DependencyNotReadyException;
import com.entity.reconciliation.quality.DataQualityScorer;
import com.entity.reconciliation.quality.QualityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Resolves one canonical record per crosswalk entry from the contributing source records.
 *
 * <p>For every configured field both source values are normalized (and code-mapped,
 * and for reference fields resolved to master ids). The field's rule then picks a value,
 * falling back to the other source when the preferred one is null. A tracked field whose
 * normalized values are both present and differ produces one conflict entry.</p>
 *
 * <p>Entries are independent, so they may be merged in parallel; output is sorted by master id.</p>
 */
public class FieldMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(FieldMergeEngine.class);

    public static final String MERGED_SUFFIX = "_MERGED";

    private final DataQualityScorer scorer;
    private final CodeMappingTable codeMappings;
    private final PipelineConfig config;
    private final DerivedFieldCalculator derivedFields = new DerivedFieldCalculator();

    public FieldMergeEngine(DataQualityScorer scorer, CodeMappingTable codeMappings, PipelineConfig config) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.codeMappings = Objects.requireNonNull(codeMappings, "codeMappings is required");
        this.config = Objects.requireNonNull(config, "config is required");
    }

    /**
     * Merges a batch.
     *
     * @param crosswalk the batch's crosswalk; {@code null} means it was never built
     * @throws DependencyNotReadyException if the crosswalk is absent or names a source record
     *                                     that is not among the supplied records
     */
    public MergeOutcome merge(EntityType entityType, String batchId, List<CrosswalkEntry> crosswalk,
                              Collection<SourceRecord> sourceA, Collection<SourceRecord> sourceB,
                              SystemOfRecordPolicy policy, ReferenceResolver references,
                              Instant processingTime) {
        Objects.requireNonNull(policy, "policy is required");
        Objects.requireNonNull(references, "references is required");
        if (crosswalk == null) {
            throw new DependencyNotReadyException(entityType, batchId, entityType,
                    "Crosswalk for " + entityType + " batch " + batchId + " has not been built");
        }

        Map<String, SourceRecord> indexA = index(sourceA);
        Map<String, SourceRecord> indexB = index(sourceB);

        Stream<CrosswalkEntry> stream = config.isParallelMerge() ? crosswalk.parallelStream() : crosswalk.stream();
        List<EntryMerge> merged = stream
                .map(entry -> mergeEntry(entry, lookup(entry, SourceSide.A, indexA), lookup(entry, SourceSide.B, indexB),
                        policy, references, processingTime))
                .sorted(Comparator.comparing(m -> m.record().masterId()))
                .toList();

        List<MergedRecord> records = new ArrayList<>(merged.size());
        List<ConflictLogEntry> conflicts = new ArrayList<>();
        for (EntryMerge m : merged) {
            records.add(m.record());
            conflicts.addAll(m.conflicts());
        }
        MergeOutcome outcome = new MergeOutcome(records, conflicts);
        log.info("merge.completed entityType={} batchId={} records={} conflicts={} unresolvedReferences={}",
                entityType, batchId, records.size(), conflicts.size(), outcome.unresolvedReferenceCount());
        return outcome;
    }

    private record EntryMerge(MergedRecord record, List<ConflictLogEntry> conflicts) {}

    private EntryMerge mergeEntry(CrosswalkEntry entry, SourceRecord a, SourceRecord b,
                                  SystemOfRecordPolicy policy, ReferenceResolver references,
                                  Instant processingTime) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        List<Object> trackedValues = new ArrayList<>();
        List<String> conflictFields = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        List<ConflictLogEntry> conflicts = new ArrayList<>();

        for (FieldPolicy field : policy.fields()) {
            FieldValue va = fieldValue(field, SourceSide.A, a, references);
            FieldValue vb = fieldValue(field, SourceSide.B, b, references);

            SourceSide primary = field.primaryOr(entry.primarySource());
            SourceSide preferred = field.rule() == FieldRule.MOST_RECENT ? mostRecent(a, b, primary) : primary;
            FieldValue chosen = pick(preferred, va, vb);
            FieldValue resolved = chosen.value() != null ? chosen : pick(preferred.other(), va, vb);

            attributes.put(field.name(), resolved.value());
            if (resolved.unresolved()) {
                unresolved.add(field.name());
            }
            if (field.tracked()) {
                trackedValues.add(resolved.value());
                if (va.value() != null && vb.value() != null && !va.value().equals(vb.value())) {
                    conflictFields.add(field.name());
                    conflicts.add(ConflictLogEntry.builder()
                            .entityType(entry.entityType())
                            .batchId(entry.batchId())
                            .entityId(entry.masterId())
                            .fieldName(field.name())
                            .sourceAValue(Fingerprints.render(va.value()))
                            .sourceBValue(Fingerprints.render(vb.value()))
                            .resolvedValue(Fingerprints.render(resolved.value()))
                            .resolutionRule(field.rule())
                            .timestamp(processingTime)
                            .build());
                }
            }
        }

        derivedFields.apply(policy.derivedFields(), attributes);
        QualityResult quality = scorer.score(attributes, policy.qualityRules());

        MergedRecord record = new MergedRecord(
                entry.entityType(),
                entry.batchId(),
                entry.masterId(),
                config.labelFor(entry.primarySource()) + MERGED_SUFFIX,
                attributes,
                Fingerprints.fingerprint(trackedValues),
                quality.score(),
                quality.issues(),
                conflictFields,
                unresolved);
        return new EntryMerge(record, conflicts);
    }

    private record FieldValue(Object value, boolean unresolved) {
        static final FieldValue ABSENT = new FieldValue(null, false);
    }

    private FieldValue fieldValue(FieldPolicy field, SourceSide side, SourceRecord record, ReferenceResolver references) {
        if (record == null) {
            return FieldValue.ABSENT;
        }
        Object value = field.normalizer().normalize(record.attribute(field.sourceField(side)));
        if (value == null) {
            return FieldValue.ABSENT;
        }
        if (field.codeMapping() != null) {
            Optional<String> mapped = codeMappings.lookup(field.codeMapping(), side, value.toString());
            if (mapped.isPresent()) {
                value = mapped.get();
            }
        }
        if (field.isReference()) {
            Optional<String> masterId = references.resolve(field.references(), side, value.toString());
            return masterId.isPresent()
                    ? new FieldValue(masterId.get(), false)
                    : new FieldValue(value, true);
        }
        return new FieldValue(value, false);
    }

    private static FieldValue pick(SourceSide side, FieldValue a, FieldValue b) {
        return side == SourceSide.A ? a : b;
    }

    private static SourceSide mostRecent(SourceRecord a, SourceRecord b, SourceSide primary) {
        if (a == null) {
            return SourceSide.B;
        }
        if (b == null) {
            return SourceSide.A;
        }
        int cmp = a.ingestionTime().compareTo(b.ingestionTime());
        if (cmp == 0) {
            return primary;
        }
        return cmp > 0 ? SourceSide.A : SourceSide.B;
    }

    private static Map<String, SourceRecord> index(Collection<SourceRecord> records) {
        Map<String, SourceRecord> index = new HashMap<>();
        for (SourceRecord record : records) {
            String key = record.trimmedKey();
            if (key == null || record.sourceRecordId() == null) {
                continue;
            }
            index.merge(indexKey(record.sourceRecordId(), key), record, (current, candidate) ->
                    SourceRecordOrdering.MOST_RECENT.compare(candidate, current) > 0 ? candidate : current);
        }
        return index;
    }

    private static String indexKey(String sourceRecordId, String naturalKey) {
        return sourceRecordId + '\u0000' + naturalKey;
    }

    private static SourceRecord lookup(CrosswalkEntry entry, SourceSide side, Map<String, SourceRecord> index) {
        String ref = entry.refFor(side);
        if (ref == null) {
            return null;
        }
        SourceRecord record = index.get(indexKey(ref, entry.masterId()));
        if (record == null) {
            throw new DependencyNotReadyException(entry.entityType(), entry.batchId(), entry.masterId(),
                    "Source " + side + " record " + ref + " referenced by the crosswalk is not available");
        }
        return record;
    }
}
