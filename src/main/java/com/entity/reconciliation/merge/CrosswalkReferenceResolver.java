package com.entity.reconciliation.merge;

import com.entity.reconciliation.core.model.CrosswalkEntry;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.SourceSide;
import com.entity.reconciliation.crosswalk.CrosswalkRepository;
import com.entity.reconciliation.error.DependencyNotReadyException;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves foreign keys through the referenced types' crosswalks for the same batch.
 * A source A foreign key is matched against source A refs, a source B key against source B refs.
 */
public final class CrosswalkReferenceResolver implements ReferenceResolver {

    private final EntityType owner;
    private final String batchId;
    private final Map<EntityType, Map<SourceSide, Map<String, String>>> index;

    private CrosswalkReferenceResolver(EntityType owner, String batchId,
                                       Map<EntityType, Map<SourceSide, Map<String, String>>> index) {
        this.owner = owner;
        this.batchId = batchId;
        this.index = index;
    }

    /**
     * Loads the crosswalks of all target types for the batch.
     *
     * @throws DependencyNotReadyException if any target's crosswalk is missing
     */
    public static CrosswalkReferenceResolver load(CrosswalkRepository repository, EntityType owner,
                                                  String batchId, Set<EntityType> targets) {
        Map<EntityType, Map<SourceSide, Map<String, String>>> index = new EnumMap<>(EntityType.class);
        for (EntityType target : targets) {
            List<CrosswalkEntry> entries = repository.findBatch(target, batchId)
                    .orElseThrow(() -> new DependencyNotReadyException(owner, batchId, target,
                            "Crosswalk for " + target + " batch " + batchId + " is not available"));
            Map<SourceSide, Map<String, String>> bySide = new EnumMap<>(SourceSide.class);
            for (SourceSide side : SourceSide.values()) {
                bySide.put(side, new HashMap<>());
            }
            for (CrosswalkEntry entry : entries) {
                for (SourceSide side : SourceSide.values()) {
                    String ref = entry.refFor(side);
                    if (ref != null) {
                        bySide.get(side).put(ref, entry.masterId());
                    }
                }
            }
            index.put(target, bySide);
        }
        return new CrosswalkReferenceResolver(owner, batchId, index);
    }

    @Override
    public Optional<String> resolve(EntityType target, SourceSide side, String ref) {
        Map<SourceSide, Map<String, String>> bySide = index.get(target);
        if (bySide == null) {
            throw new DependencyNotReadyException(owner, batchId, target,
                    "Crosswalk for " + target + " was not loaded");
        }
        if (ref == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bySide.get(side).get(ref));
    }
}
