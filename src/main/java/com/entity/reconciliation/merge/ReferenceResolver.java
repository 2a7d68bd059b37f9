package com.entity.reconciliation.merge;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.SourceSide;
import com.entity.reconciliation.error.DependencyNotReadyException;

import java.util.Optional;

/**
 * Maps a source-specific foreign key to the master id of the referenced entity.
 */
@FunctionalInterface
public interface ReferenceResolver {

    /**
     * @param target the referenced entity type
     * @param side   the source the foreign key came from
     * @param ref    the source record id held in the foreign key
     * @return the master id, or empty if the referenced crosswalk has no such ref
     * @throws DependencyNotReadyException if the target's crosswalk is not available
     */
    Optional<String> resolve(EntityType target, SourceSide side, String ref);

    /**
     * Resolver for entity types without reference fields. Any lookup fails.
     */
    static ReferenceResolver none() {
        return (target, side, ref) -> {
            throw new DependencyNotReadyException(target, null, target,
                    "No crosswalk loaded for referenced type " + target);
        };
    }
}
