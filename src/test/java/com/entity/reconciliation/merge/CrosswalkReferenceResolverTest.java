package com.entity.reconciliation.merge;

import com.entity.reconciliation.core.model.CrosswalkEntry;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MatchMethod;
import com.entity.reconciliation.core.model.SourceSide;
import com.entity.reconciliation.crosswalk.InMemoryCrosswalkRepository;
import com.entity.reconciliation.error.DependencyNotReadyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrosswalkReferenceResolver Tests")
class CrosswalkReferenceResolverTest {

    private static final String BATCH = "B1";

    private static InMemoryCrosswalkRepository veteranCrosswalk() {
        InMemoryCrosswalkRepository repository = new InMemoryCrosswalkRepository();
        repository.replaceBatch(EntityType.VETERAN, BATCH, List.of(
                new CrosswalkEntry(EntityType.VETERAN, BATCH, "123", "OMS-1", "VEMS-9", 100,
                        MatchMethod.BOTH_EXACT, SourceSide.A),
                new CrosswalkEntry(EntityType.VETERAN, BATCH, "456", null, "VEMS-5", 90,
                        MatchMethod.SOURCE_B_ONLY, SourceSide.A)));
        return repository;
    }

    @Test
    @DisplayName("Refs resolve against the crosswalk of the same side")
    void resolvesPerSide() {
        CrosswalkReferenceResolver resolver = CrosswalkReferenceResolver.load(veteranCrosswalk(),
                EntityType.EXAM_REQUEST, BATCH, Set.of(EntityType.VETERAN));

        assertEquals(Optional.of("123"), resolver.resolve(EntityType.VETERAN, SourceSide.A, "OMS-1"));
        assertEquals(Optional.of("123"), resolver.resolve(EntityType.VETERAN, SourceSide.B, "VEMS-9"));
        assertEquals(Optional.of("456"), resolver.resolve(EntityType.VETERAN, SourceSide.B, "VEMS-5"));
        assertEquals(Optional.empty(), resolver.resolve(EntityType.VETERAN, SourceSide.A, "VEMS-5"));
    }

    @Test
    @DisplayName("Missing target crosswalk fails loading")
    void missingTargetCrosswalk() {
        DependencyNotReadyException ex = assertThrows(DependencyNotReadyException.class, () ->
                CrosswalkReferenceResolver.load(veteranCrosswalk(), EntityType.EXAM_REQUEST, BATCH,
                        EnumSet.of(EntityType.VETERAN, EntityType.FACILITY)));
        assertEquals(EntityType.FACILITY, ex.getMissingDependency());
        assertEquals(EntityType.EXAM_REQUEST, ex.getEntityType());
    }

    @Test
    @DisplayName("Resolving a type that was not loaded fails")
    void unloadedTarget() {
        CrosswalkReferenceResolver resolver = CrosswalkReferenceResolver.load(veteranCrosswalk(),
                EntityType.EXAM_REQUEST, BATCH, Set.of(EntityType.VETERAN));

        assertThrows(DependencyNotReadyException.class, () ->
                resolver.resolve(EntityType.EVALUATOR, SourceSide.A, "E-1"));
    }

    @Test
    @DisplayName("The empty resolver refuses every lookup")
    void noneResolver() {
        assertThrows(DependencyNotReadyException.class, () ->
                ReferenceResolver.none().resolve(EntityType.VETERAN, SourceSide.A, "OMS-1"));
    }
}
