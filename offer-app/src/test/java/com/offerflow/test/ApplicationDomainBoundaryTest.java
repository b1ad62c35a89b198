package com.offerflow.test;

import com.offerflow.domain.ai.service.ToolCallingDomainService;
import com.offerflow.domain.dependency.service.DependencyGraphDomainService;
import com.offerflow.domain.estimation.service.BacklogRankingDomainService;
import com.offerflow.domain.lifecycle.service.LifecyclePlanDomainService;
import com.offerflow.domain.lifecycle.service.PhaseSequencerDomainService;
import com.offerflow.trigger.application.command.DependencyCommandService;
import com.offerflow.trigger.application.command.EstimationCommandService;
import com.offerflow.trigger.application.command.LifecycleCommandService;
import com.offerflow.trigger.application.command.ModelAssistedPlanningService;
import com.offerflow.trigger.application.command.ServiceTaskCommandService;
import com.offerflow.trigger.application.query.LifecycleQueryService;
import com.offerflow.trigger.application.query.PlanningQueryService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.Arrays;

public class ApplicationDomainBoundaryTest {

    @Test
    public void applicationServicesShouldDependOnDomainServices() {
        Assertions.assertTrue(hasFieldType(DependencyCommandService.class, DependencyGraphDomainService.class));
        Assertions.assertTrue(hasFieldType(ModelAssistedPlanningService.class, ToolCallingDomainService.class));
        Assertions.assertTrue(hasFieldType(LifecycleCommandService.class, PhaseSequencerDomainService.class));
        Assertions.assertTrue(hasFieldType(LifecycleCommandService.class, LifecyclePlanDomainService.class));
        Assertions.assertTrue(hasFieldType(ServiceTaskCommandService.class, LifecyclePlanDomainService.class));
        Assertions.assertTrue(hasFieldType(LifecycleQueryService.class, PhaseSequencerDomainService.class));
        Assertions.assertTrue(hasFieldType(PlanningQueryService.class, DependencyGraphDomainService.class));
        Assertions.assertTrue(hasFieldType(PlanningQueryService.class, BacklogRankingDomainService.class));
    }

    @Test
    public void modelCallsShouldGoThroughToolCallingDomainService() {
        for (Class<?> owner : new Class<?>[]{DependencyCommandService.class, EstimationCommandService.class,
                LifecycleCommandService.class, ModelAssistedPlanningService.class}) {
            Assertions.assertFalse(Arrays.stream(owner.getDeclaredFields())
                            .map(field -> field.getType().getSimpleName())
                            .anyMatch("IToolCallingModelGateway"::equals),
                    () -> owner.getSimpleName() + " should not call the model gateway directly");
        }
    }

    @Test
    public void transactionalCommandServicesShouldNotCallTheModel() {
        for (Class<?> owner : new Class<?>[]{DependencyCommandService.class, EstimationCommandService.class,
                LifecycleCommandService.class}) {
            Assertions.assertFalse(hasFieldType(owner, ToolCallingDomainService.class),
                    () -> owner.getSimpleName() + " should not hold a model connection inside its transactions");
        }
    }

    private boolean hasFieldType(Class<?> owner, Class<?> expectedType) {
        return Arrays.stream(owner.getDeclaredFields())
                .map(Field::getType)
                .anyMatch(type -> type.equals(expectedType));
    }
}
