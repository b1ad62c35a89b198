package com.offerflow.test;

import com.offerflow.trigger.application.command.AssumptionCommandService;
import com.offerflow.trigger.application.command.DecisionCommandService;
import com.offerflow.trigger.application.command.DependencyCommandService;
import com.offerflow.trigger.application.command.EstimationCommandService;
import com.offerflow.trigger.application.command.LifecycleCommandService;
import com.offerflow.trigger.application.command.ModelAssistedPlanningService;
import com.offerflow.trigger.application.command.ServiceTaskCommandService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.annotation.Transactional;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class CommandTransactionBoundaryTest {

    private static final List<Class<?>> COMMAND_SERVICES = List.of(
            DependencyCommandService.class,
            EstimationCommandService.class,
            LifecycleCommandService.class,
            ServiceTaskCommandService.class,
            DecisionCommandService.class,
            AssumptionCommandService.class
    );

    @Test
    public void everyPublicCommandShouldRollBackOnAnyException() {
        for (Class<?> service : COMMAND_SERVICES) {
            for (Method method : service.getDeclaredMethods()) {
                if (!Modifier.isPublic(method.getModifiers()) || method.isSynthetic()) {
                    continue;
                }
                Transactional transactional = method.getAnnotation(Transactional.class);
                Assertions.assertNotNull(transactional,
                        () -> service.getSimpleName() + "." + method.getName() + " 必须声明事务");
                Assertions.assertTrue(Arrays.asList(transactional.rollbackFor()).contains(Exception.class),
                        () -> service.getSimpleName() + "." + method.getName() + " 必须对所有异常回滚");
            }
        }
    }

    @Test
    public void generatedPlanShouldBeSavedInOneTransaction() throws Exception {
        Method apply = LifecycleCommandService.class.getMethod("applyGeneratedPlan",
                Long.class, LocalDate.class, Map.class);
        Assertions.assertNotNull(apply.getAnnotation(Transactional.class), "applyGeneratedPlan 必须声明事务");
    }

    @Test
    public void modelCallsShouldStayOutsideTransactions() {
        Assertions.assertNull(ModelAssistedPlanningService.class.getAnnotation(Transactional.class));
        for (Method method : ModelAssistedPlanningService.class.getDeclaredMethods()) {
            Assertions.assertNull(method.getAnnotation(Transactional.class),
                    () -> "ModelAssistedPlanningService." + method.getName() + " 调用模型期间不应持有事务");
        }
    }
}
