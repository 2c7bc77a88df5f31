package com.caseflow.orchestrator.integration.models;

import com.caseflow.orchestrator.integration.contract.ICaseFlowCase;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionExecutor;
import com.caseflow.orchestrator.integration.contract.plugin.ICaseFlowWorkflowPlugin;
import com.caseflow.orchestrator.integration.contract.precondition.ICaseFlowPrecondition;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

@Getter
@AllArgsConstructor
@ToString
public class CaseFlowWorkflowPlugin implements ICaseFlowWorkflowPlugin {
    private final String identifier;
    private final String description;
    private final String primaryInputField;
    private final List<ICaseFlowActionExecutor> actionExecutors;
    private final List<ICaseFlowPrecondition> preconditions;
    private final List<String> decisionRules;
    @ToString.Exclude
    private final Function<ICaseFlowCase, Map<String, Object>> caseDescriber;

    @Override
    public Map<String, Object> describeCase(ICaseFlowCase caseFlowCase) {
        return caseDescriber == null ? Map.of() : caseDescriber.apply(caseFlowCase);
    }

    // ---------------------------------------------------------
    // Guided Builder
    // ---------------------------------------------------------

    public static IdentifierStep builder() { return new Builder(); }

    public interface IdentifierStep {
        DescriptionStep identifier(String identifier);
    }

    public interface DescriptionStep {
        PrimaryInputStep description(String description);
    }

    public interface PrimaryInputStep {
        ExecutorStep primaryInputField(String primaryInputField);
    }

    public interface ExecutorStep {
        ExecutorStep executor(Supplier<ICaseFlowActionExecutor> executorSupplier);
        PreconditionStep preconditions();
    }

    public interface PreconditionStep {
        PreconditionStep precondition(ICaseFlowPrecondition precondition);
        PreconditionStep decisionRule(String rule);
        PreconditionStep caseDescriber(Function<ICaseFlowCase, Map<String, Object>> caseDescriber);
        CaseFlowWorkflowPlugin build();
    }

    private static class Builder implements IdentifierStep, DescriptionStep, PrimaryInputStep, ExecutorStep, PreconditionStep {
        private String identifier;
        private String description;
        private String primaryInputField;
        private final List<ICaseFlowActionExecutor> executors = new ArrayList<>();
        private final List<ICaseFlowPrecondition> preconditions = new ArrayList<>();
        private final List<String> decisionRules = new ArrayList<>();
        private Function<ICaseFlowCase, Map<String, Object>> caseDescriber;

        @Override
        public DescriptionStep identifier(String identifier) {
            this.identifier = Objects.requireNonNull(identifier, "identifier");
            return this;
        }

        @Override
        public PrimaryInputStep description(String description) {
            this.description = description;
            return this;
        }

        @Override
        public ExecutorStep primaryInputField(String primaryInputField) {
            this.primaryInputField = Objects.requireNonNull(primaryInputField, "primaryInputField");
            return this;
        }

        @Override
        public ExecutorStep executor(Supplier<ICaseFlowActionExecutor> executorSupplier) {
            this.executors.add(Objects.requireNonNull(executorSupplier.get(), "executor"));
            return this;
        }

        @Override
        public PreconditionStep preconditions() {
            return this;
        }

        @Override
        public PreconditionStep precondition(ICaseFlowPrecondition precondition) {
            this.preconditions.add(Objects.requireNonNull(precondition, "precondition"));
            return this;
        }

        @Override
        public PreconditionStep decisionRule(String rule) {
            this.decisionRules.add(rule);
            return this;
        }

        @Override
        public PreconditionStep caseDescriber(Function<ICaseFlowCase, Map<String, Object>> caseDescriber) {
            this.caseDescriber = caseDescriber;
            return this;
        }

        @Override
        public CaseFlowWorkflowPlugin build() {
            return new CaseFlowWorkflowPlugin(
                    identifier, description, primaryInputField,
                    List.copyOf(executors), List.copyOf(preconditions), List.copyOf(decisionRules),
                    caseDescriber);
        }
    }
}
