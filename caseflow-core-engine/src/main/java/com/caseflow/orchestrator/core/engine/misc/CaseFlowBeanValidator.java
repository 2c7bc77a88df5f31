package com.caseflow.orchestrator.core.engine.misc;

import com.caseflow.orchestrator.core.exception.misc.CaseFlowValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bean validation of requests and configuration. Messages are interpolated without an
 * expression language, so constraint messages must be literal or use {@code {param}} only.
 */
public class CaseFlowBeanValidator {

    private final Validator validator;

    private CaseFlowBeanValidator() {
        ValidatorFactory validatorFactory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        this.validator = validatorFactory.getValidator();
    }

    private static final class SingletonHolder {
        private static final CaseFlowBeanValidator INSTANCE = new CaseFlowBeanValidator();
    }

    public static CaseFlowBeanValidator getInstance() {
        return SingletonHolder.INSTANCE;
    }

    /**
     * @throws CaseFlowValidationException listing every violation, sorted by property path
     */
    public <T> T validate(T bean) {
        if (bean == null) {
            throw new CaseFlowValidationException(List.of("value must not be null"));
        }
        Set<ConstraintViolation<T>> violations = validator.validate(bean);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.toList());
            throw new CaseFlowValidationException(messages);
        }
        return bean;
    }
}
