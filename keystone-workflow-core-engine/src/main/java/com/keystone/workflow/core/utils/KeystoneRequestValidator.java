package com.keystone.workflow.core.utils;

import com.keystone.workflow.core.exception.task.TaskRequestValidationException;
import com.keystone.workflow.core.models.KeystoneConstraintViolation;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bean Validation of task service requests against the {@code ValidationMessages} bundle.
 * Messages are interpolated with annotation parameters only, so no expression language
 * implementation is needed on the classpath.
 */
public final class KeystoneRequestValidator {

    private static volatile ValidatorFactory validatorFactory;

    private KeystoneRequestValidator() {
    }

    private static Validator getValidator() {
        if (validatorFactory == null) {
            synchronized (KeystoneRequestValidator.class) {
                if (validatorFactory == null) {
                    validatorFactory = Validation.byDefaultProvider()
                            .configure()
                            .messageInterpolator(new ParameterMessageInterpolator())
                            .buildValidatorFactory();
                }
            }
        }
        return validatorFactory.getValidator();
    }

    public static List<KeystoneConstraintViolation> findViolations(Object request) {
        Set<ConstraintViolation<Object>> violations = getValidator().validate(request);
        return violations.stream()
                .map(violation -> {
                    Map<String, String> templateVariables = new LinkedHashMap<>();
                    violation.getConstraintDescriptor()
                            .getAttributes()
                            .forEach((key, value) -> templateVariables.put(key, String.valueOf(value)));

                    return new KeystoneConstraintViolation(
                            violation.getRootBeanClass(),
                            violation.getPropertyPath().toString(),
                            violation.getMessage(),
                            Collections.unmodifiableMap(templateVariables)
                    );
                })
                .toList();
    }

    /**
     * @throws TaskRequestValidationException if the request violates any constraint
     */
    public static <T> T validate(T request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        List<KeystoneConstraintViolation> violations = findViolations(request);
        if (!violations.isEmpty()) {
            throw new TaskRequestValidationException(request.getClass().getSimpleName(), violations);
        }
        return request;
    }
}
