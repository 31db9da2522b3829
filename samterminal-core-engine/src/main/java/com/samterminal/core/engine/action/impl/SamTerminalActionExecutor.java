package com.samterminal.core.engine.action.impl;

import com.samterminal.core.engine.action.ISamTerminalActionExecutor;
import com.samterminal.core.engine.service.ISamTerminalServiceRegistry;
import com.samterminal.core.exception.action.SamTerminalActionExecutionException;
import com.samterminal.core.exception.codes.SamTerminalInternalErrorCodes;
import com.samterminal.core.models.SamTerminalActionContext;
import com.samterminal.core.models.SamTerminalConstraintViolation;
import com.samterminal.core.models.SamTerminalProviderContext;
import com.samterminal.integration.constant.SamTerminalConstants;
import com.samterminal.integration.contract.ISamTerminalObjectMapper;
import com.samterminal.integration.contract.action.ISamTerminalAction;
import com.samterminal.integration.contract.action.ISamTerminalActionContext;
import com.samterminal.integration.contract.action.ISamTerminalActionResult;
import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;
import com.samterminal.integration.contract.provider.ISamTerminalProviderResult;
import com.samterminal.integration.exception.SamTerminalActionRuntimeException;
import com.samterminal.integration.models.actions.SamTerminalActionOutput;
import com.samterminal.integration.models.providers.SamTerminalProviderOutput;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class SamTerminalActionExecutor implements ISamTerminalActionExecutor {

    private final ISamTerminalServiceRegistry serviceRegistry;
    private final ISamTerminalObjectMapper objectMapper;
    private volatile ValidatorFactory validatorFactory;

    public SamTerminalActionExecutor(ISamTerminalServiceRegistry serviceRegistry, ISamTerminalObjectMapper objectMapper) {
        this.serviceRegistry = serviceRegistry;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ISamTerminalActionResult> execute(
            String pluginName,
            String actionName,
            Map<String, Object> params,
            Map<String, Object> variables,
            String executionId) {

        String qualifiedName = SamTerminalConstants.qualifiedName(pluginName, actionName);
        Map<String, Object> rawParams = params == null ? Map.of() : params;
        ISamTerminalActionContext context = new SamTerminalActionContext(
                executionId,
                pluginName,
                actionName,
                Collections.unmodifiableMap(new LinkedHashMap<>(rawParams)),
                variables == null ? Map.of() : Collections.unmodifiableMap(variables));

        return Mono.fromCallable(() -> serviceRegistry.getAction(pluginName, actionName))
                .doOnNext(action -> doPreStartActions(qualifiedName, context))

                // Input creation and validation
                .flatMap(action -> transformInput(qualifiedName, rawParams, action)
                        .flatMap(input -> validateInputConstraints(qualifiedName, input))
                        .flatMap(input -> validateActionInput(qualifiedName, input, action))

                        // Action execution
                        .flatMap(input -> doExecute(qualifiedName, input, context, action)))

                // an action completing without a result counts as success without data
                .switchIfEmpty(Mono.fromSupplier(SamTerminalActionOutput::ofEmpty))
                .flatMap(result -> checkReportedFailure(qualifiedName, result))

                .doOnNext(result -> doPostEndActions(qualifiedName, result))
                .doOnError(throwable -> doPostEndActions(qualifiedName, throwable));
    }

    private void doPreStartActions(String qualifiedName, ISamTerminalActionContext context) {
        log.debug("Starting action: [{}], executionId: [{}]", qualifiedName, context.getExecutionId());
    }

    private Mono<Object> transformInput(
            String qualifiedName,
            Map<String, Object> rawParams,
            ISamTerminalAction action) {

        Class<?> inputType = action.getInputType();
        if (inputType == null || inputType.isAssignableFrom(Map.class)) {
            return Mono.just(rawParams);
        }
        try {
            return Mono.just(objectMapper.convertValue(rawParams, inputType));
        } catch (Exception e) {
            return Mono.error(new SamTerminalActionExecutionException(
                    qualifiedName,
                    SamTerminalInternalErrorCodes.ACTION_INPUT_TRANSFORMATION_FAILED,
                    e));
        }
    }

    private Mono<Object> validateInputConstraints(String qualifiedName, Object input) {
        if (input instanceof Map) {
            return Mono.just(input);
        }

        Set<ConstraintViolation<Object>> violations;
        try {
            violations = getValidatorFactory().getValidator().validate(input);
        } catch (Exception e) {
            return Mono.error(new SamTerminalActionExecutionException(
                    qualifiedName,
                    SamTerminalInternalErrorCodes.ACTION_INPUT_CONSTRAINT_VIOLATION_EXECUTION_FAILED,
                    e));
        }

        if (!violations.isEmpty()) {
            List<SamTerminalConstraintViolation> constraintViolations = violations.stream()
                    .map(violation -> {
                        Map<String, String> templateVariables = new LinkedHashMap<>();
                        violation.getConstraintDescriptor()
                                .getAttributes()
                                .forEach((key, value) -> templateVariables.put(key, String.valueOf(value)));

                        return new SamTerminalConstraintViolation(
                                violation.getRootBeanClass(),
                                violation.getPropertyPath().toString(),
                                violation.getMessage(),
                                Collections.unmodifiableMap(templateVariables)
                        );
                    })
                    .toList();

            return Mono.error(new SamTerminalActionExecutionException(
                    qualifiedName,
                    SamTerminalInternalErrorCodes.ACTION_INPUT_CONSTRAINT_VIOLATION_FAILED,
                    constraintViolations));
        }
        return Mono.just(input);
    }

    private Mono<Object> validateActionInput(String qualifiedName, Object input, ISamTerminalAction action) {
        if (action.getInputValidator() == null) {
            return Mono.just(input);
        }
        try {
            action.getInputValidator().validate(input);
        } catch (SamTerminalActionRuntimeException e) {
            return Mono.error(new SamTerminalActionExecutionException(qualifiedName, e));
        } catch (Exception e) {
            return Mono.error(new SamTerminalActionExecutionException(
                    qualifiedName,
                    SamTerminalInternalErrorCodes.ACTION_INPUT_VALIDATION_PLUGIN_INTERNAL_ERROR,
                    e));
        }
        return Mono.just(input);
    }

    private Mono<ISamTerminalActionResult> doExecute(
            String qualifiedName,
            Object input,
            ISamTerminalActionContext context,
            ISamTerminalAction action) {

        Mono<ISamTerminalActionResult> result;
        try {
            result = action.getActionFunction().execute(input, context);
        } catch (Exception e) {
            return Mono.error(wrapActionError(qualifiedName, e));
        }
        return Mono.defer(() -> result == null ? Mono.<ISamTerminalActionResult>empty() : result)
                .onErrorMap(throwable -> !(throwable instanceof SamTerminalActionExecutionException),
                        throwable -> wrapActionError(qualifiedName, throwable));
    }

    private SamTerminalActionExecutionException wrapActionError(String qualifiedName, Throwable throwable) {
        if (throwable instanceof SamTerminalActionRuntimeException actionException) {
            return new SamTerminalActionExecutionException(qualifiedName, actionException);
        }
        return new SamTerminalActionExecutionException(
                qualifiedName,
                SamTerminalInternalErrorCodes.ACTION_EXECUTION_FAILED,
                throwable);
    }

    private Mono<ISamTerminalActionResult> checkReportedFailure(String qualifiedName, ISamTerminalActionResult result) {
        if (result.isSuccess()) {
            return Mono.just(result);
        }
        return Mono.error(SamTerminalActionExecutionException.ofReportedFailure(
                qualifiedName,
                SamTerminalInternalErrorCodes.ACTION_REPORTED_FAILURE,
                result.getError()));
    }

    private void doPostEndActions(String qualifiedName, ISamTerminalActionResult result) {
        log.debug("Action Completed: [{}]", qualifiedName);
    }

    private void doPostEndActions(String qualifiedName, Throwable throwable) {
        log.error("Action Failed: [{}], Error: [{}]", qualifiedName, throwable.getMessage());
    }

    @Override
    public Mono<ISamTerminalProviderResult> getData(
            String pluginName,
            String providerName,
            Map<String, Object> query) {

        String qualifiedName = SamTerminalConstants.qualifiedName(pluginName, providerName);
        SamTerminalProviderContext context = new SamTerminalProviderContext(
                pluginName,
                providerName,
                query == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query)));

        // an unknown provider is an error, a failing one is reported in the result
        return Mono.fromCallable(() -> serviceRegistry.getProvider(pluginName, providerName))
                .flatMap(provider -> query(qualifiedName, provider, context));
    }

    private Mono<ISamTerminalProviderResult> query(
            String qualifiedName,
            ISamTerminalDataProvider provider,
            SamTerminalProviderContext context) {

        return Mono.defer(() -> provider.getProviderFunction().get(context))
                .switchIfEmpty(Mono.fromSupplier(() -> SamTerminalProviderOutput.ofData(null)))
                .onErrorResume(throwable -> {
                    log.error("Provider Failed: [{}], Error: [{}]", qualifiedName, throwable.getMessage());
                    return Mono.just(SamTerminalProviderOutput.ofFailure(
                            SamTerminalInternalErrorCodes.PROVIDER_EXECUTION_FAILED.getErrorCode() + ": " + throwable.getMessage()));
                });
    }

    private ValidatorFactory getValidatorFactory() {
        if (validatorFactory == null) {
            synchronized (this) {
                if (validatorFactory == null) {
                    validatorFactory = Validation.byDefaultProvider()
                            .configure()
                            .messageInterpolator(new ParameterMessageInterpolator())
                            .buildValidatorFactory();
                }
            }
        }
        return validatorFactory;
    }
}
