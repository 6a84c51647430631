package com.scout.orchestration.service;

import com.scout.orchestration.model.StepResult;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Renders step results into the context text handed to later steps.
 */
@Service
public class OrchestrationContextService {

    static final String NO_CONTEXT = "No previous context";

    public String renderStep(StepResult result) {
        return "Step " + result.stepIndex() + " (" + result.intent() + "): " + result.answer();
    }

    /**
     * Appends one step to an existing context and returns the new context.
     */
    public String append(@Nullable String context, StepResult result) {
        String rendered = renderStep(result);
        if (!StringUtils.hasText(context)) {
            return rendered;
        }
        return context + "\n\n" + rendered;
    }

    public String defaultContext(@Nullable String context) {
        return StringUtils.hasText(context) ? context : NO_CONTEXT;
    }
}
