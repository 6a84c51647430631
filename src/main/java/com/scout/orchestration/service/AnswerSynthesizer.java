package com.scout.orchestration.service;

import com.scout.orchestration.model.StepResult;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Combines step answers into the final response. A single answer is returned as is; several
 * answers are labelled with their upper-cased intent and kept in plan order.
 */
@Service
public class AnswerSynthesizer {

    static final String SECTION_SEPARATOR = "\n\n";

    public String synthesize(@Nullable List<StepResult> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalStateException("Cannot synthesize an answer from zero step results");
        }
        if (results.size() == 1) {
            return results.get(0).answer();
        }
        return results.stream()
                .map(this::render)
                .collect(Collectors.joining(SECTION_SEPARATOR));
    }

    private String render(StepResult result) {
        return result.intent().toUpperCase(Locale.ROOT) + ": " + result.answer();
    }
}
