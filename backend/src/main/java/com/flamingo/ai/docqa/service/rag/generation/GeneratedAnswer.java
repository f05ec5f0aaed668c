package com.flamingo.ai.docqa.service.rag.generation;

import java.util.List;

/**
 * Output of {@link AnswerGenerator}.
 *
 * @param grounded false when no context was available and the answer says so
 * @param degraded true when generation timed out and a placeholder message was returned
 */
public record GeneratedAnswer(
    String answerText, List<SourceReference> sources, boolean grounded, boolean degraded) {}
