package com.flamingo.ai.talkpdf.service.summary;

import com.flamingo.ai.talkpdf.domain.model.StudyPrompt;
import java.util.List;

/**
 * Summary and study prompts of a document.
 *
 * @param summary never blank for non-empty input
 * @param studyPrompts possibly empty
 * @param degraded true when the summary is a raw text excerpt instead of a model summary
 */
public record DocumentAnalysis(String summary, List<StudyPrompt> studyPrompts, boolean degraded) {}
