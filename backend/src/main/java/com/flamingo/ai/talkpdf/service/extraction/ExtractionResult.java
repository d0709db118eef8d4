package com.flamingo.ai.talkpdf.service.extraction;

import com.flamingo.ai.talkpdf.domain.model.PageContent;
import java.util.List;

/**
 * Text pulled out of a document.
 *
 * @param text full verbatim text
 * @param pages per-page text, empty when only the plain extraction path succeeded
 * @param pageCount number of pages kept, null when page structure is unknown
 */
public record ExtractionResult(String text, List<PageContent> pages, Integer pageCount) {

  public boolean hasPages() {
    return pages != null && !pages.isEmpty();
  }
}
