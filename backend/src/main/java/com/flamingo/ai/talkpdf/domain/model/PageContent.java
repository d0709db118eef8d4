package com.flamingo.ai.talkpdf.domain.model;

/** Verbatim text of one page, with the chapter heading it falls under when known. */
public record PageContent(int page, String text, String chapter) {}
