package com.flamingo.ai.talkpdf.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent translating a study summary into the listener's language before speech synthesis. */
public interface TranslationAgent {

  @SystemMessage(
      """
        You are a professional translator. Translate the user's text into {{language}}.
        Keep the meaning, tone and structure. Write natural, spoken {{language}} suitable for
        being read aloud. Return only the translated text, with no notes or explanations.
        """)
  @UserMessage("{{text}}")
  String translate(@V("language") String language, @V("text") String text);
}
