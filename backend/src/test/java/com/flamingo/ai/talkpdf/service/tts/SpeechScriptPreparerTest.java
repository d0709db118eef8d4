package com.flamingo.ai.talkpdf.service.tts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.config.PipelineConfig.PlanLimits;
import com.flamingo.ai.talkpdf.service.translation.TranslationResult;
import com.flamingo.ai.talkpdf.service.translation.TranslationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SpeechScriptPreparerTest {

  @Mock private TranslationService translationService;

  @InjectMocks private SpeechScriptPreparer preparer;

  private final PlanLimits free = new PipelineConfig().getPlans().getFree();

  @Test
  void shouldCollapseWhitespace() {
    when(translationService.translate(anyString(), eq("en")))
        .thenAnswer(inv -> TranslationResult.original(inv.getArgument(0)));

    SpeechScript script = preparer.prepare("  First line.\n\n  Second\tline.  ", "en", free);

    assertThat(script.text()).isEqualTo("First line. Second line.");
    assertThat(script.translationApplied()).isFalse();
    assertThat(script.wordCount()).isEqualTo(4);
  }

  @Test
  void shouldCapTextBeforeAndAfterTranslation() {
    String summary = "a".repeat(3000);
    when(translationService.translate(anyString(), eq("yo")))
        .thenAnswer(
            inv -> {
              String source = inv.getArgument(0);
              assertThat(source).hasSize(2000);
              return new TranslationResult("b".repeat(2500), true);
            });

    SpeechScript script = preparer.prepare(summary, "yo", free);

    assertThat(script.text()).hasSize(2000);
    assertThat(script.translationApplied()).isTrue();
  }
}
