package com.flamingo.ai.talkpdf.config;

import com.flamingo.ai.talkpdf.domain.enums.PlanTier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the document pipeline. */
@Configuration
@ConfigurationProperties(prefix = "talkpdf")
@Getter
@Setter
public class PipelineConfig {

  /** Supported audio languages: code to human-readable label used in prompts. */
  private Map<String, String> languages = defaultLanguages();

  private Plans plans = new Plans();
  private Extraction extraction = new Extraction();
  private Analysis analysis = new Analysis();
  private Translation translation = new Translation();
  private Tts tts = new Tts();
  private RateLimit rateLimit = new RateLimit();
  private Storage storage = new Storage();

  /** Limits of the given tier. */
  public PlanLimits limitsFor(PlanTier tier) {
    return switch (tier) {
      case PRO -> plans.getPro();
      case PLUS -> plans.getPlus();
      case FREE -> plans.getFree();
    };
  }

  /** Human-readable label of a language code, or the code itself when unknown. */
  public String languageLabel(String code) {
    return languages.getOrDefault(code, code);
  }

  private static Map<String, String> defaultLanguages() {
    Map<String, String> languages = new LinkedHashMap<>();
    languages.put("en", "English");
    languages.put("yo", "Yoruba");
    languages.put("ha", "Hausa");
    languages.put("ig", "Igbo");
    languages.put("pcm", "Nigerian Pidgin");
    return languages;
  }

  @Getter
  @Setter
  public static class Plans {
    private PlanLimits free = new PlanLimits(0, 5000, 200, 350, 3, 5, 2000, 2000, 1);
    private PlanLimits plus = new PlanLimits(30, 8000, 400, 700, 5, 8, 3000, 6000, 3);
    private PlanLimits pro = new PlanLimits(50, 12000, 800, 1200, 8, 12, 4000, 15000, 8);
  }

  /** Per-tier budgets applied to a single pipeline run. */
  @Getter
  @Setter
  public static class PlanLimits {
    /** Pages kept from page-structured extraction; 0 disables it. */
    private int maxPages;

    /** Characters of extracted text fed to the analysis call. */
    private int analysisChars;

    private int summaryMinWords;
    private int summaryMaxWords;
    private int minStudyPrompts;
    private int maxStudyPrompts;

    /** Completion token budget of the analysis call. */
    private int maxTokens;

    /** Characters of script sent to speech synthesis. */
    private int ttsChars;

    /** Chunks synthesized by chunking providers. */
    private int maxTtsChunks;

    public PlanLimits() {}

    public PlanLimits(
        int maxPages,
        int analysisChars,
        int summaryMinWords,
        int summaryMaxWords,
        int minStudyPrompts,
        int maxStudyPrompts,
        int maxTokens,
        int ttsChars,
        int maxTtsChunks) {
      this.maxPages = maxPages;
      this.analysisChars = analysisChars;
      this.summaryMinWords = summaryMinWords;
      this.summaryMaxWords = summaryMaxWords;
      this.minStudyPrompts = minStudyPrompts;
      this.maxStudyPrompts = maxStudyPrompts;
      this.maxTokens = maxTokens;
      this.ttsChars = ttsChars;
      this.maxTtsChunks = maxTtsChunks;
    }
  }

  @Getter
  @Setter
  public static class Extraction {
    private int minTextChars = 50;
    private double temperature = 0.1;
    private int maxOutputTokens = 16000;
  }

  @Getter
  @Setter
  public static class Analysis {
    /** Characters of extracted text used as summary when analysis fails. */
    private int fallbackChars = 1500;

    private int minSummaryChars = 50;
  }

  @Getter
  @Setter
  public static class Translation {
    /** Translations at or below this length are discarded. */
    private int minChars = 20;
  }

  @Getter
  @Setter
  public static class Tts {
    /** Payloads at or below this size are treated as failures. */
    private int minAudioBytes = 1024;

    private double wordsPerSecond = 2.5;
    private int previewChars = 100;
    private List<String> providerOrder = new ArrayList<>(List.of("yarngpt", "gemini", "elevenlabs"));
    private Provider yarngpt = new Provider();
    private Provider gemini = new Provider();
    private Provider elevenlabs = new Provider();
  }

  /** Connection and voice settings of one speech provider. */
  @Getter
  @Setter
  public static class Provider {
    private boolean enabled = true;
    private String baseUrl;
    private String apiKey;
    private String model;
    private String outputFormat;
    private int maxRequestChars = 5000;
    private int timeoutSeconds = 60;

    /** Languages the provider may be used for; empty means all. */
    private List<String> languages = new ArrayList<>();

    /** Voice per language code. */
    private Map<String, String> voices = new LinkedHashMap<>();

    private String defaultVoice;
  }

  @Getter
  @Setter
  public static class RateLimit {
    private String actionKey = "process-document";
    private long windowMs = 60_000;
    private int maxRequests = 5;
    private long cleanupIntervalMs = 300_000;
  }

  @Getter
  @Setter
  public static class Storage {
    private String basePath = "./data/blobs";
  }
}
