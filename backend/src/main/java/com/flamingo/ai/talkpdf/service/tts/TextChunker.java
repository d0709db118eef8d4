package com.flamingo.ai.talkpdf.service.tts;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a script into request-sized chunks on sentence boundaries.
 *
 * <p>Sentences longer than the limit are split on word boundaries; a single word longer than the
 * limit is cut. Every returned chunk is non-blank and at most {@code maxChars} long.
 */
public final class TextChunker {

  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TextChunker() {}

  public static List<String> chunk(String text, int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    List<String> chunks = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return chunks;
    }

    StringBuilder current = new StringBuilder();
    for (String sentence : SENTENCE_END.split(text.trim())) {
      if (fits(current, sentence, maxChars)) {
        append(current, sentence);
        continue;
      }
      flush(current, chunks);
      if (sentence.length() <= maxChars) {
        current.append(sentence);
        continue;
      }
      for (String word : WHITESPACE.split(sentence)) {
        if (fits(current, word, maxChars)) {
          append(current, word);
          continue;
        }
        flush(current, chunks);
        while (word.length() > maxChars) {
          chunks.add(word.substring(0, maxChars));
          word = word.substring(maxChars);
        }
        current.append(word);
      }
    }
    flush(current, chunks);
    return chunks;
  }

  private static boolean fits(StringBuilder current, String piece, int maxChars) {
    int separator = current.length() == 0 ? 0 : 1;
    return current.length() + separator + piece.length() <= maxChars;
  }

  private static void append(StringBuilder current, String piece) {
    if (current.length() > 0) {
      current.append(' ');
    }
    current.append(piece);
  }

  private static void flush(StringBuilder current, List<String> chunks) {
    String chunk = current.toString().trim();
    if (!chunk.isEmpty()) {
      chunks.add(chunk);
    }
    current.setLength(0);
  }
}
