package com.scholary.dialect.transcriber.correction;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders the post-correction prompt for a dialect-preserving corrector.
 *
 * <p>The prompt fixes the rules the corrector must follow: keep the dialect and its colloquial
 * markers, write numerals as Western digits, end sentences with proper punctuation, keep embedded
 * English words, and never summarize, translate into the standard register or add content.
 */
public class CorrectionPromptBuilder {

  private static final String TEMPLATE =
      "You are an ASR post-correction model specialized in **%1$s**.\n"
          + "\n"
          + "Input Metadata:\n"
          + "- ASR Confidence Score: %2$s (Scale 0.0 to 1.0)\n"
          + "- Policy: %3$s\n"
          + "\n"
          + "Task:\n"
          + "- Correct the text while preserving the meaning **and the %1$s dialect**.\n"
          + "- Fix grammar, punctuation, spacing, and word boundaries.\n"
          + "- Keep all colloquial expressions (e.g., %4$s).\n"
          + "- Do **NOT** convert anything to the standard written register.\n"
          + "- Convert any Eastern Arabic numerals (e.g., \"٢٥\") into Western digits (\"25\").\n"
          + "- Maintain a consistent conversational flow between the **agent** and the **customer**.\n"
          + "- If the conversation contains English words, keep them unchanged.\n"
          + "- Do not rewrite, summarize, or add new information; only correct what is there.\n"
          + "- If sentence flow is broken, fix it while preserving meaning.\n"
          + "- End every statement with a full stop, every question with a question mark and every exclamation with an exclamation mark.\n"
          + "\n"
          + "ASR text:\n"
          + "\"\"\"%5$s\"\"\"\n"
          + "\n"
          + "Return ONLY a JSON object with exactly these fields:\n"
          + "{\"corrected_text\": string, \"changes_made\": boolean, \"requires_confirmation\": boolean}\n";

  private final String dialect;
  private final String colloquialExamples;

  public CorrectionPromptBuilder(String dialect, List<String> colloquialExamples) {
    this.dialect = dialect;
    this.colloquialExamples =
        colloquialExamples.stream().map(e -> "\"" + e + "\"").collect(Collectors.joining(", "));
  }

  public String build(CorrectionRequest request) {
    return String.format(
        Locale.ROOT,
        TEMPLATE,
        dialect,
        String.format(Locale.ROOT, "%.2f", request.confidence()),
        request.policy().instruction(),
        colloquialExamples,
        request.text());
  }
}
