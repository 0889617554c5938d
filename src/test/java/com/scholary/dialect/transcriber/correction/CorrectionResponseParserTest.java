package com.scholary.dialect.transcriber.correction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class CorrectionResponseParserTest {

  private final CorrectionResponseParser parser = new CorrectionResponseParser(new ObjectMapper());

  @Test
  void parse_readsAllFields() {
    String reply =
        "{\"corrected_text\": \"عايز أدفع 25 جنيه.\", \"changes_made\": true,"
            + " \"requires_confirmation\": false}";

    CorrectionResult result = parser.parse(reply, "عايز ادفع ٢٥ جنيه");

    assertThat(result.correctedText()).isEqualTo("عايز أدفع 25 جنيه.");
    assertThat(result.changesMade()).isTrue();
    assertThat(result.requiresConfirmation()).isFalse();
    assertThat(result.originalText()).isEqualTo("عايز ادفع ٢٥ جنيه");
  }

  @Test
  void parse_stripsMarkdownFencesAndProse() {
    String reply =
        "Here is the correction:\n```json\n"
            + "{\"corrected_text\": \"hello.\", \"changes_made\": true,"
            + " \"requires_confirmation\": true}"
            + "\n```";

    CorrectionResult result = parser.parse(reply, "hello");

    assertThat(result.correctedText()).isEqualTo("hello.");
    assertThat(result.requiresConfirmation()).isTrue();
  }

  @Test
  void parse_derivesMissingFlags() {
    CorrectionResult unchanged = parser.parse("{\"corrected_text\": \"same\"}", "same");
    CorrectionResult changed = parser.parse("{\"corrected_text\": \"other\"}", "same");

    assertThat(unchanged.changesMade()).isFalse();
    assertThat(unchanged.requiresConfirmation()).isFalse();
    assertThat(changed.changesMade()).isTrue();
  }

  @Test
  void parse_ignoresOriginalTextInReply() {
    CorrectionResult result =
        parser.parse("{\"corrected_text\": \"a.\", \"original_text\": \"forged\"}", "a");

    assertThat(result.originalText()).isEqualTo("a");
  }

  @Test
  void parse_rejectsMissingCorrectedText() {
    assertThatThrownBy(() -> parser.parse("{\"changes_made\": false}", "text"))
        .isInstanceOf(CorrectionParseException.class);
  }

  @Test
  void parse_rejectsBlankCorrectedText() {
    assertThatThrownBy(() -> parser.parse("{\"corrected_text\": \"  \"}", "text"))
        .isInstanceOf(CorrectionParseException.class);
  }

  @Test
  void parse_rejectsWrongFieldTypes() {
    assertThatThrownBy(() -> parser.parse("{\"corrected_text\": 42}", "text"))
        .isInstanceOf(CorrectionParseException.class);
    assertThatThrownBy(
            () -> parser.parse("{\"corrected_text\": \"x\", \"changes_made\": \"yes\"}", "text"))
        .isInstanceOf(CorrectionParseException.class);
  }

  @Test
  void parse_rejectsNonJson() {
    assertThatThrownBy(() -> parser.parse("I cannot help with that.", "text"))
        .isInstanceOf(CorrectionParseException.class);
    assertThatThrownBy(() -> parser.parse("{not json at all}", "text"))
        .isInstanceOf(CorrectionParseException.class);
    assertThatThrownBy(() -> parser.parse("", "text"))
        .isInstanceOf(CorrectionParseException.class);
  }
}
