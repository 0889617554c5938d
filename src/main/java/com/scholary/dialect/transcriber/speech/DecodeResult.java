package com.scholary.dialect.transcriber.speech;

import com.scholary.dialect.transcriber.confidence.TokenDistribution;

/** What the speech model returns for one window: text plus per-step distributions. */
public record DecodeResult(String text, TokenDistribution distribution) {

  public DecodeResult {
    text = text == null ? "" : text;
    distribution = distribution == null ? TokenDistribution.EMPTY : distribution;
  }
}
