package com.scholary.dialect.transcriber.correction;

/** One chunk's text sent to the corrector, with the confidence and policy it was routed by. */
public record CorrectionRequest(String text, double confidence, CorrectionPolicy policy) {}
