package com.example.curator.rag.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CodeFenceUtilsTest {

  @Test
  void stripsJsonFence() {
    String fenced = "```json\n[\"fhir\", \"vbc\"]\n```";

    assertThat(CodeFenceUtils.stripFences(fenced)).isEqualTo("[\"fhir\", \"vbc\"]");
  }

  @Test
  void stripsBareAndUppercaseFences() {
    assertThat(CodeFenceUtils.stripFences("```\n[\"grants\"]\n```")).isEqualTo("[\"grants\"]");
    assertThat(CodeFenceUtils.stripFences("```JSON [\"billing\"] ```")).isEqualTo("[\"billing\"]");
  }

  @Test
  void leavesUnfencedTextTrimmed() {
    assertThat(CodeFenceUtils.stripFences("  [\"compliance\"]\n")).isEqualTo("[\"compliance\"]");
  }

  @Test
  void nullBecomesEmpty() {
    assertThat(CodeFenceUtils.stripFences(null)).isEmpty();
  }
}
