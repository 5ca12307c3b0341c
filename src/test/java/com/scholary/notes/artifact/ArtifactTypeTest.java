package com.scholary.notes.artifact;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ArtifactTypeTest {

  @Test
  void fromName_shouldAcceptDashedLowerCaseNames() {
    assertThat(ArtifactType.fromName("notes-markdown")).contains(ArtifactType.NOTES_MARKDOWN);
    assertThat(ArtifactType.fromName("NOTES_SRT")).contains(ArtifactType.NOTES_SRT);
    assertThat(ArtifactType.fromName(" timestamped-json ")).contains(ArtifactType.TIMESTAMPED_JSON);
  }

  @Test
  void fromName_shouldRejectUnknownNames() {
    assertThat(ArtifactType.fromName("audio")).isEmpty();
    assertThat(ArtifactType.fromName(null)).isEmpty();
  }

  @Test
  void fileName_shouldAppendSuffixToJobId() {
    assertThat(ArtifactType.TRANSCRIPT.fileName("abc")).isEqualTo("abc_transcription.txt");
    assertThat(ArtifactType.NOTES_VTT.isTimestamped()).isTrue();
    assertThat(ArtifactType.NOTES_TEXT.isTimestamped()).isFalse();
  }
}
