package com.scholary.notes.alignment;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class NoteSectionParserTest {

  @Test
  void parse_shouldSplitAtHeadings() {
    String notes =
        "Preamble that belongs to no section\n"
            + "# Course\n"
            + "\n"
            + "## Sets\n"
            + "  Sets are collections.  \n"
            + "\n"
            + "They have no duplicates.\n"
            + "### Examples\n"
            + "Integers.\n";

    List<NoteSection> sections = NoteSectionParser.parse(notes);

    assertThat(sections)
        .containsExactly(
            new NoteSection("Course", "", 1, SectionKind.TITLE_ONLY),
            new NoteSection(
                "Sets", "Sets are collections.\nThey have no duplicates.", 2, SectionKind.CONTENT),
            new NoteSection("Examples", "Integers.", 3, SectionKind.CONTENT));
  }

  @Test
  void parse_shouldIgnoreHashWithoutSpace() {
    List<NoteSection> sections = NoteSectionParser.parse("## Tags\n#hashtag line\n####### seven");

    assertThat(sections).hasSize(1);
    assertThat(sections.get(0).content()).isEqualTo("#hashtag line\n####### seven");
  }

  @Test
  void parse_shouldReturnEmptyForBlankNotes() {
    assertThat(NoteSectionParser.parse("")).isEmpty();
    assertThat(NoteSectionParser.parse(null)).isEmpty();
  }
}
