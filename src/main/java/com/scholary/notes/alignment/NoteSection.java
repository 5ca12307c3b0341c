package com.scholary.notes.alignment;

/**
 * One heading-delimited section of a notes document.
 *
 * @param title heading text without the leading hashes
 * @param content body lines joined with newlines, empty for title-only sections
 * @param level heading depth, 1 to 6
 * @param kind title-only or content
 */
public record NoteSection(String title, String content, int level, SectionKind kind) {}
