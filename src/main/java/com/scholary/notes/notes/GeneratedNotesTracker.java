package com.scholary.notes.notes;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Remembers recently generated notes so near-duplicates can be regenerated.
 *
 * <p>Backed by a bounded Caffeine cache from content hash to the lowercased introduction (first
 * 200 characters). Notes are "similar" when their hash is known or their introduction shares more
 * than 70% of its words with a remembered one.
 */
public class GeneratedNotesTracker {

  static final int INTRO_CHARS = 200;
  static final double INTRO_SIMILARITY_THRESHOLD = 0.7;

  private final Cache<String, String> introductions;

  public GeneratedNotesTracker(int maxSize, Duration expireAfterWrite) {
    this.introductions =
        Caffeine.newBuilder().maximumSize(maxSize).expireAfterWrite(expireAfterWrite).build();
  }

  public boolean isSimilar(String notes) {
    if (introductions.getIfPresent(hash(notes)) != null) {
      return true;
    }
    String intro = intro(notes);
    for (String recent : introductions.asMap().values()) {
      if (wordOverlap(intro, recent) > INTRO_SIMILARITY_THRESHOLD) {
        return true;
      }
    }
    return false;
  }

  public void track(String notes) {
    introductions.put(hash(notes), intro(notes));
  }

  long size() {
    introductions.cleanUp();
    return introductions.estimatedSize();
  }

  /** Jaccard index of the two texts' word sets. */
  static double wordOverlap(String text1, String text2) {
    Set<String> words1 = words(text1);
    Set<String> words2 = words(text2);
    if (words1.isEmpty() || words2.isEmpty()) {
      return 0.0;
    }
    Set<String> union = new HashSet<>(words1);
    union.addAll(words2);
    Set<String> intersection = new HashSet<>(words1);
    intersection.retainAll(words2);
    return (double) intersection.size() / union.size();
  }

  private static Set<String> words(String text) {
    if (text == null || text.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(text.toLowerCase(Locale.ROOT).trim().split("\\s+"))
        .collect(Collectors.toSet());
  }

  private static String intro(String notes) {
    String head = notes.length() > INTRO_CHARS ? notes.substring(0, INTRO_CHARS) : notes;
    return head.toLowerCase(Locale.ROOT).strip();
  }

  private static String hash(String notes) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(notes.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
