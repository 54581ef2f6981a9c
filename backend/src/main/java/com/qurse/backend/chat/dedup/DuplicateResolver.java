package com.qurse.backend.chat.dedup;

import com.qurse.backend.chat.domain.MessageParts;
import java.util.Comparator;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Decides whether two assistant messages of one conversation are the same logical answer, for
 * example a stopped partial copy saved by the client and the complete copy saved by the server.
 *
 * <p>Similarity is scored per channel (visible text, reasoning) and the channels are combined
 * with fixed thresholds. Every score is symmetric in its arguments.
 */
@Component
public class DuplicateResolver {

  static final double TEXT_THRESHOLD = 0.85;
  static final double TEXT_WITH_REASONING_THRESHOLD = 0.70;
  static final double REASONING_THRESHOLD = 0.80;
  static final double STOP_MARKER_TEXT_THRESHOLD = 0.75;

  static final int EXACT_MATCH_MAX_LENGTH = 10;
  static final int EDIT_DISTANCE_MAX_LENGTH = 255;
  static final int EDGE_LENGTH = 200;

  static final double PREFIX_SIMILARITY = 0.95;
  static final double PREFIX_AND_SUFFIX_SIMILARITY = 0.90;
  static final double CONTAINMENT_SIMILARITY = 0.85;

  /** A truncated reasoning counts as a copy when it covers this share of the shorter one. */
  static final double REASONING_PREFIX_FRACTION = 0.9;

  static final int REASONING_PREFIX_MIN_LENGTH = 20;

  private static final Comparator<UUID> ID_ORDER = Comparator.nullsLast(Comparator.naturalOrder());

  public boolean isDuplicate(AssistantCandidate a, AssistantCandidate b) {
    double text = textSimilarity(a.text(), b.text());
    if (text > TEXT_THRESHOLD) {
      return true;
    }
    String reasoningA = normalizeReasoning(a.reasoning());
    String reasoningB = normalizeReasoning(b.reasoning());
    if (text > TEXT_WITH_REASONING_THRESHOLD
        && reasoningSimilarity(reasoningA, reasoningB) > REASONING_THRESHOLD) {
      return true;
    }
    if (a.stopMarker() != b.stopMarker() && text > STOP_MARKER_TEXT_THRESHOLD) {
      return true;
    }
    return !reasoningA.isEmpty()
        && !reasoningB.isEmpty()
        && head(reasoningA).equals(head(reasoningB))
        && text > TEXT_WITH_REASONING_THRESHOLD;
  }

  /**
   * Picks the copy to keep: the one carrying the stop marker, then the longer text, then the
   * earlier row, then the lower id.
   */
  public DuplicateResolution choose(AssistantCandidate a, AssistantCandidate b) {
    if (a.stopMarker() != b.stopMarker()) {
      return a.stopMarker()
          ? new DuplicateResolution(a, b, DuplicateReason.STOP_MARKER)
          : new DuplicateResolution(b, a, DuplicateReason.STOP_MARKER);
    }
    int lengthA = normalizeText(a.text()).length();
    int lengthB = normalizeText(b.text()).length();
    if (lengthA != lengthB) {
      return lengthA > lengthB
          ? new DuplicateResolution(a, b, DuplicateReason.LESS_CONTENT)
          : new DuplicateResolution(b, a, DuplicateReason.LESS_CONTENT);
    }
    int byTime = compareCreatedAt(a, b);
    boolean keepA = byTime != 0 ? byTime < 0 : ID_ORDER.compare(a.id(), b.id()) <= 0;
    return keepA
        ? new DuplicateResolution(a, b, DuplicateReason.KEPT_EARLIER)
        : new DuplicateResolution(b, a, DuplicateReason.KEPT_EARLIER);
  }

  /**
   * Similarity of the visible text, ignoring the stop marker and whitespace differences. Emptiness
   * is judged on the raw input: a non-empty text never matches an empty one.
   */
  public double textSimilarity(String a, String b) {
    boolean emptyA = a == null || a.isEmpty();
    boolean emptyB = b == null || b.isEmpty();
    if (emptyA || emptyB) {
      return emptyA && emptyB ? 1.0 : 0.0;
    }
    return similarity(normalizeText(a), normalizeText(b));
  }

  /**
   * Similarity of the reasoning channel. A reasoning that stops early inside the other one scores
   * at least {@link #REASONING_PREFIX_FRACTION}.
   */
  public double reasoningSimilarity(String a, String b) {
    String left = normalizeReasoning(a);
    String right = normalizeReasoning(b);
    double score = similarity(left, right);
    if (left.isEmpty() || right.isEmpty()) {
      return score;
    }
    int shorter = Math.min(left.length(), right.length());
    if (shorter >= REASONING_PREFIX_MIN_LENGTH
        && commonPrefixLength(left, right) >= shorter * REASONING_PREFIX_FRACTION) {
      return Math.max(score, REASONING_PREFIX_FRACTION);
    }
    return score;
  }

  static double similarity(String a, String b) {
    if (a.isEmpty() || b.isEmpty()) {
      return a.equals(b) ? 1.0 : 0.0;
    }
    if (a.equals(b)) {
      return 1.0;
    }
    int maxLength = Math.max(a.length(), b.length());
    if (maxLength <= EXACT_MATCH_MAX_LENGTH) {
      return 0.0;
    }
    if (maxLength <= EDIT_DISTANCE_MAX_LENGTH) {
      return Math.max(0.0, 1.0 - (double) levenshtein(a, b) / maxLength);
    }
    return longSimilarity(a, b);
  }

  private static double longSimilarity(String a, String b) {
    String prefixA = head(a);
    String prefixB = head(b);
    if (prefixA.equals(prefixB)) {
      if (a.startsWith(b) || b.startsWith(a)) {
        return PREFIX_SIMILARITY;
      }
      if (tail(a).equals(tail(b))) {
        return PREFIX_AND_SUFFIX_SIMILARITY;
      }
    }
    double score = 1.0 - (double) levenshtein(prefixA, prefixB) / EDGE_LENGTH;
    if (a.contains(b) || b.contains(a)) {
      score = Math.max(score, CONTAINMENT_SIMILARITY);
    }
    return Math.max(0.0, score);
  }

  static int levenshtein(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      char left = a.charAt(i - 1);
      for (int j = 1; j <= b.length(); j++) {
        int substitution = previous[j - 1] + (left == b.charAt(j - 1) ? 0 : 1);
        current[j] = Math.min(substitution, Math.min(previous[j], current[j - 1]) + 1);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }

  static String normalizeText(String text) {
    if (text == null) {
      return "";
    }
    return text.replace(MessageParts.STOP_MARKER, "").replaceAll("\\s+", " ").trim();
  }

  static String normalizeReasoning(String reasoning) {
    if (reasoning == null) {
      return "";
    }
    return reasoning.replaceAll("\\s+", " ").trim();
  }

  private static int commonPrefixLength(String a, String b) {
    int limit = Math.min(a.length(), b.length());
    int index = 0;
    while (index < limit && a.charAt(index) == b.charAt(index)) {
      index++;
    }
    return index;
  }

  private static String head(String value) {
    return value.length() <= EDGE_LENGTH ? value : value.substring(0, EDGE_LENGTH);
  }

  private static String tail(String value) {
    return value.length() <= EDGE_LENGTH ? value : value.substring(value.length() - EDGE_LENGTH);
  }

  private static int compareCreatedAt(AssistantCandidate a, AssistantCandidate b) {
    if (a.createdAt() == null || b.createdAt() == null) {
      return 0;
    }
    return a.createdAt().compareTo(b.createdAt());
  }
}
