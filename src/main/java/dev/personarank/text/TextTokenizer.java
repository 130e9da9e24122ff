package dev.personarank.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Lexical helpers shared by persona classification, job analysis and relevance scoring.
 *
 * <p>Tokens are maximal runs of Unicode letters or digits, lowercased with {@link Locale#ROOT} and
 * passed through {@link #fold(String)} so that simple plurals ("hotels", "itineraries") compare
 * equal to their singular forms. All methods are pure functions.
 */
public final class TextTokenizer {

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

  /** Minimum length of a keyword extracted from free text (shorter tokens are too ambiguous). */
  static final int MIN_KEYWORD_LENGTH = 3;

  private static final Set<String> STOPWORDS =
      Set.of(
          "a", "about", "above", "after", "again", "against", "all", "also", "am", "an", "and",
          "any", "are", "as", "at", "be", "because", "been", "before", "being", "below",
          "between", "both", "but", "by", "can", "could", "did", "do", "does", "doing", "down",
          "during", "each", "few", "for", "from", "further", "had", "has", "have", "having", "he",
          "her", "here", "hers", "herself", "him", "himself", "his", "how", "i", "if", "in",
          "into", "is", "it", "its", "itself", "just", "me", "more", "most", "my", "myself", "no",
          "nor", "not", "now", "of", "off", "on", "once", "only", "or", "other", "our", "ours",
          "ourselves", "out", "over", "own", "same", "she", "should", "so", "some", "such",
          "than", "that", "the", "their", "theirs", "them", "themselves", "then", "there",
          "these", "they", "this", "those", "through", "to", "too", "under", "until", "up",
          "very", "was", "we", "were", "what", "when", "where", "which", "while", "who", "whom",
          "why", "will", "with", "would", "you", "your", "yours", "yourself", "yourselves");

  private TextTokenizer() {}

  /**
   * Splits text into lowercase, plural-folded word tokens in reading order. Duplicates are kept.
   *
   * @param text the text to tokenize (null is treated as empty)
   * @return the tokens; empty when the text has no letters or digits
   */
  public static List<String> tokenize(@Nullable String text) {
    List<String> raw = rawTokens(text);
    List<String> tokens = new ArrayList<>(raw.size());
    for (String token : raw) {
      tokens.add(fold(token));
    }
    return Collections.unmodifiableList(tokens);
  }

  /**
   * Extracts the distinct content keywords of a free-text description: tokens of at least three
   * characters that are not English stopwords, in first-occurrence order.
   *
   * @param text the description (null is treated as empty)
   * @return an unmodifiable, insertion-ordered keyword set
   */
  public static Set<String> keywords(@Nullable String text) {
    Set<String> keywords = new LinkedHashSet<>();
    for (String token : rawTokens(text)) {
      if (token.length() >= MIN_KEYWORD_LENGTH && !isStopword(token)) {
        keywords.add(fold(token));
      }
    }
    return Collections.unmodifiableSet(keywords);
  }

  /**
   * Normalises a lowercase token by removing a trailing plural suffix: {@code ies -> y} and a
   * single trailing {@code s}, except after {@code s}, {@code u} or {@code i} ("business",
   * "status", "analysis" are left alone). Tokens of three characters or fewer are unchanged.
   *
   * @param token a lowercase token
   * @return the folded token
   */
  public static String fold(String token) {
    int length = token.length();
    if (length <= 3) {
      return token;
    }
    if (token.endsWith("ies") && length > 4) {
      return token.substring(0, length - 3) + "y";
    }
    if (token.charAt(length - 1) == 's') {
      char previous = token.charAt(length - 2);
      if (previous != 's' && previous != 'u' && previous != 'i') {
        return token.substring(0, length - 1);
      }
    }
    return token;
  }

  /**
   * Folds every term of a vocabulary the same way document tokens are folded, so vocabularies can
   * be written in natural form. Multi-word terms are split into their tokens.
   *
   * @param terms the raw vocabulary terms
   * @return an unmodifiable set of folded tokens
   */
  public static Set<String> foldAll(Iterable<String> terms) {
    Set<String> folded = new LinkedHashSet<>();
    for (String term : terms) {
      folded.addAll(tokenize(term));
    }
    return Collections.unmodifiableSet(folded);
  }

  /**
   * Tests whether a term occurs in text starting at a word boundary. Both sides are lowercased and
   * their words re-joined with single spaces, so "Travelling consultant" contains "travel" and
   * "Human-Resources lead" contains "human resource", while "chrome" does not contain "hr".
   *
   * @param text the text to search (null is treated as empty)
   * @param term a word or phrase
   * @return {@code true} when some word of the text, or run of words, starts with the term
   */
  public static boolean containsWordStart(@Nullable String text, String term) {
    String needle = String.join(" ", rawTokens(term));
    if (needle.isEmpty()) {
      return false;
    }
    String haystack = " " + String.join(" ", rawTokens(text));
    return haystack.contains(" " + needle);
  }

  private static List<String> rawTokens(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    for (String part : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
      if (!part.isEmpty()) {
        tokens.add(part);
      }
    }
    return tokens;
  }

  static boolean isStopword(String token) {
    return STOPWORDS.contains(token);
  }
}
