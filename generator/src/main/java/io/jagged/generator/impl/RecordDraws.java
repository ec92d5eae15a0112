package io.jagged.generator.impl;

import io.jagged.generator.api.DecisionTape;
import io.jagged.layout.Content;
import io.jagged.layout.RecordContent;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Draws a record or tuple over already-built fields.
 *
 * <p>Named records get short ASCII-letter names. A name that is already taken is replaced by
 * {@code f<position>}, extended with underscores until unique, so naming never needs a retry.
 */
public final class RecordDraws {
  private static final String LETTERS =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
  private static final int MAX_NAME_LENGTH = 3;

  private RecordDraws() {}

  /**
   * Combines {@code contents} into a record of length {@code min(shortest field, maxLength)}.
   *
   * @param tape the decision tape
   * @param contents the fields
   * @param allowTuple whether the record may be a tuple
   * @param maxLength ceiling on the record length
   * @return the record
   */
  public static Content draw(
      DecisionTape tape, List<Content> contents, boolean allowTuple, int maxLength) {
    boolean tuple = allowTuple && tape.drawBoolean();
    List<String> fields = tuple ? null : drawFieldNames(tape, contents.size());
    int shortest = contents.stream().mapToInt(Content::length).min().orElse(0);
    return new RecordContent(contents, fields, Math.min(shortest, maxLength));
  }

  static List<String> drawFieldNames(DecisionTape tape, int count) {
    List<String> names = new ArrayList<>(count);
    Set<String> taken = new HashSet<>();
    for (int i = 0; i < count; i++) {
      String name = drawName(tape);
      if (taken.contains(name)) {
        name = "f" + i;
        while (taken.contains(name)) {
          name = name + "_";
        }
      }
      taken.add(name);
      names.add(name);
    }
    return names;
  }

  private static String drawName(DecisionTape tape) {
    int len = tape.drawInt(0, MAX_NAME_LENGTH);
    StringBuilder sb = new StringBuilder(len);
    for (int i = 0; i < len; i++) {
      sb.append(LETTERS.charAt(tape.drawInt(0, LETTERS.length() - 1)));
    }
    return sb.toString();
  }
}
