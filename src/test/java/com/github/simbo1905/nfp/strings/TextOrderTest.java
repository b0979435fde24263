package com.github.simbo1905.nfp.strings;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.*;

import java.util.Comparator;
import org.junit.Test;

/// Tests for the two lexical orders a text index can use.
public class TextOrderTest {

  private static final String EMOJI = "😀";
  private static final String LAST_BMP = "￿";

  @Test
  public void testAsciiAgrees() {
    for (TextOrder order : TextOrder.values()) {
      final Comparator<String> cmp = order.comparator();
      assertThat(cmp.compare("B", "a"), lessThan(0));
      assertThat(cmp.compare("abc", "ab"), greaterThan(0));
      assertEquals(0, cmp.compare("same", "same"));
    }
  }

  @Test
  public void testSupplementaryCharactersFollowUtf8() {
    // UTF-16 puts the surrogate pair first, UTF-8 puts U+1F600 after U+FFFF
    assertThat(TextOrder.UTF16.comparator().compare(EMOJI, LAST_BMP), lessThan(0));
    assertThat(TextOrder.UTF8_BYTES.comparator().compare(EMOJI, LAST_BMP), greaterThan(0));
    assertThat(
        TextOrder.UTF8_BYTES.comparator().compare("x" + EMOJI, "x" + LAST_BMP), greaterThan(0));
  }

  @Test
  public void testSharedHighSurrogate() {
    final String smile = "😀";
    final String grin = "😁";
    assertThat(TextOrder.UTF8_BYTES.comparator().compare(smile, grin), lessThan(0));
    assertThat(TextOrder.UTF8_BYTES.comparator().compare(grin, smile), greaterThan(0));
  }

  @Test
  public void testNonAsciiBmp() {
    assertThat(TextOrder.UTF8_BYTES.comparator().compare("z", "é"), lessThan(0));
    assertThat(TextOrder.UTF8_BYTES.comparator().compare("é", "ë"), lessThan(0));
  }

  @Test
  public void testUnpairedSurrogatesStayDistinct() {
    final Comparator<String> cmp = TextOrder.UTF8_BYTES.comparator();
    assertThat(cmp.compare("\uD800", "\uDC00"), lessThan(0));
    assertThat(cmp.compare("\uDC00", "\uD800"), greaterThan(0));
    assertThat(cmp.compare("?", "\uD800"), lessThan(0));
    assertThat(cmp.compare("\uD800", "?"), greaterThan(0));
    assertThat(cmp.compare("a\uD800", "a\uDC00"), lessThan(0));
    assertEquals(0, cmp.compare("\uD800", "\uD800"));
    // a lone high surrogate sorts below any supplementary character
    assertThat(cmp.compare("\uD800", EMOJI), lessThan(0));
    assertThat(cmp.compare(LAST_BMP, "\uDC00"), greaterThan(0));
  }

  @Test
  public void testStoreHonoursConfiguredOrder() {
    try (DedupStringStore store =
        DedupStringStore.Builder().textOrder(TextOrder.UTF16).open()) {
      store.add(LAST_BMP);
      store.add(EMOJI);
      final StringBuilder walked = new StringBuilder();
      store.walk(StringKey.TEXT, (id, text, refCount) -> walked.append(id));
      assertEquals("10", walked.toString());
    }
  }
}
