package com.onthegomap.tilestash.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FormatTest {

  private final Format format = Format.forLocale(Locale.US);

  @ParameterizedTest
  @CsvSource({
    "0,0",
    "600,600",
    "1500,1.5k",
    "99999,99k",
    "1000000,1M",
    "2500000000,2.5G",
    "-1,-",
  })
  void testStorage(long bytes, String expected) {
    assertEquals(expected, format.storage(bytes));
  }

  @Test
  void testDuration() {
    assertEquals("0.5s", format.duration(Duration.ofMillis(500)));
    assertEquals("1m30s", format.duration(Duration.ofSeconds(90)));
    assertEquals("2h", format.duration(Duration.ofHours(2)));
  }

  @Test
  void testPercentAndInteger() {
    assertEquals("91%", format.percent(0.91));
    assertEquals("12,345", format.integer(12345));
  }
}
