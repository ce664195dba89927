package com.onthegomap.tilestash.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class TilestashConfigTest {

  @Test
  void testDefaults() {
    TilestashConfig config = TilestashConfig.defaults();
    assertEquals(Duration.ofSeconds(4), config.directTimeout());
    assertEquals(Duration.ofSeconds(5), config.relayTimeout());
    assertEquals(Duration.ofSeconds(6), config.raceTimeout());
    assertEquals(500, config.minTileBytes());
    assertEquals(20, config.effectiveConcurrency());
    assertEquals(50, config.cacheLookupBatch());
    assertEquals(Duration.ofMillis(500), config.progressInterval());
    assertEquals(Duration.ofSeconds(10), config.checkpointInterval());
    assertEquals(Duration.ofHours(24), config.checkpointMaxAge());
    assertEquals(Duration.ofSeconds(1), config.retryDelay());
    assertEquals(Duration.ofMillis(300), config.basemapRetryWait());
    assertEquals(Duration.ofSeconds(10), config.basemapTimeout());
    assertEquals(2, config.basemapRetries());
    assertEquals(Duration.ofSeconds(3), config.errorDisplay());
    assertEquals(TilestashConfig.DEFAULT_RELAYS, config.relays());
    assertEquals(TilestashConfig.BRAZIL_BOUNDS, config.region());
    assertEquals(Path.of("data", "tiles.db"), config.tileCacheFile());
    assertEquals(Locale.forLanguageTag("pt-BR"), config.locale());
  }

  @Test
  void testConstrainedDeviceUsesLowerConcurrency() {
    TilestashConfig config = TilestashConfig.from(Arguments.of("constrained_device", "true"));
    assertEquals(10, config.effectiveConcurrency());
    assertEquals(7, TilestashConfig.from(Arguments.of("constrained_device", "true", "constrained_concurrency", "7"))
      .effectiveConcurrency());
  }

  @Test
  void testOverrides() {
    TilestashConfig config = TilestashConfig.from(Arguments.of(
      "data_dir", "/tmp/tiles",
      "relays", "https://relay.example/?u=",
      "concurrency", "4"
    ));
    assertEquals(Path.of("/tmp/tiles", "state"), config.stateDir());
    assertEquals(List.of("https://relay.example/?u="), config.relays());
    assertEquals(4, config.effectiveConcurrency());
  }

  @Test
  void testValidation() {
    assertThrows(IllegalArgumentException.class,
      () -> TilestashConfig.from(Arguments.of("concurrency", "0")));
    assertThrows(IllegalArgumentException.class,
      () -> TilestashConfig.from(Arguments.of("success_ratio", "1.5")));
    assertThrows(IllegalArgumentException.class,
      () -> TilestashConfig.from(Arguments.of("cache_lookup_batch", "0")));
  }
}
