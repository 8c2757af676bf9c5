package se.alipsa.refbridge.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ReferenceEngineConfigTest {

  @Test
  void appliesDefaults() {
    ReferenceEngineConfig config = ReferenceEngineConfig.of("http://localhost:8080/");
    assertEquals(URI.create("http://localhost:8080"), config.coordinatorUri());
    assertEquals("user", config.user());
    assertEquals("hive", config.catalog());
    assertEquals("tpch", config.schema());
    assertEquals(Duration.ofSeconds(10), config.timeout());
    assertEquals("", config.sessionProperty());
  }

  @Test
  void readsSettingsFromQueryStringAndProperties() {
    Properties props = new Properties();
    props.setProperty("schema", "fuzz");
    ReferenceEngineConfig config = ReferenceEngineConfig.fromUrl(
        "http://presto:8080?user=fuzzer&schema=tiny&timeoutMs=30000&session=query_max_memory%3D1GB", props);
    assertEquals(URI.create("http://presto:8080"), config.coordinatorUri());
    assertEquals("fuzzer", config.user());
    assertEquals("fuzz", config.schema());
    assertEquals(Duration.ofSeconds(30), config.timeout());
    assertEquals("query_max_memory=1GB", config.sessionProperty());
    assertEquals("", config.withSessionProperty(null).sessionProperty());
  }

  @Test
  void decodesQueryValuesAndIgnoresEmptyPairs() {
    ReferenceEngineConfig config = ReferenceEngineConfig.fromUrl("http://h:8080?&user=a%20b&&catalog=memory", null);
    assertEquals("a b", config.user());
    assertEquals("memory", config.catalog());
  }

  @Test
  void rejectsUnknownSettings() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> ReferenceEngineConfig.fromUrl("http://h:8080?user=a&password=secret", null));
    assertTrue(e.getMessage().startsWith("Unknown setting 'password'"));
  }

  @Test
  void rejectsInvalidTimeouts() {
    assertThrows(IllegalArgumentException.class, () -> ReferenceEngineConfig.fromUrl("http://h?timeoutMs=soon", null));
    assertThrows(IllegalArgumentException.class, () -> ReferenceEngineConfig.fromUrl("http://h?timeoutMs=0", null));
  }
}
