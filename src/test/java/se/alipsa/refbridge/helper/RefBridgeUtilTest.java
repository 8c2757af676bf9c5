package se.alipsa.refbridge.helper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class RefBridgeUtilTest {

  @Test
  void stripsFileScheme() {
    assertEquals("/data/t_0/000000_0", RefBridgeUtil.stripFileScheme("file:/data/t_0/000000_0"));
    assertEquals("/data/t_0/000000_0", RefBridgeUtil.stripFileScheme("file:///data/t_0/000000_0"));
    assertEquals("hdfs://nn/t_0/f", RefBridgeUtil.stripFileScheme("hdfs://nn/t_0/f"));
    assertNull(RefBridgeUtil.stripFileScheme(null));
  }
}
