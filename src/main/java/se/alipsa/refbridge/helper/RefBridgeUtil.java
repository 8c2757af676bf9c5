package se.alipsa.refbridge.helper;

/** Helpers for locations reported by the reference engine. */
public final class RefBridgeUtil {

  private RefBridgeUtil() {
  }

  /**
   * Turn a file location reported by the reference engine into a local path.
   *
   * @param location
   *          e.g. {@code file:/data/hive/t_0/000000_0}
   * @return the location without its {@code file:} scheme
   */
  public static String stripFileScheme(String location) {
    if (location == null) {
      return null;
    }
    if (location.startsWith("file://")) {
      return location.substring("file://".length());
    }
    if (location.startsWith("file:")) {
      return location.substring("file:".length());
    }
    return location;
  }
}
