package com.codeheadsystems.keyid.server.manager;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a User-Agent header into a short label such as {@code "Chrome 120.0 on Windows 10/11"}.
 */
public final class DeviceLabels {

  public static final String UNKNOWN_DEVICE = "Unknown Device";

  private static final Pattern EDGE = Pattern.compile("(?:Edge|Edg)/([\\d.]+)");
  private static final Pattern CHROME = Pattern.compile("(?:Chrome|CriOS)/([\\d.]+)");
  private static final Pattern FIREFOX = Pattern.compile("(?:Firefox|FxiOS)/([\\d.]+)");
  private static final Pattern SAFARI = Pattern.compile("Safari/([\\d.]+)");

  private static final Pattern WINDOWS = Pattern.compile("Windows NT ([\\d.]+)");
  private static final Pattern MAC = Pattern.compile("Mac OS X ([\\d_]+)");
  private static final Pattern ANDROID = Pattern.compile("Android ([\\d.]+)");
  private static final Pattern IOS = Pattern.compile("iPhone OS ([\\d_]+)");

  private static final Map<String, String> WINDOWS_VERSIONS = Map.of(
      "10.0", "Windows 10/11",
      "6.3", "Windows 8.1",
      "6.2", "Windows 8",
      "6.1", "Windows 7");

  private DeviceLabels() {
  }

  /**
   * Describes the device behind a User-Agent.
   *
   * @param userAgent the header value, may be null
   * @return "browser on os", or {@value #UNKNOWN_DEVICE} for a missing agent
   */
  public static String describe(String userAgent) {
    if (userAgent == null || userAgent.isBlank()) {
      return UNKNOWN_DEVICE;
    }
    return browser(userAgent) + " on " + operatingSystem(userAgent);
  }

  static String browser(String userAgent) {
    Matcher m;
    if ((m = EDGE.matcher(userAgent)).find()) {
      return "Edge " + m.group(1);
    }
    if ((m = CHROME.matcher(userAgent)).find()) {
      return "Chrome " + m.group(1);
    }
    if ((m = FIREFOX.matcher(userAgent)).find()) {
      return "Firefox " + m.group(1);
    }
    if ((m = SAFARI.matcher(userAgent)).find()) {
      return "Safari " + m.group(1);
    }
    return "Browser";
  }

  static String operatingSystem(String userAgent) {
    Matcher m;
    if ((m = WINDOWS.matcher(userAgent)).find()) {
      String nt = m.group(1);
      return WINDOWS_VERSIONS.getOrDefault(nt, "Windows (NT " + nt + ")");
    }
    if ((m = MAC.matcher(userAgent)).find()) {
      return "macOS " + m.group(1).replace('_', '.');
    }
    if ((m = ANDROID.matcher(userAgent)).find()) {
      return "Android " + m.group(1);
    }
    if ((m = IOS.matcher(userAgent)).find()) {
      return "iOS " + m.group(1).replace('_', '.');
    }
    if (userAgent.contains("Linux")) {
      return "Linux";
    }
    return "Unknown OS";
  }
}
