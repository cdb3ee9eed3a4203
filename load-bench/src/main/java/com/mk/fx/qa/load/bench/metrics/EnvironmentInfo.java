package com.mk.fx.qa.load.bench.metrics;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** Host and trigger information attached to run reports. */
public final class EnvironmentInfo {

  private EnvironmentInfo() {}

  /** Host name from the environment, else the resolved local host name, else {@code "unknown"}. */
  public static String host() {
    var env = firstNonBlank(System.getenv("HOSTNAME"), System.getenv("COMPUTERNAME"));
    if (env != null) return env;
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return "unknown";
    }
  }

  /** {@code TRIGGERED_BY} from the environment, else the OS user name. */
  public static String triggeredBy() {
    var who = firstNonBlank(System.getenv("TRIGGERED_BY"), System.getProperty("user.name"));
    return who != null ? who : "unknown";
  }

  private static String firstNonBlank(String a, String b) {
    if (a != null && !a.isBlank()) return a;
    if (b != null && !b.isBlank()) return b;
    return null;
  }
}
