package com.mk.fx.qa.load.bench.metrics;

import com.mk.fx.qa.load.bench.dto.report.LoadRunReport;
import java.util.ArrayList;
import java.util.List;

/** Maps transport failures onto stable error types and builds report samples from them. */
final class ErrorClassifier {

  private ErrorClassifier() {}

  static String classify(Throwable t) {
    if (t == null) return "UNKNOWN";
    var clsName = rootCause(t).getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException", "UnresolvedAddressException" -> "UNKNOWN_HOST";
      case "SSLException", "SSLHandshakeException" -> "SSL_ERROR";
      case "HttpTimeoutException", "HttpConnectTimeoutException" -> "HTTP_TIMEOUT";
      case "ClosedChannelException", "EOFException" -> "CONNECTION_CLOSED";
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }

  static LoadRunReport.ErrorSample sample(String type, Throwable t) {
    var root = rootCause(t);

    String msg = t.getMessage();
    if (msg == null || msg.equals("null")) {
      msg = root.getMessage();
    }
    if (msg == null || msg.equals("null")) {
      msg = root.getClass().getSimpleName() + " occurred";
    }

    List<String> frames = new ArrayList<>();
    if (root != t) {
      frames.add(
          "ROOT CAUSE: "
              + root.getClass().getSimpleName()
              + " - "
              + (root.getMessage() != null ? root.getMessage() : "no message"));
      appendFrames(frames, root.getStackTrace(), 3);
      frames.add("");
    }
    frames.add("WRAPPED BY: " + t.getClass().getSimpleName());
    appendFrames(frames, t.getStackTrace(), 10);

    return new LoadRunReport.ErrorSample(type, msg, List.copyOf(frames));
  }

  private static Throwable rootCause(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root;
  }

  private static void appendFrames(List<String> frames, StackTraceElement[] stack, int max) {
    int limit = Math.min(max, stack.length);
    for (int i = 0; i < limit; i++) {
      var frame = stack[i];
      frames.add(
          "  at "
              + frame.getClassName()
              + "."
              + frame.getMethodName()
              + "("
              + frame.getFileName()
              + ":"
              + frame.getLineNumber()
              + ")");
    }
  }
}
