package com.acme.amqp.topology;

/**
 * Renders a millisecond TTL as a compact human readable string made of the non-zero day, hour,
 * minute, second and millisecond components, in that order.
 *
 * <p>Examples: 5000 -> {@code 5s}, 65000 -> {@code 1m5s}, 3600000 -> {@code 1h}, 1500 -> {@code
 * 1s500ms}. The output only contains letters and digits, so it is safe as a queue name suffix and
 * as a topic binding key.
 */
public final class TtlFormatter {

  private static final long SECOND = 1000L;
  private static final long MINUTE = 60 * SECOND;
  private static final long HOUR = 60 * MINUTE;
  private static final long DAY = 24 * HOUR;

  private TtlFormatter() {}

  public static String format(long ttlMs) {
    if (ttlMs < 0) {
      throw new IllegalArgumentException("TTL must not be negative: " + ttlMs);
    }
    if (ttlMs == 0) {
      return "0ms";
    }
    StringBuilder sb = new StringBuilder();
    long rest = ttlMs;
    rest = append(sb, rest, DAY, "d");
    rest = append(sb, rest, HOUR, "h");
    rest = append(sb, rest, MINUTE, "m");
    rest = append(sb, rest, SECOND, "s");
    if (rest > 0) {
      sb.append(rest).append("ms");
    }
    return sb.toString();
  }

  private static long append(StringBuilder sb, long rest, long unit, String suffix) {
    long count = rest / unit;
    if (count > 0) {
      sb.append(count).append(suffix);
    }
    return rest % unit;
  }
}
