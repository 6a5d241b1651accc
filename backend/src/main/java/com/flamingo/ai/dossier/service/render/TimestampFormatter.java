package com.flamingo.ai.dossier.service.render;

import com.flamingo.ai.dossier.config.DossierConfig;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/** Renders epoch-second timestamps in the configured zone. */
@Component
public class TimestampFormatter {

  private final ZoneId zoneId;

  public TimestampFormatter(DossierConfig dossierConfig) {
    this.zoneId = ZoneId.of(dossierConfig.getZoneId());
  }

  /** ISO-8601 with offset, e.g. {@code 2024-03-01T09:30:00-03:00}; empty for {@code 0}. */
  public String format(double epochSeconds) {
    if (epochSeconds == 0) {
      return "";
    }
    return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(toInstant(epochSeconds).atZone(zoneId));
  }

  /** {@code yyyy-MM-dd}, or {@code Unknown} for {@code 0}. */
  public String formatDate(double epochSeconds) {
    if (epochSeconds == 0) {
      return "Unknown";
    }
    return DateTimeFormatter.ISO_LOCAL_DATE.format(toInstant(epochSeconds).atZone(zoneId));
  }

  public String format(Instant instant) {
    return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant.atZone(zoneId));
  }

  private static Instant toInstant(double epochSeconds) {
    long seconds = (long) Math.floor(epochSeconds);
    long nanos = Math.round((epochSeconds - seconds) * 1_000_000) * 1_000L;
    return Instant.ofEpochSecond(seconds, nanos);
  }
}
