/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Map;

/** One JSON object per log line, for log shippers. */
final class VaultJsonLayout extends LayoutBase<ILoggingEvent> {

  @Override
  public String doLayout(ILoggingEvent event) {
    StringWriter buffer = new StringWriter(256);
    try (JsonWriter json = new JsonWriter(buffer)) {
      json.setHtmlSafe(false);
      json.beginObject();
      json.name("ts").value(Instant.ofEpochMilli(event.getTimeStamp()).toString());
      json.name("level").value(event.getLevel().toString());
      json.name("logger").value(event.getLoggerName());
      json.name("thread").value(event.getThreadName());
      json.name("message").value(event.getFormattedMessage());

      Map<String, String> mdc = event.getMDCPropertyMap();
      if (mdc != null && !mdc.isEmpty()) {
        json.name("mdc").beginObject();
        for (Map.Entry<String, String> entry : mdc.entrySet()) {
          json.name(entry.getKey()).value(entry.getValue());
        }
        json.endObject();
      }

      IThrowableProxy throwable = event.getThrowableProxy();
      if (throwable != null) {
        json.name("stack").value(ThrowableProxyUtil.asString(throwable));
      }
      json.endObject();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return buffer.append(System.lineSeparator()).toString();
  }
}
