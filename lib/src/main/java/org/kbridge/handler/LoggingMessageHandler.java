package org.kbridge.handler;

import com.dslplatform.json.DslJson;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.function.Predicate;
import org.kbridge.messaging.Msg;

/**
 * A message processor that logs each message as a JSON line and accepts it.
 *
 * <p>Features:
 *
 * <ul>
 *   <li>JSON formatting of message id, timestamp, size and payload
 *   <li>UTF-8 payloads are logged as text, JSON payloads collapsed to a single line
 *   <li>Fallback to Base64 encoding for binary data
 *   <li>Skips formatting when the log level is disabled
 * </ul>
 */
public class LoggingMessageHandler implements Predicate<Msg> {

  private static final DslJson<Object> DSL_JSON = new DslJson<>();
  private final Logger logger;
  private final Level logLevel;

  /** Creates a handler logging at INFO. */
  public LoggingMessageHandler() {
    this(System.getLogger(LoggingMessageHandler.class.getName()), Level.INFO);
  }

  /**
   * Creates a handler with the specified logger and level.
   *
   * @param logger the logger to use for logging messages
   * @param logLevel the log level to use for logging messages
   */
  public LoggingMessageHandler(final Logger logger, final Level logLevel) {
    this.logger = logger;
    this.logLevel = logLevel;
  }

  /**
   * Logs the message.
   *
   * @param msg the received message
   * @return always {@code true}, logging failures do not fail the message
   */
  @Override
  public boolean test(final Msg msg) {
    if (!logger.isLoggable(logLevel)) {
      return true;
    }

    final var logData = new LinkedHashMap<String, Object>();
    logData.put("id", msg.id());
    logData.put("timestamp", msg.timestamp().toString());
    logData.put("size", msg.data().length);
    logData.put("payload", formatPayload(msg.data()));

    try (final var out = new ByteArrayOutputStream()) {
      DSL_JSON.serialize(logData, out);
      logger.log(logLevel, out.toString(StandardCharsets.UTF_8));
    } catch (final IOException e) {
      logger.log(Level.WARNING, "Failed to log message %s".formatted(msg.id()), e);
    }
    return true;
  }

  String formatPayload(final byte[] bytes) {
    if (bytes.length == 0) {
      return "empty";
    }

    final String text;
    try {
      text =
        StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (final CharacterCodingException e) {
      return Base64.getEncoder().encodeToString(bytes);
    }

    if (isLikelyJson(text)) {
      try {
        final var json = DSL_JSON.deserialize(Object.class, new ByteArrayInputStream(bytes));
        final var out = new ByteArrayOutputStream();
        DSL_JSON.serialize(json, out);
        return out.toString(StandardCharsets.UTF_8);
      } catch (final IOException e) {
        logger.log(Level.DEBUG, "Failed to parse JSON content, falling back to raw string", e);
      }
    }
    return text;
  }

  private boolean isLikelyJson(final String value) {
    final var trimmed = value.trim();
    return (
      (trimmed.startsWith("{") || trimmed.startsWith("[")) && (trimmed.endsWith("}") || trimmed.endsWith("]"))
    );
  }
}
