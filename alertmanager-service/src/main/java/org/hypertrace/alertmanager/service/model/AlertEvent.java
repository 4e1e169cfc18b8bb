package org.hypertrace.alertmanager.service.model;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/** An alert as produced by the alerting pipeline. Immutable. */
@Builder
@Getter
@ToString
public class AlertEvent {
  private static final AlertEvent EMPTY = AlertEvent.builder().build();

  @Builder.Default private final String topic = "";
  @Builder.Default private final State state = State.builder().build();
  @Builder.Default private final EventData data = EventData.builder().build();

  /** The zero-valued event: empty strings, {@link Level#OK}, not recoverable, no tags or fields. */
  public static AlertEvent empty() {
    return EMPTY;
  }

  @Builder
  @Getter
  @ToString
  public static class State {
    @Builder.Default private final String id = "";
    @Builder.Default private final String message = "";
    @Builder.Default private final Level level = Level.OK;
  }

  @Builder
  @Getter
  @ToString
  public static class EventData {
    @Builder.Default private final String name = "";
    @Builder.Default private final String taskName = "";
    @Builder.Default private final String category = "";
    private final boolean recoverable;
    @Singular private final Map<String, String> tags;
    @Singular private final Map<String, FieldValue> fields;
  }
}
