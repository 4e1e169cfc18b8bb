package org.hypertrace.alertmanager.transport;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A single alert as AlertManager expects it: string labels plus string annotations. */
@Getter
@ToString
@EqualsAndHashCode
public class AlertManagerEvent {

  @JsonProperty("labels")
  private final Map<String, String> labels;

  @JsonProperty("annotations")
  private final Map<String, String> annotations;

  @JsonCreator
  public AlertManagerEvent(
      @JsonProperty("labels") Map<String, String> labels,
      @JsonProperty("annotations") Map<String, String> annotations) {
    this.labels = copyOf(labels);
    this.annotations = copyOf(annotations);
  }

  private static Map<String, String> copyOf(Map<String, String> source) {
    if (source == null) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
