package org.hypertrace.alertmanager.service;

import java.util.LinkedHashMap;
import java.util.Map;
import org.hypertrace.alertmanager.service.model.AlertEvent;
import org.hypertrace.alertmanager.service.model.FieldValue;
import org.hypertrace.alertmanager.transport.AlertManagerEvent;
import org.hypertrace.alertmanager.transport.exception.EventSerializationException;

/**
 * Maps an {@link AlertEvent} onto the AlertManager schema. Topic, state and data attributes
 * become labels prefixed with an underscore, tags are copied over them, and fields become
 * annotations.
 *
 * <p>A tag named like one of the fixed labels replaces it.
 */
public class AlertEventTranslator {
  static final String TOPIC_LABEL = "_topic";
  static final String ID_LABEL = "_ID";
  static final String MESSAGE_LABEL = "_message";
  static final String LEVEL_LABEL = "_level";
  static final String NAME_LABEL = "_name";
  static final String TASK_NAME_LABEL = "_taskName";
  static final String CATEGORY_LABEL = "_category";
  static final String RECOVERABLE_LABEL = "_recoverable";

  public AlertManagerEvent translate(AlertEvent event) throws EventSerializationException {
    Map<String, String> labels = new LinkedHashMap<>();
    Map<String, String> annotations = new LinkedHashMap<>();

    // global tags
    labels.put(TOPIC_LABEL, event.getTopic());
    labels.put(ID_LABEL, event.getState().getId());
    labels.put(MESSAGE_LABEL, event.getState().getMessage());
    labels.put(LEVEL_LABEL, event.getState().getLevel().name());
    labels.put(NAME_LABEL, event.getData().getName());
    labels.put(TASK_NAME_LABEL, event.getData().getTaskName());
    labels.put(CATEGORY_LABEL, event.getData().getCategory());
    labels.put(RECOVERABLE_LABEL, Boolean.toString(event.getData().isRecoverable()));

    labels.putAll(event.getData().getTags());

    for (Map.Entry<String, FieldValue> field : event.getData().getFields().entrySet()) {
      FieldValue value = field.getValue();
      if (!value.isString()) {
        throw new EventSerializationException(
            String.format(
                "field %s is a %s, only STRING fields can be sent as annotations",
                field.getKey(), value.getType()));
      }
      annotations.put(field.getKey(), value.asString());
    }
    return new AlertManagerEvent(labels, annotations);
  }
}
