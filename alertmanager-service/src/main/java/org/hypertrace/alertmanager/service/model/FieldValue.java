package org.hypertrace.alertmanager.service.model;

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A typed value of an alert field. Fields carry heterogeneous values, but only {@link
 * Type#STRING} values can become AlertManager annotations.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FieldValue {

  public enum Type {
    STRING,
    LONG,
    DOUBLE,
    BOOLEAN
  }

  private final Type type;
  private final Object value;

  private FieldValue(Type type, Object value) {
    this.type = type;
    this.value = Objects.requireNonNull(value, "field value cannot be null");
  }

  public static FieldValue ofString(String value) {
    return new FieldValue(Type.STRING, value);
  }

  public static FieldValue ofLong(long value) {
    return new FieldValue(Type.LONG, value);
  }

  public static FieldValue ofDouble(double value) {
    return new FieldValue(Type.DOUBLE, value);
  }

  public static FieldValue ofBoolean(boolean value) {
    return new FieldValue(Type.BOOLEAN, value);
  }

  public boolean isString() {
    return type == Type.STRING;
  }

  /** @throws IllegalStateException if this is not a string value */
  public String asString() {
    if (!isString()) {
      throw new IllegalStateException(String.format("field value is a %s, not a STRING", type));
    }
    return (String) value;
  }
}
