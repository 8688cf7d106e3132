package evaluation.core;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Objects;

/**
 * A scalar generation or algorithm parameter value.
 *
 * <p>Numbers compare numerically ({@code 2} equals {@code 2.0}), booleans and strings by their
 * natural order. Across kinds the order is number &lt; boolean &lt; string, which keeps group and
 * file ordering stable when a parameter mixes kinds.
 */
public final class ParameterValue implements Comparable<ParameterValue> {

  public enum Kind {
    NUMBER,
    BOOLEAN,
    STRING
  }

  private static final Comparator<ParameterValue> ORDER =
      Comparator.comparing(ParameterValue::kind).thenComparing((a, b) -> a.compareSameKind(b));

  private final Kind kind;
  private final BigDecimal number;
  private final boolean bool;
  private final String text;

  private ParameterValue(Kind kind, BigDecimal number, boolean bool, String text) {
    this.kind = kind;
    this.number = number;
    this.bool = bool;
    this.text = text;
  }

  public static ParameterValue of(Number value) {
    Objects.requireNonNull(value, "value");
    if ((value instanceof Double || value instanceof Float)
        && !Double.isFinite(value.doubleValue())) {
      throw new IllegalArgumentException("Parameter values must be finite, got: " + value);
    }
    BigDecimal decimal =
        value instanceof BigDecimal big ? big : new BigDecimal(value.toString());
    return new ParameterValue(Kind.NUMBER, decimal.stripTrailingZeros(), false, null);
  }

  public static ParameterValue of(String value) {
    return new ParameterValue(Kind.STRING, null, false, Objects.requireNonNull(value, "value"));
  }

  public static ParameterValue of(boolean value) {
    return new ParameterValue(Kind.BOOLEAN, null, value, null);
  }

  /** Wraps a value read from JSON or built in code; only numbers, strings and booleans qualify. */
  public static ParameterValue ofObject(Object value) {
    if (value instanceof ParameterValue parameterValue) {
      return parameterValue;
    }
    if (value instanceof Number n) {
      return of(n);
    }
    if (value instanceof Boolean b) {
      return of(b.booleanValue());
    }
    if (value instanceof String s) {
      return of(s);
    }
    throw new IllegalArgumentException(
        "Parameter values must be numbers, booleans or strings, got: " + value);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isNumber() {
    return kind == Kind.NUMBER;
  }

  public double asDouble() {
    if (kind != Kind.NUMBER) {
      throw new IllegalStateException("Not a numeric parameter value: " + this);
    }
    return number.doubleValue();
  }

  public BigDecimal asDecimal() {
    if (kind != Kind.NUMBER) {
      throw new IllegalStateException("Not a numeric parameter value: " + this);
    }
    return number;
  }

  public boolean asBoolean() {
    if (kind != Kind.BOOLEAN) {
      throw new IllegalStateException("Not a boolean parameter value: " + this);
    }
    return bool;
  }

  public String asString() {
    return toString();
  }

  /** Returns the value as a plain Java object, for serialization. */
  public Object toJavaValue() {
    return switch (kind) {
      case NUMBER -> number;
      case BOOLEAN -> bool;
      case STRING -> text;
    };
  }

  @Override
  public int compareTo(ParameterValue other) {
    return ORDER.compare(this, other);
  }

  private int compareSameKind(ParameterValue other) {
    return switch (kind) {
      case NUMBER -> number.compareTo(other.number);
      case BOOLEAN -> Boolean.compare(bool, other.bool);
      case STRING -> text.compareTo(other.text);
    };
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ParameterValue other)) {
      return false;
    }
    return kind == other.kind && compareSameKind(other) == 0;
  }

  @Override
  public int hashCode() {
    return switch (kind) {
      case NUMBER -> Objects.hash(kind, number);
      case BOOLEAN -> Objects.hash(kind, bool);
      case STRING -> Objects.hash(kind, text);
    };
  }

  @Override
  public String toString() {
    return switch (kind) {
      case NUMBER -> number.toPlainString();
      case BOOLEAN -> Boolean.toString(bool);
      case STRING -> text;
    };
  }
}
