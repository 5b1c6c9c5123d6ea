package dev.trafomatch.design;

import org.jspecify.annotations.Nullable;

/**
 * Raised when a value's runtime kind does not match the kind an attribute is declared with.
 *
 * <p>This signals a configuration or catalog defect rather than bad user input, so it is not meant
 * to be recovered from: the scoring call that hits it is aborted.
 */
public class InvalidAttributeKindException extends IllegalStateException {

  private final @Nullable String attribute;

  public InvalidAttributeKindException(
      String attribute, AttributeKind expected, AttributeKind actual) {
    super(
        "Attribute '"
            + attribute
            + "' is declared "
            + expected
            + " but received a "
            + actual
            + " value");
    this.attribute = attribute;
  }

  InvalidAttributeKindException(AttributeValue value, AttributeKind requested) {
    super("Cannot read " + value.kind() + " value '" + value.display() + "' as " + requested);
    this.attribute = null;
  }

  /** Name of the offending attribute, or null when the value was read outside any attribute. */
  public @Nullable String getAttribute() {
    return attribute;
  }
}
