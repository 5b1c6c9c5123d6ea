package dev.trafomatch.matching;

/** The query names an attribute outside the configured attribute table. */
public class UnknownAttributeException extends InvalidQueryException {

  public UnknownAttributeException(String attribute) {
    super(attribute, "unknown attribute");
  }

  public String getAttribute() {
    return getField();
  }
}
