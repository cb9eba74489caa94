package strata.layout;

public enum BorderType {
  LEFT,
  RIGHT
}
