package strata.layout;

import org.immutables.value.Value;
import strata.annotations.Tuple;

@Value.Immutable
@Tuple
public interface Point {
  static Point of(double x, double y) {
    return ImmutablePoint.of(x, y);
  }

  double x();

  double y();

  default Point translate(double dx, double dy) {
    return of(x() + dx, y() + dy);
  }

  default Point transpose() {
    return of(y(), x());
  }
}
