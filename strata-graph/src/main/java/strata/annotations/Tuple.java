package strata.annotations;

import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a small value type whose generated immutable implementation is constructed positionally through a static
 * {@code of} method instead of a builder. The parameters of {@code of} follow the declaration order of the
 * accessors.
 *
 * @see Value.Style#allParameters
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Value.Style(allParameters = true, defaults = @Value.Immutable(builder = false))
public @interface Tuple {
}
