package relay.model;

import java.util.Objects;

/**
 * One field of a sparse update: either {@linkplain Absent absent} (leave the current value
 * alone) or {@linkplain Present present} with a value that may itself be {@code null}.
 *
 * <p>Keeps "not supplied" distinct from "explicitly cleared", which a bare nullable field cannot.
 *
 * @param <T> field type
 */
public sealed interface Patch<T> permits Patch.Absent, Patch.Present {

  @SuppressWarnings("unchecked")
  static <T> Patch<T> absent() {
    return (Patch<T>) Absent.INSTANCE;
  }

  static <T> Patch<T> of(T value) {
    return new Present<>(value);
  }

  /**
   * {@link #of} for a non-null value, {@link #absent()} otherwise. Convenient when mapping
   * nullable request fields where null means "not supplied".
   */
  static <T> Patch<T> ofNullable(T value) {
    return value == null ? absent() : of(value);
  }

  boolean isPresent();

  /**
   * The supplied value; only valid when {@link #isPresent()}.
   */
  T value();

  /**
   * The supplied value if present, otherwise {@code current}.
   */
  default T applyTo(T current) {
    return isPresent() ? value() : current;
  }

  /**
   * {@code other} if it is present, otherwise this patch. Used to fold successive amendments.
   */
  default Patch<T> overriddenBy(Patch<T> other) {
    Objects.requireNonNull(other, "other");
    return other.isPresent() ? other : this;
  }

  record Absent<T>() implements Patch<T> {
    private static final Absent<?> INSTANCE = new Absent<>();

    @Override
    public boolean isPresent() {
      return false;
    }

    @Override
    public T value() {
      throw new IllegalStateException("patch field is absent");
    }

    @Override
    public String toString() {
      return "absent";
    }
  }

  record Present<T>(T value) implements Patch<T> {
    @Override
    public boolean isPresent() {
      return true;
    }
  }
}
