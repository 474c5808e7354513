package grove.outline;

import java.util.Objects;

/*
 * One rendered line of the indentation-flattened outline.
 * */
public class Row<V> {
  public final int depth;
  public final V value;

  public Row(int depth, V value) {
    this.depth = depth;
    this.value = value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Row<?> row = (Row<?>)o;
    return depth == row.depth &&
           Objects.equals(value, row.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(depth, value);
  }

  @Override
  public String toString() {
    return depth + ":" + value;
  }
}
