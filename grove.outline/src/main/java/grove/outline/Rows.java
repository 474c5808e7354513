package grove.outline;

import grove.Cursor;
import grove.Forest;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public class Rows {
  private Rows() {}

  /*
   * rows top to bottom, in the pre-order of the forest
   * */
  public static <V> List<Row<V>> flatten(@NotNull Forest<V> forest) {
    ArrayList<Row<V>> rows = new ArrayList<>();
    Cursor<V> loc = Cursor.fromFlatForest(forest);
    while (loc != null) {
      rows.add(new Row<>(loc.depth(), loc.label()));
      loc = loc.nextInPreOrder();
    }
    return rows;
  }

  /*
   * index of the first row with the given key, -1 if there is none
   * */
  public static <V, K> int indexOf(@NotNull List<Row<V>> rows, @NotNull K key, @NotNull Function<? super V, ? extends K> keyOf) {
    for (int i = 0; i < rows.size(); i++) {
      if (key.equals(keyOf.apply(rows.get(i).value))) {
        return i;
      }
    }
    return -1;
  }

  public static <V> String render(@NotNull List<Row<V>> rows, @NotNull String indent) {
    StringBuilder sb = new StringBuilder();
    for (Row<V> row : rows) {
      for (int i = 0; i < row.depth; i++) {
        sb.append(indent);
      }
      sb.append(row.value).append('\n');
    }
    return sb.toString();
  }
}
