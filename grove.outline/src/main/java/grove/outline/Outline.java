package grove.outline;

import grove.Cursor;
import grove.Forest;
import grove.Forests;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/*
 * Immutable state of a reorderable outline: the forest, how its nodes are keyed and what was moved so far.
 * */
public class Outline<V, K> {
  public final Forest<V> forest;
  public final Function<? super V, ? extends K> keyOf;
  public final OutlineLog<K> log;
  public final OutlineOptions options;

  public Outline(Forest<V> forest, Function<? super V, ? extends K> keyOf, OutlineLog<K> log, OutlineOptions options) {
    this.forest = Objects.requireNonNull(forest, "forest");
    this.keyOf = Objects.requireNonNull(keyOf, "keyOf");
    this.log = Objects.requireNonNull(log, "log");
    this.options = Objects.requireNonNull(options, "options");
  }

  public static <V, K> Outline<V, K> create(@NotNull Forest<V> forest, @NotNull Function<? super V, ? extends K> keyOf) {
    return create(forest, keyOf, OutlineOptions.defaults());
  }

  public static <V, K> Outline<V, K> create(@NotNull Forest<V> forest,
                                            @NotNull Function<? super V, ? extends K> keyOf,
                                            @NotNull OutlineOptions options) {
    return new Outline<>(forest, keyOf, OutlineLog.empty(options.historyLimit), options);
  }

  public Outline<V, K> withForest(Forest<V> forest) {
    return new Outline<>(forest, this.keyOf, this.log, this.options);
  }

  public Outline<V, K> log(Op op, K key, @Nullable K target) {
    return new Outline<>(this.forest, this.keyOf, this.log.add(op, key, target), this.options);
  }

  @Nullable
  public Cursor<V> cursorAt(@NotNull K key) {
    return Forests.findCursorByKey(key, keyOf, forest);
  }

  public K keyOf(V value) {
    return keyOf.apply(value);
  }

  public List<Row<V>> rows() {
    return Rows.flatten(forest);
  }

  public List<Placement<K>> placements() {
    return Placements.of(forest, keyOf);
  }

  @Override
  public String toString() {
    return "Outline{" +
           "forest=" + forest +
           ", timestamp=" + log.timestamp +
           '}';
  }
}
