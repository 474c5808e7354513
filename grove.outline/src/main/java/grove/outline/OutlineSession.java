package grove.outline;

import grove.InvalidOperationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/*
 * Owns the current outline for one editing surface and applies UI requests one at a time,
 * each one on top of the result of the previous.
 * After every effective change the store receives the placements that changed.
 * */
public class OutlineSession<V, K> {
  private static final Logger log = LoggerFactory.getLogger(OutlineSession.class);

  private final OutlineStore<K> store;
  private Outline<V, K> outline;

  public OutlineSession(@NotNull Outline<V, K> outline, @NotNull OutlineStore<K> store) {
    this.outline = Objects.requireNonNull(outline, "outline");
    this.store = Objects.requireNonNull(store, "store");
  }

  public synchronized Outline<V, K> current() {
    return outline;
  }

  public List<Row<V>> rows() {
    return current().rows();
  }

  public boolean moveUp(@NotNull K key) {
    return apply(Op.MOVE_UP, key, null, o -> OutlineController.moveUp(o, key));
  }

  public boolean moveDown(@NotNull K key) {
    return apply(Op.MOVE_DOWN, key, null, o -> OutlineController.moveDown(o, key));
  }

  public boolean dropAfter(@NotNull K key, @NotNull K target) {
    return apply(Op.DROP_AFTER, key, target, o -> OutlineController.dropAfter(o, key, target));
  }

  public boolean dropAsFirstChild(@NotNull K key, @NotNull K target) {
    return apply(Op.DROP_AS_FIRST_CHILD, key, target, o -> OutlineController.dropAsFirstChild(o, key, target));
  }

  public boolean dropAsLastChild(@NotNull K key, @NotNull K target) {
    return apply(Op.DROP_AS_LAST_CHILD, key, target, o -> OutlineController.dropAsLastChild(o, key, target));
  }

  public boolean dropAsFirstRoot(@NotNull K key) {
    return apply(Op.DROP_AS_FIRST_ROOT, key, null, o -> OutlineController.dropAsFirstRoot(o, key));
  }

  /*
   * returns whether the order changed
   * */
  private synchronized boolean apply(Op op, K key, @Nullable K target, UnaryOperator<Outline<V, K>> edit) {
    Outline<V, K> before = outline;
    Outline<V, K> after;
    try {
      after = edit.apply(before);
    }
    catch (InvalidOperationException e) {
      if (before.options.invalidDropPolicy == OutlineOptions.InvalidDropPolicy.PROPAGATE) {
        throw e;
      }
      log.warn("Ignoring {} of {} (target {}): {}", op, key, target, e.getMessage());
      return false;
    }
    if (after == before) {
      log.debug("{} of {} left the order unchanged", op, key);
      return false;
    }
    outline = after;
    log.debug("{} of {} applied, outline is now {}", op, key, after.forest);

    List<Placement<K>> changed = Placements.changed(before.placements(), after.placements());
    log.info("Saving {} changed placements after {} of {}", changed.size(), op, key);
    store.save(changed);
    return true;
  }
}
