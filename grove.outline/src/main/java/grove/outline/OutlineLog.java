package grove.outline;

import io.lacuna.bifurcan.List;
import io.lacuna.bifurcan.Lists;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/*
 * Append-only history of applied moves, oldest entries are dropped past the limit.
 * Timestamps are a logical clock and keep growing after entries are dropped.
 * */
public class OutlineLog<K> {

  public static class Entry<K> {
    public final Op op;
    public final K key;
    @Nullable
    public final K target;
    public final long timestamp;

    public Entry(Op op, K key, @Nullable K target, long timestamp) {
      this.op = op;
      this.key = key;
      this.target = target;
      this.timestamp = timestamp;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      Entry<?> entry = (Entry<?>)o;
      return timestamp == entry.timestamp &&
             op == entry.op &&
             Objects.equals(key, entry.key) &&
             Objects.equals(target, entry.target);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, key, target, timestamp);
    }

    @Override
    public String toString() {
      return "Entry{" +
             "op=" + op +
             ", key=" + key +
             ", target=" + target +
             ", timestamp=" + timestamp +
             '}';
    }
  }

  public final List<Entry<K>> entries;
  public final long timestamp;
  public final int limit;

  public OutlineLog(List<Entry<K>> entries, long timestamp, int limit) {
    this.entries = entries;
    this.timestamp = timestamp;
    this.limit = limit;
  }

  public static <K> OutlineLog<K> empty(int limit) {
    return new OutlineLog<>(new List<>(), 0, limit);
  }

  public OutlineLog<K> add(Op op, K key, @Nullable K target) {
    long next = this.timestamp + 1;
    List<Entry<K>> entries = this.entries.addLast(new Entry<>(op, key, target, next));
    while (entries.size() > limit) {
      entries = entries.removeFirst();
    }
    return new OutlineLog<>(entries, next, limit);
  }

  public java.util.List<Entry<K>> entries() {
    return Lists.toList(this.entries);
  }

  public java.util.List<Entry<K>> entriesSince(long timestamp) {
    int start = (int)entries.size();
    for (int i = 0; i < entries.size(); i++) {
      if (entries.nth(i).timestamp > timestamp) {
        start = i;
        break;
      }
    }
    return Lists.toList(entries.slice(start, entries.size()));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    OutlineLog<?> log = (OutlineLog<?>)o;
    return timestamp == log.timestamp &&
           limit == log.limit &&
           entries.equals(log.entries);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Lists.hash(entries), timestamp, limit);
  }
}
