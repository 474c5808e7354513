package grove.outline;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OutlineLogTest {

  @Test
  void testAddAdvancesClock() {
    OutlineLog<String> log = OutlineLog.<String>empty(10)
      .add(Op.MOVE_UP, "a", "b")
      .add(Op.DROP_AS_FIRST_ROOT, "c", null);
    assertEquals(2, log.timestamp);
    assertEquals(new OutlineLog.Entry<>(Op.DROP_AS_FIRST_ROOT, "c", null, 2), log.entries().get(1));
  }

  @Test
  void testLimitDropsOldest() {
    OutlineLog<String> log = OutlineLog.empty(2);
    for (String key : new String[]{"a", "b", "c", "d"}) {
      log = log.add(Op.MOVE_DOWN, key, null);
    }
    List<OutlineLog.Entry<String>> entries = log.entries();
    assertEquals(2, entries.size());
    assertEquals("c", entries.get(0).key);
    assertEquals("d", entries.get(1).key);
    assertEquals(4, log.timestamp);
  }

  @Test
  void testEntriesSince() {
    OutlineLog<String> log = OutlineLog.empty(10);
    for (String key : new String[]{"a", "b", "c"}) {
      log = log.add(Op.MOVE_UP, key, null);
    }
    assertEquals(3, log.entriesSince(0).size());
    assertEquals("c", log.entriesSince(2).get(0).key);
    assertTrue(log.entriesSince(3).isEmpty());
  }

  @Test
  void testLogIsPersistent() {
    OutlineLog<String> empty = OutlineLog.empty(10);
    OutlineLog<String> one = empty.add(Op.MOVE_UP, "a", null);
    assertTrue(empty.entries().isEmpty());
    assertEquals(1, one.entries().size());
    assertNotEquals(empty, one);
    assertEquals(one, empty.add(Op.MOVE_UP, "a", null));
  }

  @Test
  void testEqualLogsHashAlike() {
    OutlineLog<String> first = OutlineLog.<String>empty(4).add(Op.MOVE_UP, "a", "b").add(Op.MOVE_DOWN, "c", null);
    OutlineLog<String> second = OutlineLog.<String>empty(4).add(Op.MOVE_UP, "a", "b").add(Op.MOVE_DOWN, "c", null);
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertTrue(new HashSet<>(Collections.singletonList(first)).contains(second));
  }
}
