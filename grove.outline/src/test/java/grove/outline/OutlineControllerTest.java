package grove.outline;

import grove.InvalidOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OutlineControllerTest {

  private Outline<Category, Integer> outline;

  @BeforeEach
  void setUp() {
    outline = Outline.create(Category.sample(), c -> c.id);
  }

  @Test
  void testMoveUpIndentsIntoPreviousSibling() {
    Outline<Category, Integer> moved = OutlineController.moveUp(outline, 3);
    assertEquals("[Work[Email[Meetings[Standup]]], Home[Garden]]", moved.forest.toString());
    List<OutlineLog.Entry<Integer>> entries = moved.log.entries();
    assertEquals(1, entries.size());
    assertEquals(new OutlineLog.Entry<>(Op.MOVE_UP, 3, 2, 1), entries.get(0));
  }

  @Test
  void testMoveUpLeavesRootTree() {
    Outline<Category, Integer> moved = OutlineController.moveUp(outline, 6);
    assertEquals("[Work[Email Meetings[Standup]], Garden, Home]", moved.forest.toString());
    assertEquals(Integer.valueOf(1), moved.log.entries().get(0).target);
  }

  @Test
  void testMoveUpOnFirstRowIsNoop() {
    assertSame(outline, OutlineController.moveUp(outline, 1));
    assertTrue(outline.log.entries().isEmpty());
  }

  @Test
  void testMoveDown() {
    Outline<Category, Integer> moved = OutlineController.moveDown(outline, 2);
    assertEquals("[Work[Meetings[Email Standup]], Home[Garden]]", moved.forest.toString());

    moved = OutlineController.moveDown(moved, 4);
    assertEquals("[Work[Meetings[Email] Standup], Home[Garden]]", moved.forest.toString());
    assertEquals(2, moved.log.entries().size());

    assertSame(outline, OutlineController.moveDown(outline, 5));
  }

  @Test
  void testDrops() {
    assertEquals("[Work[Email Meetings], Home[Garden], Standup]",
                 OutlineController.dropAfter(outline, 4, 5).forest.toString());
    assertEquals("[Work[Email Meetings[Home[Garden] Standup]]]",
                 OutlineController.dropAsFirstChild(outline, 5, 3).forest.toString());
    assertEquals("[Home[Garden[Work[Email Meetings[Standup]]]]]",
                 OutlineController.dropAsLastChild(outline, 1, 6).forest.toString());
    assertEquals("[Garden, Work[Email Meetings[Standup]], Home]",
                 OutlineController.dropAsFirstRoot(outline, 6).forest.toString());
  }

  @Test
  void testDropOnCurrentPlaceIsNoop() {
    assertSame(outline, OutlineController.dropAfter(outline, 3, 2));
    assertSame(outline, OutlineController.dropAsFirstRoot(outline, 1));
    assertSame(outline, OutlineController.dropAsLastChild(outline, 4, 3));
  }

  @Test
  void testInvalidDrops() {
    InvalidOperationException inside = assertThrows(InvalidOperationException.class,
                                                    () -> OutlineController.dropAsFirstChild(outline, 1, 4));
    assertEquals(InvalidOperationException.Reason.TARGET_INSIDE_FOCUS, inside.reason);

    InvalidOperationException unknownTarget = assertThrows(InvalidOperationException.class,
                                                           () -> OutlineController.dropAfter(outline, 2, 99));
    assertEquals(InvalidOperationException.Reason.TARGET_NOT_FOUND, unknownTarget.reason);

    InvalidOperationException unknownKey = assertThrows(InvalidOperationException.class,
                                                        () -> OutlineController.moveUp(outline, 99));
    assertEquals(InvalidOperationException.Reason.TARGET_NOT_FOUND, unknownKey.reason);
  }

  @Test
  void testHistoryLimit() {
    Outline<Category, Integer> limited = Outline.create(Category.sample(), c -> c.id,
                                                        OutlineOptions.defaults().withHistoryLimit(2));
    limited = OutlineController.moveUp(limited, 6);
    limited = OutlineController.moveUp(limited, 6);
    limited = OutlineController.moveDown(limited, 2);

    List<OutlineLog.Entry<Integer>> entries = limited.log.entries();
    assertEquals(2, entries.size());
    assertEquals(2, entries.get(0).timestamp);
    assertEquals(3, entries.get(1).timestamp);
    assertEquals(3, limited.log.timestamp);
  }

  @Test
  void testCursorAt() {
    assertEquals("Meetings", outline.cursorAt(3).label().name);
    assertNull(outline.cursorAt(42));
  }
}
