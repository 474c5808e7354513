package grove.outline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OutlineOptionsTest {

  @Test
  void testDefaults() {
    OutlineOptions options = OutlineOptions.defaults();
    assertEquals(OutlineOptions.DEFAULT_HISTORY_LIMIT, options.historyLimit);
    assertEquals(OutlineOptions.InvalidDropPolicy.IGNORE, options.invalidDropPolicy);
  }

  @Test
  void testWithers() {
    OutlineOptions options = OutlineOptions.defaults()
      .withHistoryLimit(8)
      .withInvalidDropPolicy(OutlineOptions.InvalidDropPolicy.PROPAGATE);
    assertEquals(new OutlineOptions(8, OutlineOptions.InvalidDropPolicy.PROPAGATE), options);
    assertEquals(OutlineOptions.DEFAULT_HISTORY_LIMIT, OutlineOptions.defaults().historyLimit);
  }

  @Test
  void testRejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> OutlineOptions.defaults().withHistoryLimit(0));
  }
}
