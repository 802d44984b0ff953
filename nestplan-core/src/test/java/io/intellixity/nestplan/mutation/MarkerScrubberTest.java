package io.intellixity.nestplan.mutation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.intellixity.nestplan.mutation.Fixtures.map;
import static org.junit.jupiter.api.Assertions.*;

final class MarkerScrubberTest {
  private final MarkerScrubber scrubber = new MarkerScrubber();

  @Test
  void stripsMarkerAtEveryDepthIncludingListElements() {
    Map<String, Object> in = Map.of(
        "apiAction", "create",
        "title", "Post",
        "tags", List.of(
            Map.of("id", "t1", "apiAction", "connect"),
            "plain",
            List.of(Map.of("apiAction", "delete", "id", "t2"))
        ),
        "category", Map.of("update", Map.of("where", Map.of("id", "c1"), "data", Map.of("apiAction", "update")))
    );

    Object out = scrubber.scrub(in);

    assertEquals(Map.of(
        "title", "Post",
        "tags", List.of(Map.of("id", "t1"), "plain", List.of(Map.of("id", "t2"))),
        "category", Map.of("update", Map.of("where", Map.of("id", "c1"), "data", Map.of()))
    ), out);
    assertFalse(scrubber.containsMarker(out));
    assertTrue(scrubber.containsMarker(in));
  }

  @Test
  void returnsDeepCopyAndLeavesInputAlone() {
    List<Object> tags = new ArrayList<>();
    tags.add(map("id", "t1", "apiAction", "delete"));
    Map<String, Object> in = map("tags", tags, "note", null);

    @SuppressWarnings("unchecked")
    Map<String, Object> out = (Map<String, Object>) scrubber.scrub(in);
    tags.add("later");

    assertEquals(1, ((List<?>) out.get("tags")).size());
    assertTrue(out.containsKey("note"));
    assertNull(out.get("note"));
    assertEquals("delete", ((Map<?, ?>) tags.get(0)).get("apiAction"));
  }

  @Test
  void scalarsAndNullPassThrough() {
    assertNull(scrubber.scrub(null));
    assertEquals("x", scrubber.scrub("x"));
    assertEquals(3, scrubber.scrub(3));
  }

  @Test
  void honoursCustomMarkerKey() {
    MarkerScrubber custom = new MarkerScrubber("_op");
    assertEquals(Map.of("apiAction", "keep"), custom.scrub(Map.of("_op", "delete", "apiAction", "keep")));
  }
}
