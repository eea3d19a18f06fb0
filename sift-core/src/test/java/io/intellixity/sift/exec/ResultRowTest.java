package io.intellixity.sift.exec;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ResultRowTest {
  @Test
  void keepsFieldOrderAndRejectsUnknownNames() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("title", "Alien");
    m.put("year", 1979);
    ResultRow r = ResultRow.of(m);

    assertEquals(List.of("title", "year"), r.names());
    assertEquals(1979, r.get("year", Integer.class));
    assertThrows(IllegalArgumentException.class, () -> r.get("Title"));
    assertEquals("{title=Alien, year=1979}", r.toString());
    assertEquals(r, new ResultRow(List.of("title", "year"), new Object[] {"Alien", 1979}));
  }

  @Test
  void valuesAreDefensivelyCopied() {
    Object[] values = {"a"};
    ResultRow r = new ResultRow(List.of("x"), values);
    values[0] = "b";
    assertEquals("a", r.get("x"));
  }
}
