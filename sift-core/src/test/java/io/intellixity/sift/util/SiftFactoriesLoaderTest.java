package io.intellixity.sift.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SiftFactoriesLoaderTest {
  interface Greeter {
    String greet();
  }

  static final class Hello implements Greeter {
    @Override public String greet() { return "hello"; }
  }

  static final class Hola implements Greeter {
    @Override public String greet() { return "hola"; }
  }

  @Test
  void loadsListedImplementationsInOrder() {
    List<Greeter> gs = SiftFactoriesLoader.load(Greeter.class);
    assertEquals(2, gs.size());
    assertEquals("hello", gs.get(0).greet());
    assertEquals("hola", gs.get(1).greet());
  }

  @Test
  void unlistedTypeYieldsNothing() {
    assertTrue(SiftFactoriesLoader.load(Runnable.class).isEmpty());
  }
}
