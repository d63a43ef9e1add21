package io.intellixity.unisql.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class UnisqlFactoriesLoaderTest {

  public interface Greeter {
    String greet();
  }

  public static final class Hello implements Greeter {
    @Override public String greet() { return "hello"; }
  }

  public static final class Hi implements Greeter {
    @Override public String greet() { return "hi"; }
  }

  public interface Unlisted {}

  @Test
  void loadsListedImplementationsInOrderWithoutDuplicates() {
    List<Greeter> greeters = UnisqlFactoriesLoader.load(Greeter.class);
    assertEquals(2, greeters.size());
    assertEquals("hello", greeters.get(0).greet());
    assertEquals("hi", greeters.get(1).greet());
  }

  @Test
  void unknownSpiYieldsEmptyList() {
    assertTrue(UnisqlFactoriesLoader.load(Unlisted.class).isEmpty());
  }
}
