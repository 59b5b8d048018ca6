package ddd.outbox.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

  @Test
  void acceptsIdentifiers() {
    assertEquals("outbox_message", TableNames.validate("outbox_message"));
    assertEquals("_Outbox2", TableNames.validate("_Outbox2"));
  }

  @Test
  void rejectsInvalidNames() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1outbox"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("app.outbox"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("outbox message"));
  }
}
