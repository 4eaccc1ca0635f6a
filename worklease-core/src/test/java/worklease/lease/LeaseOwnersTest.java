package worklease.lease;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LeaseOwnersTest {

  @Test
  void hostAndPidEndsWithPid() {
    String owner = LeaseOwners.hostAndPid();

    assertFalse(owner.isBlank());
    assertTrue(owner.endsWith("-" + ProcessHandle.current().pid()), owner);
  }

  @Test
  void uniqueOwnersDiffer() {
    String a = LeaseOwners.unique();
    String b = LeaseOwners.unique();

    assertNotEquals(a, b);
    assertTrue(a.startsWith(LeaseOwners.hostAndPid() + "-"), a);
    assertEquals(LeaseOwners.hostAndPid().length() + 9, a.length());
  }
}
