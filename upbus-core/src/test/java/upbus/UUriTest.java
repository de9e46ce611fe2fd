package upbus;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UUriTest {

  @Test
  void equalityIsStructural() {
    UUri a = new UUri("veh", 0xA34B, 1, 0x8001);
    UUri b = new UUri("veh", 0xA34B, 1, 0x8001);

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, new UUri("veh", 0xA34B, 2, 0x8001));
    assertNotEquals(a, new UUri("other", 0xA34B, 1, 0x8001));
    assertNotEquals(a, a.withResourceId(0x8002));
  }

  @Test
  void rendersHexUri() {
    assertEquals("up://veh/A34B/1/8001", new UUri("veh", 0xA34B, 0x01, 0x8001).toUri());
    assertEquals("up://veh/FFFFFFFF/FF/0", new UUri("veh", -1, 0xFF, 0).toUri());
  }

  @Test
  void parsesItsOwnRendering() {
    UUri uri = new UUri("my-vehicle", 0xFFFF_0001, 0x02, 0xD100);

    assertEquals(uri, UUri.parse(uri.toUri()));
  }

  @Test
  void parsesWithoutSchemeOrAuthority() {
    assertEquals(new UUri("veh", 0x10, 1, 0x8001), UUri.parse("//veh/10/1/8001"));
    assertEquals(new UUri("", 0x10, 1, 0x8001), UUri.parse("/10/1/8001"));
  }

  @Test
  void parseRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> UUri.parse("up://veh"));
    assertThrows(IllegalArgumentException.class, () -> UUri.parse("up://veh/10/1"));
    assertThrows(IllegalArgumentException.class, () -> UUri.parse("up://veh/zz/1/8001"));
    assertThrows(IllegalArgumentException.class, () -> UUri.parse("veh/10/1/8001"));
    assertThrows(IllegalArgumentException.class, () -> UUri.parse("up://veh/10/100/8001"));
  }

  @Test
  void rejectsOutOfRangeFields() {
    assertThrows(IllegalArgumentException.class, () -> new UUri("veh", 1, 256, 0x8001));
    assertThrows(IllegalArgumentException.class, () -> new UUri("veh", 1, -1, 0x8001));
    assertThrows(IllegalArgumentException.class, () -> new UUri("veh", 1, 1, 0x10000));
    assertThrows(NullPointerException.class, () -> new UUri(null, 1, 1, 0x8001));
  }

  @Test
  void topicRequiresAuthorityAndTopicResourceRange() {
    assertTrue(new UUri("veh", 1, 1, 0x8000).isTopic());
    assertTrue(new UUri("veh", 1, 1, 0xFFFE).isTopic());

    assertFalse(new UUri("", 1, 1, 0x8001).isTopic());
    assertFalse(new UUri("  ", 1, 1, 0x8001).isTopic());
    assertFalse(new UUri("a/b", 1, 1, 0x8001).isTopic());
    assertFalse(new UUri("veh", 1, 1, 0).isTopic());
    assertFalse(new UUri("veh", 1, 1, 0x7FFF).isTopic());
    assertFalse(new UUri("veh", 1, 1, 0xFFFF).isTopic());
  }
}
