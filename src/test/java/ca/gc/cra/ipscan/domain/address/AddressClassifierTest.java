package ca.gc.cra.ipscan.domain.address;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class AddressClassifierTest {
  private final AddressClassifier classifier = new AddressClassifier(ClassificationRules.defaults());

  @Test
  void privateRangesIncludeTheirBoundaries() {
    for (String address : List.of(
        "10.0.0.0", "10.255.255.255", "172.16.0.0", "172.31.255.255", "192.168.0.0", "192.168.255.255")) {
      assertEquals(AddressClass.PRIVATE, classifier.classify(address), address);
    }
  }

  @Test
  void addressesJustOutsidePrivateRangesArePublic() {
    for (String address : List.of(
        "9.255.255.255", "11.0.0.0", "172.15.255.255", "172.32.0.0", "192.167.255.255", "192.169.0.0")) {
      assertEquals(AddressClass.PUBLIC, classifier.classify(address), address);
    }
  }

  @Test
  void loopbackAndLinkLocalAreReportedAsPublic() {
    assertEquals(AddressClass.PUBLIC, classifier.classify("127.0.0.1"));
    assertEquals(AddressClass.PUBLIC, classifier.classify("169.254.1.1"));
  }

  @Test
  void unspecifiedMulticastAndReservedAreInvalid() {
    for (String address : List.of("0.0.0.0", "224.0.0.1", "239.255.255.255", "240.0.0.1", "255.255.255.255")) {
      assertEquals(AddressClass.INVALID, classifier.classify(address), address);
    }
  }

  @Test
  void leadingZerosAreReadAsDecimal() {
    assertEquals(AddressClass.PRIVATE, classifier.classify("010.0.0.1"));
    assertEquals(AddressClass.PUBLIC, classifier.classify("08.08.08.08"));
  }

  @Test
  void malformedTextIsInvalid() {
    for (String text : List.of("", "abc", "1.2.3", "1.2.3.4.5", "256.1.1.1", "1..2.3", "1.2.3.4 ", "0001.2.3.4")) {
      assertEquals(AddressClass.INVALID, classifier.classify(text), text);
    }
    assertEquals(AddressClass.INVALID, classifier.classify(null));
  }

  @Test
  void customRulesAreHonoured() {
    AddressClassifier custom = new AddressClassifier(new ClassificationRules(
        List.of(Ipv4Cidr.parse("100.64.0.0/10")), List.of(Ipv4Cidr.parse("8.8.8.8/32"))));

    assertEquals(AddressClass.PRIVATE, custom.classify("100.64.1.1"));
    assertEquals(AddressClass.PUBLIC, custom.classify("10.0.0.1"));
    assertEquals(AddressClass.INVALID, custom.classify("8.8.8.8"));
  }

  @Test
  void rejectsNullRules() {
    assertThrows(NullPointerException.class, () -> new AddressClassifier(null));
  }
}
