package io.b2mash.maxify.project;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class QualifiedNameTest {

  @Test
  void splitsOnFirstSeparator() {
    var parsed = QualifiedName.parse("acme/rocket");

    assertThat(parsed.organization()).isEqualTo("acme");
    assertThat(parsed.name()).isEqualTo("rocket");
  }

  @Test
  void bareNameHasNoOrganization() {
    var parsed = QualifiedName.parse("rocket");

    assertThat(parsed.organization()).isNull();
    assertThat(parsed).hasToString("rocket");
  }

  @Test
  void roundTripsThroughToString() {
    var name = new QualifiedName("Acme", "Rocket");

    assertThat(QualifiedName.parse(name.toString())).isEqualTo(name);
  }

  @Test
  void canonicalFormIsLowercase() {
    assertThat(QualifiedName.parse("Acme/Rocket").canonical()).hasToString("acme/rocket");
  }
}
