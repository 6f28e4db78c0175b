package org.javai.units.text;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class Latin1TextTest {

	@Test
	void oneBytePerCharacter() {
		byte[] bytes = Latin1Text.encode("µm/°C");

		assertThat(bytes).hasSize(5);
		assertThat(bytes[0]).isEqualTo((byte) 0xB5);
		assertThat(Latin1Text.decode(bytes)).isEqualTo("µm/°C");
	}

	@Test
	void rejectsCharactersOutsideLatin1() {
		assertThat(Latin1Text.isRepresentable("Θ")).isFalse();
		assertThat(Latin1Text.isRepresentable("°C")).isTrue();
		assertThatThrownBy(() -> Latin1Text.encode("Ω"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Latin-1");
	}
}
