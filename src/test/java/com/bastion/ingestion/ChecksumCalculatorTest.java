package com.bastion.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ChecksumCalculator Tests")
class ChecksumCalculatorTest {

    private final ChecksumCalculator calculator = new ChecksumCalculator();

    @Test
    @DisplayName("Should produce the lowercase hex SHA-256 of the UTF-8 bytes")
    void shouldHashUtf8() {
        assertThat(calculator.checksum("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(calculator.checksum(""))
            .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    @DisplayName("Should distinguish content differing only in whitespace")
    void shouldBeSensitiveToWhitespace() {
        assertThat(calculator.checksum("{\"a\":1}")).isNotEqualTo(calculator.checksum("{\"a\":1}\n"));
    }
}
