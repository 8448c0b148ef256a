package com.enr.entry;

import com.enr.error.EnrException;
import com.enr.error.ErrorType;
import com.enr.rlp.ValueCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.enr.entry.EntryTestSupport.*;
import static org.assertj.core.api.Assertions.*;

class GenericEntryTest {

    @ParameterizedTest
    @ValueSource(strings = {"a", "eth", "les", "snap", "x-custom-key"})
    void shouldRoundtripUnderArbitraryKeys(String key) throws EnrException {
        var entry = GenericEntry.of(key, 12345L, ValueCodec.UINT64);

        var decoded = roundtrip(entry, GenericEntry.decoder(key, ValueCodec.UINT64));

        assertThat(entry.getEnrKey()).isEqualTo(key);
        assertThat(decoded).isEqualTo(entry);
        assertThat(decoded.getValue()).isEqualTo(12345L);
    }

    @Test
    void shouldEncodeWithCodecOnly() throws EnrException {
        var entry = GenericEntry.of("foo", "bar", ValueCodec.STRING);

        assertThat(encode(entry)).containsExactly(0x83, 'b', 'a', 'r');
    }

    @Test
    void shouldCompareByteValuesByContent() throws EnrException {
        var entry = GenericEntry.of("eth2", new byte[]{1, 2, 3}, ValueCodec.BYTES);

        var decoded = roundtrip(entry, GenericEntry.decoder("eth2", ValueCodec.BYTES));

        assertThat(decoded).isEqualTo(entry);
        assertThat(decoded.hashCode()).isEqualTo(entry.hashCode());
        assertThat(decoded).hasToString("eth2=[1, 2, 3]");
        assertThat(decoded).isNotEqualTo(GenericEntry.of("eth2", new byte[]{1, 2, 4}, ValueCodec.BYTES));
        assertThat(decoded).isNotEqualTo(GenericEntry.of("eth3", new byte[]{1, 2, 3}, ValueCodec.BYTES));
    }

    @Test
    void shouldSupportStructuredValues() throws EnrException {
        var codec = ValueCodec.listOf(ValueCodec.listOf(ValueCodec.STRING));
        var value = List.of(List.of("eth", "68"), List.of("snap", "1"));

        var decoded = roundtrip(GenericEntry.of("caps", value, codec), GenericEntry.decoder("caps", codec));

        assertThat(decoded.getValue()).isEqualTo(value);
    }

    @Test
    void shouldReturnNewEntryOnDecode() throws EnrException {
        var original = GenericEntry.of("foo", "bar", ValueCodec.STRING);
        var decoder = GenericEntry.decoder("foo", ValueCodec.STRING);

        var first = decode(decoder, encode(original));
        var second = decode(decoder, encode(GenericEntry.of("foo", "baz", ValueCodec.STRING)));

        assertThat(first.getValue()).isEqualTo("bar");
        assertThat(second.getValue()).isEqualTo("baz");
        assertThat(original.getValue()).isEqualTo("bar");
    }

    @Test
    void shouldPropagateCodecErrors() {
        assertFails(() -> encode(GenericEntry.of("port", 70000, ValueCodec.UINT16)), ErrorType.UINT_OVERFLOW);
        assertFails(() -> decode(GenericEntry.decoder("foo", ValueCodec.STRING), new byte[]{(byte) 0xc0}),
                ErrorType.EXPECTED_STRING);
    }

    @Test
    void shouldRejectEmptyKey() {
        assertThatThrownBy(() -> GenericEntry.of("", "bar", ValueCodec.STRING))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenericEntry.decoder("", ValueCodec.STRING))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenericEntry.of("foo", null, ValueCodec.STRING))
                .isInstanceOf(NullPointerException.class);
    }
}
