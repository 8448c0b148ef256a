package com.enr.core;

import com.enr.entry.ClientEntry;
import com.enr.entry.GenericEntry;
import com.enr.entry.IdEntry;
import com.enr.entry.Ipv4AddrEntry;
import com.enr.entry.PortEntry;
import com.enr.entry.RawEntry;
import com.enr.error.EnrException;
import com.enr.error.ErrorType;
import com.enr.error.KeyException;
import com.enr.rlp.RlpWriter;
import com.enr.rlp.ValueCodec;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;

import static org.assertj.core.api.Assertions.*;

class NodeRecordTest {

    @Test
    void shouldEncodeMinimalRecord() throws EnrException {
        var record = NodeRecord.builder().seq(1).set(IdEntry.V4).build();

        assertThat(record.encode()).containsExactly(0xc7, 0x01, 0x82, 'i', 'd', 0x82, 'v', '4');
    }

    @Test
    void shouldKeepKeysSorted() throws EnrException {
        var record = NodeRecord.builder()
                .set(PortEntry.udp(30303))
                .set(IdEntry.V4)
                .set(ClientEntry.of("geth", "1.10.0"))
                .set(PortEntry.tcp(30303))
                .build();

        assertThat(record.keys()).containsExactly("client", "id", "tcp", "udp");
        assertThat(record.size()).isEqualTo(4);
    }

    @Test
    void shouldLoadTypedEntries() throws Exception {
        var record = NodeRecord.builder()
                .set(IdEntry.V4)
                .set(new Ipv4AddrEntry(InetAddress.getByName("192.0.2.1")))
                .set(PortEntry.udp(30303))
                .build();

        assertThat(record.load(PortEntry.Udp.DECODER).getPort()).isEqualTo(30303);
        assertThat(record.load(IdEntry.DECODER)).isEqualTo(IdEntry.V4);
        assertThat(record.load(Ipv4AddrEntry.DECODER).getAddress()).isEqualTo(InetAddress.getByName("192.0.2.1"));
    }

    @Test
    void shouldReportMissingKey() throws EnrException {
        var record = NodeRecord.builder().set(IdEntry.V4).build();

        assertThatThrownBy(() -> record.load(PortEntry.Tcp.DECODER))
                .isInstanceOf(KeyException.class)
                .hasMessage("missing ENR key \"tcp\"")
                .satisfies(e -> assertThat(KeyException.isNotFound(e)).isTrue())
                .extracting("key")
                .isEqualTo("tcp");
    }

    @Test
    void shouldWrapDecodeFailureWithKey() throws EnrException {
        var record = NodeRecord.builder()
                .set(GenericEntry.of("ip", new byte[]{1, 2, 3}, ValueCodec.BYTES))
                .build();

        assertThatThrownBy(() -> record.load(Ipv4AddrEntry.DECODER))
                .isInstanceOf(KeyException.class)
                .hasMessageStartingWith("ENR key \"ip\": ")
                .satisfies(e -> assertThat(KeyException.isNotFound(e)).isFalse())
                .extracting("errorType")
                .isEqualTo(ErrorType.WRONG_SIZE);
    }

    @Test
    void shouldLeaveBuilderUnchangedWhenSetFails() throws Exception {
        var builder = NodeRecord.builder().set(IdEntry.V4);

        assertThatThrownBy(() -> builder.set(new Ipv4AddrEntry(InetAddress.getByName("2001:db8::1"))))
                .isInstanceOf(KeyException.class)
                .hasMessage("ENR key \"ip\": address is not IPv4")
                .extracting("errorType")
                .isEqualTo(ErrorType.ADDRESS_FAMILY_MISMATCH);
        assertThat(builder.build().keys()).containsExactly("id");
    }

    @Test
    void shouldReplaceExistingValue() throws EnrException {
        var record = NodeRecord.builder()
                .set(PortEntry.tcp(1000))
                .set(PortEntry.tcp(2000))
                .build();

        assertThat(record.size()).isEqualTo(1);
        assertThat(record.load(PortEntry.Tcp.DECODER).getPort()).isEqualTo(2000);
    }

    @Test
    void shouldRoundtripThroughWireForm() throws Exception {
        var record = NodeRecord.builder()
                .seq(-1L)
                .set(IdEntry.V4)
                .set(new Ipv4AddrEntry(InetAddress.getByName("10.0.0.1")))
                .set(PortEntry.tcp(30303))
                .set(GenericEntry.of("eth", "mainnet", ValueCodec.STRING))
                .build();

        var decoded = NodeRecord.decode(record.encode());

        assertThat(decoded).isEqualTo(record);
        assertThat(decoded.hashCode()).isEqualTo(record.hashCode());
        assertThat(Long.toUnsignedString(decoded.getSeq())).isEqualTo("18446744073709551615");
        assertThat(decoded.toString()).contains("seq=18446744073709551615");
    }

    @Test
    void shouldRejectUnsortedKeys() {
        byte[] encoded = new RlpWriter()
                .startList()
                .writeUint(1)
                .writeString("udp").writeUint(30303)
                .writeString("id").writeString("v4")
                .endList()
                .toByteArray();

        assertThatThrownBy(() -> NodeRecord.decode(encoded))
                .isInstanceOf(EnrException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.KEYS_NOT_SORTED);
    }

    @Test
    void shouldRejectDuplicateKeys() {
        byte[] encoded = new RlpWriter()
                .startList()
                .writeUint(1)
                .writeString("id").writeString("v4")
                .writeString("id").writeString("v4")
                .endList()
                .toByteArray();

        assertThatThrownBy(() -> NodeRecord.decode(encoded))
                .isInstanceOf(EnrException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.DUPLICATE_KEY);
    }

    @Test
    void shouldOrderKeysByEncodedBytes() throws EnrException {
        String fullwidth = "\uFF00";
        String emoji = "\uD83D\uDE00";
        var record = NodeRecord.builder()
                .set(GenericEntry.of(emoji, 1L, ValueCodec.UINT64))
                .set(GenericEntry.of(fullwidth, 2L, ValueCodec.UINT64))
                .set(IdEntry.V4)
                .build();

        assertThat(record.keys()).containsExactly("id", fullwidth, emoji);
        assertThat(NodeRecord.decode(record.encode())).isEqualTo(record);
        assertThat(NodeRecord.decode(record.encode()).keys()).containsExactly("id", fullwidth, emoji);

        byte[] reversed = new RlpWriter()
                .startList()
                .writeUint(1)
                .writeString(emoji).writeUint(1)
                .writeString(fullwidth).writeUint(2)
                .endList()
                .toByteArray();
        assertThatThrownBy(() -> NodeRecord.decode(reversed))
                .isInstanceOf(EnrException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.KEYS_NOT_SORTED);
    }

    @Test
    void shouldRejectMalformedKeyBytes() {
        byte[] encoded = new RlpWriter()
                .startList()
                .writeUint(1)
                .writeBytes(new byte[]{'i', (byte) 0xff})
                .writeUint(1)
                .endList()
                .toByteArray();

        assertThatThrownBy(() -> NodeRecord.decode(encoded))
                .isInstanceOf(EnrException.class)
                .hasMessage("record key is not valid UTF-8: 0x69ff")
                .extracting("errorType")
                .isEqualTo(ErrorType.INVALID_KEY);
    }

    @Test
    void shouldRejectKeyThatCannotBeEncoded() throws EnrException {
        var builder = NodeRecord.builder().set(IdEntry.V4);

        assertThatThrownBy(() -> builder.set(GenericEntry.of("\uD800", "x", ValueCodec.STRING)))
                .isInstanceOf(KeyException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.INVALID_KEY);
        assertThat(builder.build().keys()).containsExactly("id");
    }

    @Test
    void shouldRejectMissingValue() {
        byte[] encoded = new RlpWriter()
                .startList()
                .writeUint(1)
                .writeString("id")
                .endList()
                .toByteArray();

        assertThatThrownBy(() -> NodeRecord.decode(encoded))
                .isInstanceOf(EnrException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.END_OF_LIST);
    }

    @Test
    void shouldEnforceSizeLimit() throws EnrException {
        var record = NodeRecord.builder()
                .set(GenericEntry.of("big", new byte[400], ValueCodec.BYTES))
                .build();

        assertThatThrownBy(record::encode)
                .isInstanceOf(EnrException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.RECORD_TOO_LARGE);
        assertThatThrownBy(() -> NodeRecord.decode(new byte[301]))
                .isInstanceOf(EnrException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.RECORD_TOO_LARGE);
    }

    @Test
    void shouldFallBackToRawEntries() throws EnrException {
        var record = NodeRecord.builder()
                .set(IdEntry.V4)
                .set(GenericEntry.of("ip", new byte[]{1, 2, 3}, ValueCodec.BYTES))
                .set(GenericEntry.of("eth", "mainnet", ValueCodec.STRING))
                .build();

        var entries = record.entries();

        assertThat(entries).hasSize(3);
        assertThat(entries.get(0)).isInstanceOf(RawEntry.class);
        assertThat(entries.get(0).getEnrKey()).isEqualTo("eth");
        assertThat(entries.get(1)).isEqualTo(IdEntry.V4);
        assertThat(entries.get(2)).isInstanceOf(RawEntry.class);
        assertThat(((RawEntry) entries.get(2)).getEncoded()).containsExactly(0x83, 1, 2, 3);
    }

    @Test
    void shouldDeriveBuilderFromRecord() throws EnrException {
        var original = NodeRecord.builder()
                .seq(5)
                .set(IdEntry.V4)
                .set(PortEntry.tcp(30303))
                .build();

        var updated = original.toBuilder()
                .seq(6)
                .remove(PortEntry.Tcp.KEY)
                .set(PortEntry.udp(30303))
                .build();

        assertThat(original.keys()).containsExactly("id", "tcp");
        assertThat(updated.keys()).containsExactly("id", "udp");
        assertThat(updated.getSeq()).isEqualTo(6);
        assertThat(updated.has("tcp")).isFalse();
    }

    @Test
    void shouldCopyEncodedValues() throws EnrException {
        var record = NodeRecord.builder().set(PortEntry.tcp(30303)).build();

        byte[] value = record.getEncodedValue("tcp").orElseThrow();
        value[0] = 0;

        assertThat(record.getEncodedValue("tcp")).hasValueSatisfying(v -> assertThat(v).containsExactly(0x82, 0x76, 0x5f));
        assertThat(record.getEncodedValue("udp")).isEmpty();
    }
}
