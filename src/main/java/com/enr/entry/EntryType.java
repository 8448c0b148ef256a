package com.enr.entry;

import com.enr.error.EnrException;
import com.enr.rlp.RlpReader;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * The well-known record keys, each bound to the decoder used when a record is read
 * without knowing its contents in advance. "ip" and "ip6" decode to the structured
 * {@link Ipv4AddrEntry} and {@link Ipv6AddrEntry}.
 */
public enum EntryType {
    TCP(PortEntry.Tcp.DECODER),
    TCP6(PortEntry.Tcp6.DECODER),
    UDP(PortEntry.Udp.DECODER),
    UDP6(PortEntry.Udp6.DECODER),
    QUIC(PortEntry.Quic.DECODER),
    QUIC6(PortEntry.Quic6.DECODER),
    ID(IdEntry.DECODER),
    IP(Ipv4AddrEntry.DECODER),
    IP6(Ipv6AddrEntry.DECODER),
    CLIENT(ClientEntry.DECODER);

    @Getter
    private final String key;
    @Getter
    private final EntryDecoder<? extends Entry> decoder;

    private static final Map<String, EntryType> LOOKUP = new HashMap<>();

    static {
        for (var type : values()) {
            LOOKUP.put(type.key, type);
        }
    }

    EntryType(EntryDecoder<? extends Entry> decoder) {
        this.decoder = decoder;
        this.key = decoder.getEnrKey();
    }

    /**
     * @return the type stored under {@code key}, or {@code null} if the key is not well-known.
     */
    public static EntryType fromKey(String key) {
        return LOOKUP.get(key);
    }

    /**
     * Decode the value stored under {@code key}. Well-known keys produce their typed entry and
     * must consume the whole input; any other key produces a {@link RawEntry}.
     */
    public static Entry decode(String key, byte[] encoded) throws EnrException {
        var type = fromKey(key);
        if (type == null) {
            return new RawEntry(key, encoded);
        }
        var reader = new RlpReader(encoded);
        Entry entry = type.decoder.decode(reader);
        reader.finish();
        return entry;
    }
}
