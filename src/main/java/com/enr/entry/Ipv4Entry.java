package com.enr.entry;

import com.enr.Constants;
import com.enr.error.EnrException;
import com.enr.error.ErrorType;
import com.enr.rlp.RlpReader;
import com.enr.rlp.RlpWriter;
import com.enr.util.IpBytes;
import lombok.EqualsAndHashCode;

import java.util.Objects;

/**
 * The "ip" key, holding the IPv4 address of the node as raw bytes.
 * An IPv4-mapped IPv6 address is narrowed to its 4-byte form on encode.
 */
@EqualsAndHashCode
public final class Ipv4Entry implements Entry {
    public static final String KEY = "ip";

    public static final EntryDecoder<Ipv4Entry> DECODER = new EntryDecoder<>() {
        @Override
        public String getEnrKey() {
            return KEY;
        }

        @Override
        public Ipv4Entry decode(RlpReader reader) throws EnrException {
            byte[] bytes = reader.readBytes();
            if (bytes.length != Constants.IPV4_BYTES) {
                throw new EnrException(ErrorType.INVALID_IP_ADDRESS,
                        "invalid IPv4 address, want 4 bytes: " + IpBytes.format(bytes));
            }
            return new Ipv4Entry(bytes);
        }
    };

    private final byte[] address;

    public Ipv4Entry(byte[] address) {
        this.address = Objects.requireNonNull(address, "Address cannot be null").clone();
    }

    public byte[] getAddress() {
        return address.clone();
    }

    @Override
    public String getEnrKey() {
        return KEY;
    }

    @Override
    public void encode(RlpWriter writer) throws EnrException {
        byte[] ip4 = IpBytes.to4(address);
        if (ip4 == null) {
            throw new EnrException(ErrorType.INVALID_IP_ADDRESS, "invalid IPv4 address: " + IpBytes.format(address));
        }
        writer.writeBytes(ip4);
    }

    @Override
    public String toString() {
        return KEY + "=" + IpBytes.format(address);
    }
}
