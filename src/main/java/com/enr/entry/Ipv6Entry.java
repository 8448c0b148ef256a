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
 * The "ip6" key, holding the IPv6 address of the node as raw bytes.
 * A 4-byte address is widened to its IPv4-mapped form on encode.
 */
@EqualsAndHashCode
public final class Ipv6Entry implements Entry {
    public static final String KEY = "ip6";

    public static final EntryDecoder<Ipv6Entry> DECODER = new EntryDecoder<>() {
        @Override
        public String getEnrKey() {
            return KEY;
        }

        @Override
        public Ipv6Entry decode(RlpReader reader) throws EnrException {
            byte[] bytes = reader.readBytes();
            if (bytes.length != Constants.IPV6_BYTES) {
                throw new EnrException(ErrorType.INVALID_IP_ADDRESS,
                        "invalid IPv6 address, want 16 bytes: " + IpBytes.format(bytes));
            }
            return new Ipv6Entry(bytes);
        }
    };

    private final byte[] address;

    public Ipv6Entry(byte[] address) {
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
        byte[] ip6 = IpBytes.to16(address);
        if (ip6 == null) {
            throw new EnrException(ErrorType.INVALID_IP_ADDRESS, "invalid IPv6 address: " + IpBytes.format(address));
        }
        writer.writeBytes(ip6);
    }

    @Override
    public String toString() {
        return KEY + "=" + IpBytes.format(address);
    }
}
