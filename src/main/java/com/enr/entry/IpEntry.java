package com.enr.entry;

import com.enr.Constants;
import com.enr.error.EnrException;
import com.enr.error.ErrorType;
import com.enr.rlp.RlpReader;
import com.enr.rlp.RlpWriter;
import com.enr.util.IpBytes;
import lombok.EqualsAndHashCode;

import java.net.InetAddress;
import java.util.Objects;

/**
 * Either the "ip" or the "ip6" key, depending on the address.
 * <p>
 * Use this entry to write an address that may be of either family: addresses that can
 * be represented in 4 bytes are stored under "ip", all others under "ip6". To read an
 * address of a known family, prefer {@link Ipv4Entry}/{@link Ipv6Entry} or the
 * structured {@link Ipv4AddrEntry}/{@link Ipv6AddrEntry}.
 */
@EqualsAndHashCode
public final class IpEntry implements Entry {

    /** Reads the "ip" key, accepting 4 or 16 bytes. */
    public static final EntryDecoder<IpEntry> V4_DECODER = decoder(Ipv4Entry.KEY);

    /** Reads the "ip6" key, accepting 4 or 16 bytes. */
    public static final EntryDecoder<IpEntry> V6_DECODER = decoder(Ipv6Entry.KEY);

    private final byte[] address;

    /**
     * Takes a copy of {@code address}. Its length is checked on encode, not here.
     */
    public IpEntry(byte[] address) {
        this.address = Objects.requireNonNull(address, "Address cannot be null").clone();
    }

    public static IpEntry of(InetAddress address) {
        return new IpEntry(address.getAddress());
    }

    public byte[] getAddress() {
        return address.clone();
    }

    @Override
    public String getEnrKey() {
        return IpBytes.to4(address) == null ? Ipv6Entry.KEY : Ipv4Entry.KEY;
    }

    @Override
    public void encode(RlpWriter writer) throws EnrException {
        byte[] ip4 = IpBytes.to4(address);
        if (ip4 != null) {
            writer.writeBytes(ip4);
            return;
        }
        byte[] ip6 = IpBytes.to16(address);
        if (ip6 != null) {
            writer.writeBytes(ip6);
            return;
        }
        throw new EnrException(ErrorType.INVALID_IP_ADDRESS, "invalid IP address: " + IpBytes.format(address));
    }

    @Override
    public String toString() {
        return getEnrKey() + "=" + IpBytes.format(address);
    }

    private static EntryDecoder<IpEntry> decoder(String key) {
        return new EntryDecoder<>() {
            @Override
            public String getEnrKey() {
                return key;
            }

            @Override
            public IpEntry decode(RlpReader reader) throws EnrException {
                byte[] bytes = reader.readBytes();
                if (bytes.length != Constants.IPV4_BYTES && bytes.length != Constants.IPV6_BYTES) {
                    throw new EnrException(ErrorType.INVALID_IP_ADDRESS,
                            "invalid IP address, want 4 or 16 bytes: " + IpBytes.format(bytes));
                }
                return new IpEntry(bytes);
            }
        };
    }
}
