package com.enr.entry;

import com.enr.Constants;
import com.enr.error.EnrException;
import com.enr.error.ErrorType;
import com.enr.rlp.RlpReader;
import com.enr.rlp.RlpWriter;
import lombok.Value;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * The "ip6" key, holding the IPv6 address of the node as an {@link InetAddress}.
 * <p>
 * Only {@link Inet6Address} values can be encoded. Note that
 * {@link InetAddress#getByName(String)} returns an {@code Inet4Address} for IPv4-mapped
 * literals such as {@code ::ffff:192.0.2.1}, so those are rejected. Decoding always
 * yields an {@code Inet6Address}, IPv4-mapped bytes included.
 */
@Value
public class Ipv6AddrEntry implements Entry {
    public static final String KEY = "ip6";

    public static final EntryDecoder<Ipv6AddrEntry> DECODER = new EntryDecoder<>() {
        @Override
        public String getEnrKey() {
            return KEY;
        }

        @Override
        public Ipv6AddrEntry decode(RlpReader reader) throws EnrException {
            byte[] bytes = reader.readFixedBytes(Constants.IPV6_BYTES);
            try {
                return new Ipv6AddrEntry(Inet6Address.getByAddress(null, bytes, -1));
            } catch (UnknownHostException e) {
                throw new EnrException(ErrorType.INVALID_IP_ADDRESS, "invalid IPv6 address", e);
            }
        }
    };

    InetAddress address;

    public Ipv6AddrEntry(InetAddress address) {
        this.address = Objects.requireNonNull(address, "Address cannot be null");
    }

    @Override
    public String getEnrKey() {
        return KEY;
    }

    @Override
    public void encode(RlpWriter writer) throws EnrException {
        if (!(address instanceof Inet6Address)) {
            throw new EnrException(ErrorType.ADDRESS_FAMILY_MISMATCH, "address is not IPv6");
        }
        writer.writeBytes(address.getAddress());
    }

    @Override
    public String toString() {
        return KEY + "=" + address.getHostAddress();
    }
}
