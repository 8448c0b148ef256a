package com.enr.entry;

import com.enr.Constants;
import com.enr.error.EnrException;
import com.enr.error.ErrorType;
import com.enr.rlp.RlpReader;
import com.enr.rlp.RlpWriter;
import lombok.Value;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * The "ip" key, holding the IPv4 address of the node as an {@link InetAddress}.
 * Only {@link Inet4Address} values can be encoded; decoding always yields one.
 */
@Value
public class Ipv4AddrEntry implements Entry {
    public static final String KEY = "ip";

    public static final EntryDecoder<Ipv4AddrEntry> DECODER = new EntryDecoder<>() {
        @Override
        public String getEnrKey() {
            return KEY;
        }

        @Override
        public Ipv4AddrEntry decode(RlpReader reader) throws EnrException {
            byte[] bytes = reader.readFixedBytes(Constants.IPV4_BYTES);
            try {
                return new Ipv4AddrEntry(InetAddress.getByAddress(bytes));
            } catch (UnknownHostException e) {
                throw new EnrException(ErrorType.INVALID_IP_ADDRESS, "invalid IPv4 address", e);
            }
        }
    };

    InetAddress address;

    public Ipv4AddrEntry(InetAddress address) {
        this.address = Objects.requireNonNull(address, "Address cannot be null");
    }

    @Override
    public String getEnrKey() {
        return KEY;
    }

    @Override
    public void encode(RlpWriter writer) throws EnrException {
        if (!(address instanceof Inet4Address)) {
            throw new EnrException(ErrorType.ADDRESS_FAMILY_MISMATCH, "address is not IPv4");
        }
        writer.writeBytes(address.getAddress());
    }

    @Override
    public String toString() {
        return KEY + "=" + address.getHostAddress();
    }
}
