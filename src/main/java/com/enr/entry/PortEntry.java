package com.enr.entry;

import com.enr.error.EnrException;
import com.enr.rlp.RlpReader;
import com.enr.rlp.RlpWriter;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.function.IntFunction;

/**
 * An unsigned 16-bit port number. Each subclass binds the port to one record key.
 */
@Getter
@EqualsAndHashCode
public abstract class PortEntry implements Entry {
    public static final int MAX_PORT = 0xFFFF;

    private final int port;

    protected PortEntry(int port) {
        if (port < 0 || port > MAX_PORT) {
            throw new IllegalArgumentException("Port must be 0-" + MAX_PORT + ", got: " + port);
        }
        this.port = port;
    }

    @Override
    public void encode(RlpWriter writer) {
        writer.writeUint(port);
    }

    @Override
    public String toString() {
        return getEnrKey() + "=" + port;
    }

    // Factory methods
    public static Tcp tcp(int port) {
        return new Tcp(port);
    }

    public static Tcp6 tcp6(int port) {
        return new Tcp6(port);
    }

    public static Udp udp(int port) {
        return new Udp(port);
    }

    public static Udp6 udp6(int port) {
        return new Udp6(port);
    }

    public static Quic quic(int port) {
        return new Quic(port);
    }

    public static Quic6 quic6(int port) {
        return new Quic6(port);
    }

    private static <T extends PortEntry> EntryDecoder<T> decoder(String key, IntFunction<T> factory) {
        return new EntryDecoder<>() {
            @Override
            public String getEnrKey() {
                return key;
            }

            @Override
            public T decode(RlpReader reader) throws EnrException {
                return factory.apply(reader.readUint16());
            }
        };
    }

    /** The "tcp" key: TCP port of the node. */
    @EqualsAndHashCode(callSuper = true)
    public static final class Tcp extends PortEntry {
        public static final String KEY = "tcp";
        public static final EntryDecoder<Tcp> DECODER = decoder(KEY, Tcp::new);

        public Tcp(int port) {
            super(port);
        }

        @Override
        public String getEnrKey() { return KEY; }
    }

    /** The "tcp6" key: IPv6-specific TCP port. */
    @EqualsAndHashCode(callSuper = true)
    public static final class Tcp6 extends PortEntry {
        public static final String KEY = "tcp6";
        public static final EntryDecoder<Tcp6> DECODER = decoder(KEY, Tcp6::new);

        public Tcp6(int port) {
            super(port);
        }

        @Override
        public String getEnrKey() { return KEY; }
    }

    /** The "udp" key: UDP port of the node. */
    @EqualsAndHashCode(callSuper = true)
    public static final class Udp extends PortEntry {
        public static final String KEY = "udp";
        public static final EntryDecoder<Udp> DECODER = decoder(KEY, Udp::new);

        public Udp(int port) {
            super(port);
        }

        @Override
        public String getEnrKey() { return KEY; }
    }

    /** The "udp6" key: IPv6-specific UDP port. */
    @EqualsAndHashCode(callSuper = true)
    public static final class Udp6 extends PortEntry {
        public static final String KEY = "udp6";
        public static final EntryDecoder<Udp6> DECODER = decoder(KEY, Udp6::new);

        public Udp6(int port) {
            super(port);
        }

        @Override
        public String getEnrKey() { return KEY; }
    }

    /** The "quic" key: QUIC port of the node. */
    @EqualsAndHashCode(callSuper = true)
    public static final class Quic extends PortEntry {
        public static final String KEY = "quic";
        public static final EntryDecoder<Quic> DECODER = decoder(KEY, Quic::new);

        public Quic(int port) {
            super(port);
        }

        @Override
        public String getEnrKey() { return KEY; }
    }

    /** The "quic6" key: IPv6-specific QUIC port. */
    @EqualsAndHashCode(callSuper = true)
    public static final class Quic6 extends PortEntry {
        public static final String KEY = "quic6";
        public static final EntryDecoder<Quic6> DECODER = decoder(KEY, Quic6::new);

        public Quic6(int port) {
            super(port);
        }

        @Override
        public String getEnrKey() { return KEY; }
    }
}
