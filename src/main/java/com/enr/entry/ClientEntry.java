package com.enr.entry;

import com.enr.error.EnrException;
import com.enr.error.ErrorType;
import com.enr.rlp.RlpReader;
import com.enr.rlp.RlpWriter;
import com.enr.rlp.ValueCodec;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The "client" key, holding client information as described by EIP-7636.
 * <p>
 * The entry has three optional slots, by convention name, version and build information.
 * On the wire the present slots form a list that must have 2 or 3 elements. Only the count
 * is validated; what each position means is left to the caller. A slot is present when it
 * holds a value, even an empty string.
 */
@Getter
@EqualsAndHashCode
public final class ClientEntry implements Entry {
    public static final String KEY = "client";
    public static final int SLOTS = 3;

    private static final int MIN_LENGTH = 2;

    public static final EntryDecoder<ClientEntry> DECODER = new EntryDecoder<>() {
        @Override
        public String getEnrKey() {
            return KEY;
        }

        @Override
        public ClientEntry decode(RlpReader reader) throws EnrException {
            List<String> list = ValueCodec.STRING_LIST.decode(reader);
            checkLength(list.size());
            return new ClientEntry(list.stream().map(Optional::of).collect(Collectors.toList()));
        }
    };

    private final List<Optional<String>> slots;

    /**
     * @param slots up to three slots; missing trailing slots are empty
     * @throws IllegalArgumentException if more than three slots are given
     */
    public ClientEntry(List<Optional<String>> slots) {
        Objects.requireNonNull(slots, "Slots cannot be null");
        if (slots.size() > SLOTS) {
            throw new IllegalArgumentException("Client info has " + SLOTS + " slots, got: " + slots.size());
        }
        var padded = new ArrayList<Optional<String>>(slots);
        while (padded.size() < SLOTS) {
            padded.add(Optional.empty());
        }
        this.slots = List.copyOf(padded);
    }

    /**
     * Builds an entry from plain strings, {@code null} standing for an empty slot.
     */
    public static ClientEntry of(String... values) {
        return new ClientEntry(Arrays.stream(values).map(Optional::ofNullable).collect(Collectors.toList()));
    }

    public Optional<String> getName() {
        return slots.get(0);
    }

    public Optional<String> getVersion() {
        return slots.get(1);
    }

    public Optional<String> getExtra() {
        return slots.get(2);
    }

    @Override
    public String getEnrKey() {
        return KEY;
    }

    @Override
    public void encode(RlpWriter writer) throws EnrException {
        List<String> present = slots.stream().flatMap(Optional::stream).collect(Collectors.toList());
        checkLength(present.size());
        ValueCodec.STRING_LIST.encode(present, writer);
    }

    @Override
    public String toString() {
        return KEY + "=" + slots.stream().map(s -> s.orElse("<none>")).collect(Collectors.joining("/"));
    }

    private static void checkLength(int length) throws EnrException {
        if (length < MIN_LENGTH || length > SLOTS) {
            throw new EnrException(ErrorType.INVALID_CLIENT_INFO, "invalid client info length: " + length);
        }
    }
}
