package com.enr.util;

import com.enr.Constants;
import lombok.experimental.UtilityClass;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

/**
 * Conversions between the 4-byte and 16-byte forms of raw IP addresses.
 * An IPv4 address may be held either as 4 bytes or in IPv4-mapped form ({@code ::ffff:a.b.c.d}).
 */
@UtilityClass
public class IpBytes {

    private static final byte[] V4_IN_V6_PREFIX = {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, (byte) 0xff, (byte) 0xff};

    /**
     * Returns the 4-byte form of {@code ip}, or {@code null} if it is not an IPv4 address.
     */
    public static byte[] to4(byte[] ip) {
        if (ip == null) {
            return null;
        }
        if (ip.length == Constants.IPV4_BYTES) {
            return ip.clone();
        }
        if (ip.length == Constants.IPV6_BYTES
                && Arrays.equals(ip, 0, V4_IN_V6_PREFIX.length, V4_IN_V6_PREFIX, 0, V4_IN_V6_PREFIX.length)) {
            return Arrays.copyOfRange(ip, V4_IN_V6_PREFIX.length, Constants.IPV6_BYTES);
        }
        return null;
    }

    /**
     * Returns the 16-byte form of {@code ip}, or {@code null} if it has neither valid length.
     * IPv4 addresses are returned in their IPv4-mapped form.
     */
    public static byte[] to16(byte[] ip) {
        if (ip == null) {
            return null;
        }
        if (ip.length == Constants.IPV6_BYTES) {
            return ip.clone();
        }
        if (ip.length == Constants.IPV4_BYTES) {
            byte[] out = new byte[Constants.IPV6_BYTES];
            System.arraycopy(V4_IN_V6_PREFIX, 0, out, 0, V4_IN_V6_PREFIX.length);
            System.arraycopy(ip, 0, out, V4_IN_V6_PREFIX.length, Constants.IPV4_BYTES);
            return out;
        }
        return null;
    }

    /**
     * Formats {@code ip} for messages: the usual textual form for 4 or 16 bytes,
     * otherwise {@code ?} followed by the bytes in hex.
     */
    public static String format(byte[] ip) {
        if (ip == null || ip.length == 0) {
            return "<nil>";
        }
        if (ip.length == Constants.IPV4_BYTES || ip.length == Constants.IPV6_BYTES) {
            try {
                return InetAddress.getByAddress(ip).getHostAddress();
            } catch (UnknownHostException e) {
                throw new IllegalStateException("address of valid length rejected", e);
            }
        }
        return "?" + hex(ip);
    }

    public static String hex(byte[] bytes) {
        var sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
