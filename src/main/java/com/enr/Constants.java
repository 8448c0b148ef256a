package com.enr;

public final class Constants {
    /** Maximum encoded size of a node record, in bytes. */
    public static final int SIZE_LIMIT = Integer.getInteger("enr.record.size.limit", 300);

    /** Name of the default identity scheme. */
    public static final String ID_V4 = "v4";

    public static final int IPV4_BYTES = 4;
    public static final int IPV6_BYTES = 16;

    private Constants() {}
}
