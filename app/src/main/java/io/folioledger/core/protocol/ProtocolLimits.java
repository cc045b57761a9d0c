package io.folioledger.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_PAYLOAD_BYTES = 8 * 1024;
    public static final int MAX_ID_LEN = 128;
    /** A full block of worst-case transactions (about 50 KB each as JSON) must fit one frame. */
    public static final int MAX_TXS_PER_BLOCK = 1_000;
    /** Largest frame accepted by the peer transport. */
    public static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;
    /** Encoded size a catch-up reply aims for; a single larger block is still sent alone. */
    public static final int MAX_REPLY_BYTES = 8 * 1024 * 1024;
}
