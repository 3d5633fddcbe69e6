package io.kuberde.mux;

/**
 * One decoded frame. For {@code DATA} and {@code REAUTH} the payload holds {@code length} bytes;
 * for the other types {@code length} carries the value itself (window delta, ping id, go-away code)
 * and the payload is empty.
 */
public record Frame(FrameType type, int flags, int streamId, long length, byte[] payload) {
    public static final int VERSION = 0;
    public static final int HEADER_SIZE = 12;

    public static final int FLAG_SYN = 0x1;
    public static final int FLAG_ACK = 0x2;
    public static final int FLAG_FIN = 0x4;
    public static final int FLAG_RST = 0x8;

    public static final int GO_AWAY_NORMAL = 0;
    public static final int GO_AWAY_PROTOCOL_ERROR = 1;
    public static final int GO_AWAY_UNAUTHORIZED = 2;

    private static final byte[] EMPTY = new byte[0];

    public Frame {
        payload = payload == null ? EMPTY : payload;
    }

    public static Frame control(FrameType type, int flags, int streamId, long value) {
        return new Frame(type, flags, streamId, value, EMPTY);
    }

    public static Frame data(int flags, int streamId, byte[] payload) {
        return new Frame(FrameType.DATA, flags, streamId, payload.length, payload);
    }

    public boolean has(int flag) {
        return (flags & flag) != 0;
    }

    public boolean carriesPayload() {
        return type == FrameType.DATA || type == FrameType.REAUTH;
    }
}
