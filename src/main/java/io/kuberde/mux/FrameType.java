package io.kuberde.mux;

public enum FrameType {
    DATA(0),
    WINDOW_UPDATE(1),
    PING(2),
    GO_AWAY(3),
    REAUTH(4);

    private final int code;

    FrameType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static FrameType fromCode(int code) throws MuxException {
        for (FrameType value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        throw new MuxException("Unknown frame type: " + code);
    }
}
