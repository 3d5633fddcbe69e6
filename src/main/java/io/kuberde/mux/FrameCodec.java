package io.kuberde.mux;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Big-endian 12-byte header followed by the payload of DATA and REAUTH frames.
 */
public final class FrameCodec {
    private FrameCodec() {
    }

    public static void write(OutputStream out, Frame frame) throws IOException {
        byte[] header = new byte[Frame.HEADER_SIZE];
        header[0] = (byte) Frame.VERSION;
        header[1] = (byte) frame.type().code();
        header[2] = (byte) (frame.flags() >>> 8);
        header[3] = (byte) frame.flags();
        putInt(header, 4, frame.streamId());
        putInt(header, 8, (int) frame.length());
        out.write(header);
        if (frame.carriesPayload() && frame.payload().length > 0) {
            out.write(frame.payload());
        }
    }

    /**
     * @return the next frame, or {@code null} on a clean end of stream at a frame boundary
     */
    public static Frame read(DataInputStream in, int maxPayload) throws IOException {
        int first = in.read();
        if (first < 0) {
            return null;
        }
        byte[] rest = new byte[Frame.HEADER_SIZE - 1];
        try {
            in.readFully(rest);
        } catch (EOFException e) {
            throw new MuxException("Truncated frame header", e);
        }
        if (first != Frame.VERSION) {
            throw new MuxException("Unsupported protocol version: " + first);
        }
        FrameType type = FrameType.fromCode(rest[0] & 0xFF);
        int flags = ((rest[1] & 0xFF) << 8) | (rest[2] & 0xFF);
        int streamId = getInt(rest, 3);
        long length = getInt(rest, 7) & 0xFFFFFFFFL;
        byte[] payload = null;
        if (type == FrameType.DATA || type == FrameType.REAUTH) {
            if (length > maxPayload) {
                throw new MuxException("Frame payload " + length + " exceeds limit " + maxPayload);
            }
            payload = new byte[(int) length];
            try {
                in.readFully(payload);
            } catch (EOFException e) {
                throw new MuxException("Truncated frame payload", e);
            }
        }
        return new Frame(type, flags, streamId, length, payload);
    }

    private static void putInt(byte[] buf, int offset, int value) {
        buf[offset] = (byte) (value >>> 24);
        buf[offset + 1] = (byte) (value >>> 16);
        buf[offset + 2] = (byte) (value >>> 8);
        buf[offset + 3] = (byte) value;
    }

    private static int getInt(byte[] buf, int offset) {
        return ((buf[offset] & 0xFF) << 24)
                | ((buf[offset + 1] & 0xFF) << 16)
                | ((buf[offset + 2] & 0xFF) << 8)
                | (buf[offset + 3] & 0xFF);
    }
}
