package sh.harold.destiny.api.wheel.network;

/**
 * Write side of a client message. Framing and byte order belong to the transport.
 */
public interface WheelMessageWriter {

    void writeByte(int value);

    void writeShort(int value);

    void writeInt(long value);

    void writeString(String value);

    default void writeBoolean(boolean value) {
        writeByte(value ? 1 : 0);
    }
}
