package sh.harold.destiny.api.wheel.network;

/**
 * Read side of a client message. Framing and byte order belong to the transport.
 */
public interface WheelMessageReader {

    int readUnsignedShort();
}
