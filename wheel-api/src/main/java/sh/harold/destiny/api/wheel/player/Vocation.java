package sh.harold.destiny.api.wheel.player;

/**
 * Base vocations, carrying the id the client expects in wheel payloads.
 */
public enum Vocation {
    NONE(0),
    KNIGHT(1),
    PALADIN(2),
    SORCERER(3),
    DRUID(4);

    private final int clientId;

    Vocation(int clientId) {
        this.clientId = clientId;
    }

    public int getClientId() {
        return clientId;
    }
}
