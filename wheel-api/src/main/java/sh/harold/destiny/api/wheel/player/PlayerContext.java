package sh.harold.destiny.api.wheel.player;

import java.util.UUID;

/**
 * Live view of the player a wheel is bound to. The wheel only reads through
 * this interface and never changes the player's identity fields; the one
 * side effect it may request is spending money or shortening spell cooldowns.
 */
public interface PlayerContext {

    UUID getId();

    int getLevel();

    Vocation getVocation();

    boolean isPremium();

    /**
     * @return true once the player has been promoted in their vocation
     */
    boolean isPromoted();

    boolean isInTemple();

    boolean isInFight();

    boolean isInProtectionZone();

    /**
     * Count hostile creatures within the given radius in tiles.
     *
     * @param radius search radius, 1 means adjacent tiles only
     * @return number of creatures found
     */
    int countNearbyCreatures(int radius);

    long getMoney();

    /**
     * Try to take money from the player.
     *
     * @param amount amount to remove, never negative
     * @return true if the full amount was removed
     */
    boolean removeMoney(long amount);

    int getHealth();

    int getMaxHealth();

    int getShieldSkill();

    boolean isWieldingShield();

    boolean isWieldingTwoHandedWeapon();

    boolean isWieldingDistanceWeapon();

    boolean isOnDivineEmpowermentField();

    /**
     * Points granted by sources outside the wheel, such as events or store items.
     */
    default int getExtraWheelPoints() {
        return 0;
    }

    /**
     * Shorten every running spell cooldown.
     *
     * @param millis amount to remove from each cooldown
     */
    default void reduceSpellCooldowns(long millis) {
    }
}
