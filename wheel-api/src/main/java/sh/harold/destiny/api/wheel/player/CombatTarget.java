package sh.harold.destiny.api.wheel.player;

/**
 * The creature on the receiving end of a damage or healing hook.
 */
public interface CombatTarget {

    boolean isPlayer();

    boolean isMonster();

    int getHealth();

    int getMaxHealth();

    /**
     * Stage of the drain body debuff currently applied to the target, 0 when none.
     */
    int getDrainBodyDebuffStage();

    default int getHealthPercent() {
        int max = getMaxHealth();
        if (max <= 0) {
            return 0;
        }
        return (int) ((long) getHealth() * 100 / max);
    }
}
