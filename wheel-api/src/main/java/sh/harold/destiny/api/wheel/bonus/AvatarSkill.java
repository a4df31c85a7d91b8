package sh.harold.destiny.api.wheel.bonus;

/**
 * Bonuses granted while an avatar spell is running, indexed by avatar stage 1..3.
 */
public enum AvatarSkill {
    NONE(0, 0, 0),
    DAMAGE_REDUCTION(5, 10, 15),
    CRITICAL_CHANCE(100, 100, 100),
    CRITICAL_DAMAGE(5, 10, 15);

    private final int[] valuesByStage;

    AvatarSkill(int stage1, int stage2, int stage3) {
        this.valuesByStage = new int[]{0, stage1, stage2, stage3};
    }

    /**
     * @param stage avatar stage, clamped to 0..3
     * @return bonus in percent, 0 at stage 0
     */
    public int getValue(int stage) {
        int clamped = Math.max(0, Math.min(WheelStage.MAX_STAGE, stage));
        return valuesByStage[clamped];
    }
}
