package sh.harold.destiny.wheel.config;

import sh.harold.destiny.api.wheel.bonus.WheelStage;
import sh.harold.destiny.api.wheel.gem.GemQuality;
import sh.harold.destiny.api.wheel.slot.SlotTier;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tunable numbers of the wheel engine.
 *
 * Every value has a default, so an empty or missing {@code wheel.yml}
 * yields a working configuration.
 */
public class WheelConfig {

    // Default values
    private static final int DEFAULT_MIN_LEVEL = 50;
    private static final int DEFAULT_POINTS_PER_LEVEL = 1;
    private static final int[] DEFAULT_STAGE_THRESHOLDS = {250, 500, 1000};
    private static final int DEFAULT_MAX_REVEALED = 225;
    private static final int DEFAULT_RETRY_CEILING = 3;
    private static final double DEFAULT_MITIGATION_FLOOR = 0.10;
    private static final long DEFAULT_MASTERY_INTERVAL_MILLIS = 2000;
    private static final int[] DEFAULT_GIFT_HEAL_PERCENT = {20, 25, 30};
    private static final int[] DEFAULT_GIFT_COOLDOWN_SECONDS = {108000, 72000, 36000};
    private static final long DEFAULT_GIFT_SPELL_COOLDOWN_REDUCTION_MILLIS = 60000;

    private final int minLevel;
    private final int pointsPerLevel;
    private final Map<SlotTier, Integer> slotCaps;
    private final int[] stageThresholds;
    private final Map<GemQuality, Long> revealCosts;
    private final Map<GemQuality, Long> rotateCosts;
    private final Map<GemQuality, Integer> revelationPoints;
    private final int maxRevealedGems;
    private final int retryCeiling;
    private final double mitigationFloor;
    private final long masteryIntervalMillis;
    private final int[] giftOfLifeHealPercent;
    private final int[] giftOfLifeCooldownSeconds;
    private final long giftOfLifeSpellCooldownReductionMillis;

    private WheelConfig(Builder builder) {
        this.minLevel = builder.minLevel;
        this.pointsPerLevel = builder.pointsPerLevel;
        this.slotCaps = Collections.unmodifiableMap(new EnumMap<>(builder.slotCaps));
        this.stageThresholds = builder.stageThresholds.clone();
        this.revealCosts = Collections.unmodifiableMap(new EnumMap<>(builder.revealCosts));
        this.rotateCosts = Collections.unmodifiableMap(new EnumMap<>(builder.rotateCosts));
        this.revelationPoints = Collections.unmodifiableMap(new EnumMap<>(builder.revelationPoints));
        this.maxRevealedGems = builder.maxRevealedGems;
        this.retryCeiling = builder.retryCeiling;
        this.mitigationFloor = builder.mitigationFloor;
        this.masteryIntervalMillis = builder.masteryIntervalMillis;
        this.giftOfLifeHealPercent = builder.giftOfLifeHealPercent.clone();
        this.giftOfLifeCooldownSeconds = builder.giftOfLifeCooldownSeconds.clone();
        this.giftOfLifeSpellCooldownReductionMillis = builder.giftOfLifeSpellCooldownReductionMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WheelConfig defaults() {
        return new Builder().build();
    }

    public int getMinLevel() { return minLevel; }
    public int getPointsPerLevel() { return pointsPerLevel; }
    public int getSlotCap(SlotTier tier) { return slotCaps.get(tier); }
    public int getMaxRevealedGems() { return maxRevealedGems; }
    public int getRetryCeiling() { return retryCeiling; }
    public double getMitigationFloor() { return mitigationFloor; }
    public long getMasteryIntervalMillis() { return masteryIntervalMillis; }
    public long getGiftOfLifeSpellCooldownReductionMillis() { return giftOfLifeSpellCooldownReductionMillis; }

    public long getRevealCost(GemQuality quality) {
        return revealCosts.get(quality);
    }

    public long getRotateCost(GemQuality quality) {
        return rotateCosts.get(quality);
    }

    public int getRevelationPoints(GemQuality quality) {
        return revelationPoints.get(quality);
    }

    /**
     * Points needed to reach the given stage.
     *
     * @param stage 1..3
     */
    public int getStageThreshold(int stage) {
        return stageThresholds[checkStage(stage) - 1];
    }

    /**
     * @param stage 1..3
     * @return heal in percent of max health
     */
    public int getGiftOfLifeHealPercent(int stage) {
        return giftOfLifeHealPercent[checkStage(stage) - 1];
    }

    /**
     * @param stage 1..3
     */
    public int getGiftOfLifeCooldownSeconds(int stage) {
        return giftOfLifeCooldownSeconds[checkStage(stage) - 1];
    }

    private static int checkStage(int stage) {
        if (stage < 1 || stage > WheelStage.MAX_STAGE) {
            throw new IllegalArgumentException("Stage out of range: " + stage);
        }
        return stage;
    }

    @Override
    public String toString() {
        return "WheelConfig{" +
                "minLevel=" + minLevel +
                ", pointsPerLevel=" + pointsPerLevel +
                ", slotCaps=" + slotCaps +
                ", stageThresholds=" + Arrays.toString(stageThresholds) +
                ", revealCosts=" + revealCosts +
                ", rotateCosts=" + rotateCosts +
                ", maxRevealedGems=" + maxRevealedGems +
                ", retryCeiling=" + retryCeiling +
                ", mitigationFloor=" + mitigationFloor +
                '}';
    }

    /**
     * Builder class for wheel configurations.
     */
    public static class Builder {
        private int minLevel = DEFAULT_MIN_LEVEL;
        private int pointsPerLevel = DEFAULT_POINTS_PER_LEVEL;
        private final Map<SlotTier, Integer> slotCaps = new EnumMap<>(SlotTier.class);
        private int[] stageThresholds = DEFAULT_STAGE_THRESHOLDS.clone();
        private final Map<GemQuality, Long> revealCosts = new EnumMap<>(GemQuality.class);
        private final Map<GemQuality, Long> rotateCosts = new EnumMap<>(GemQuality.class);
        private final Map<GemQuality, Integer> revelationPoints = new EnumMap<>(GemQuality.class);
        private int maxRevealedGems = DEFAULT_MAX_REVEALED;
        private int retryCeiling = DEFAULT_RETRY_CEILING;
        private double mitigationFloor = DEFAULT_MITIGATION_FLOOR;
        private long masteryIntervalMillis = DEFAULT_MASTERY_INTERVAL_MILLIS;
        private int[] giftOfLifeHealPercent = DEFAULT_GIFT_HEAL_PERCENT.clone();
        private int[] giftOfLifeCooldownSeconds = DEFAULT_GIFT_COOLDOWN_SECONDS.clone();
        private long giftOfLifeSpellCooldownReductionMillis = DEFAULT_GIFT_SPELL_COOLDOWN_REDUCTION_MILLIS;

        private Builder() {
            for (SlotTier tier : SlotTier.values()) {
                slotCaps.put(tier, tier.getDefaultCap());
            }
            revealCosts.put(GemQuality.LESSER, 125_000L);
            revealCosts.put(GemQuality.REGULAR, 1_000_000L);
            revealCosts.put(GemQuality.GREATER, 6_000_000L);
            revealCosts.put(GemQuality.EPIC, 10_000_000L);
            rotateCosts.put(GemQuality.LESSER, 125_000L);
            rotateCosts.put(GemQuality.REGULAR, 250_000L);
            rotateCosts.put(GemQuality.GREATER, 500_000L);
            rotateCosts.put(GemQuality.EPIC, 1_000_000L);
            revelationPoints.put(GemQuality.LESSER, 50);
            revelationPoints.put(GemQuality.REGULAR, 100);
            revelationPoints.put(GemQuality.GREATER, 150);
            revelationPoints.put(GemQuality.EPIC, 200);
        }

        public Builder minLevel(int minLevel) {
            if (minLevel < 0) {
                throw new IllegalArgumentException("minLevel must be non-negative");
            }
            this.minLevel = minLevel;
            return this;
        }

        public Builder pointsPerLevel(int pointsPerLevel) {
            if (pointsPerLevel < 0) {
                throw new IllegalArgumentException("pointsPerLevel must be non-negative");
            }
            this.pointsPerLevel = pointsPerLevel;
            return this;
        }

        public Builder slotCap(SlotTier tier, int cap) {
            if (cap < 0) {
                throw new IllegalArgumentException("Slot cap must be non-negative");
            }
            slotCaps.put(Objects.requireNonNull(tier, "tier cannot be null"), cap);
            return this;
        }

        /**
         * Sets the points needed for stages 1, 2 and 3.
         */
        public Builder stageThresholds(int first, int second, int third) {
            if (first <= 0 || second < first || third < second) {
                throw new IllegalArgumentException("Stage thresholds must be positive and non-decreasing");
            }
            this.stageThresholds = new int[]{first, second, third};
            return this;
        }

        public Builder revealCost(GemQuality quality, long cost) {
            revealCosts.put(Objects.requireNonNull(quality, "quality cannot be null"), requireNonNegative(cost, "reveal cost"));
            return this;
        }

        public Builder rotateCost(GemQuality quality, long cost) {
            rotateCosts.put(Objects.requireNonNull(quality, "quality cannot be null"), requireNonNegative(cost, "rotate cost"));
            return this;
        }

        public Builder revelationPoints(GemQuality quality, int points) {
            revelationPoints.put(Objects.requireNonNull(quality, "quality cannot be null"),
                    (int) requireNonNegative(points, "revelation points"));
            return this;
        }

        public Builder maxRevealedGems(int maxRevealedGems) {
            if (maxRevealedGems <= 0) {
                throw new IllegalArgumentException("maxRevealedGems must be positive");
            }
            this.maxRevealedGems = maxRevealedGems;
            return this;
        }

        public Builder retryCeiling(int retryCeiling) {
            if (retryCeiling <= 0) {
                throw new IllegalArgumentException("retryCeiling must be positive");
            }
            this.retryCeiling = retryCeiling;
            return this;
        }

        public Builder mitigationFloor(double mitigationFloor) {
            if (mitigationFloor < 0 || mitigationFloor > 1) {
                throw new IllegalArgumentException("mitigationFloor must be within 0..1");
            }
            this.mitigationFloor = mitigationFloor;
            return this;
        }

        public Builder masteryIntervalMillis(long masteryIntervalMillis) {
            this.masteryIntervalMillis = requireNonNegative(masteryIntervalMillis, "mastery interval");
            return this;
        }

        public Builder giftOfLifeHealPercent(int stage1, int stage2, int stage3) {
            this.giftOfLifeHealPercent = new int[]{stage1, stage2, stage3};
            return this;
        }

        public Builder giftOfLifeCooldownSeconds(int stage1, int stage2, int stage3) {
            this.giftOfLifeCooldownSeconds = new int[]{stage1, stage2, stage3};
            return this;
        }

        public Builder giftOfLifeSpellCooldownReductionMillis(long millis) {
            this.giftOfLifeSpellCooldownReductionMillis = requireNonNegative(millis, "spell cooldown reduction");
            return this;
        }

        public WheelConfig build() {
            for (GemQuality quality : GemQuality.values()) {
                // Cost must not fall as quality rises
                if (quality.ordinal() > 0
                        && revealCosts.get(quality) < revealCosts.get(GemQuality.values()[quality.ordinal() - 1])) {
                    throw new IllegalArgumentException("Reveal cost must not decrease with quality: " + quality);
                }
            }
            return new WheelConfig(this);
        }

        private static long requireNonNegative(long value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be non-negative");
            }
            return value;
        }
    }
}
