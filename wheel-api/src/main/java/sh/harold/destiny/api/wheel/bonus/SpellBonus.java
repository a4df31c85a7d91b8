package sh.harold.destiny.api.wheel.bonus;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Accumulated modifiers for one spell. Instances are immutable; contributions
 * from several sources are merged with {@link #plus(SpellBonus)}.
 */
public record SpellBonus(Decrease decrease, Increase increase, Leech leech) {

    public static final SpellBonus EMPTY = new SpellBonus(Decrease.NONE, Increase.NONE, Leech.NONE);

    public SpellBonus {
        Objects.requireNonNull(decrease, "decrease");
        Objects.requireNonNull(increase, "increase");
        Objects.requireNonNull(leech, "leech");
    }

    /**
     * Cooldown and cost reductions, cooldowns in milliseconds.
     */
    public record Decrease(int cooldown, int manaCost, int secondaryGroupCooldown) {
        public static final Decrease NONE = new Decrease(0, 0, 0);

        Decrease plus(Decrease other) {
            return new Decrease(cooldown + other.cooldown,
                    manaCost + other.manaCost,
                    secondaryGroupCooldown + other.secondaryGroupCooldown);
        }
    }

    /**
     * Effect increases. Percentages are whole percent except critical chance,
     * which is in hundredths of a percent.
     */
    public record Increase(boolean area, int damage, int heal, int additionalTarget, int damageReduction,
                           int duration, int criticalDamage, int criticalChance) {
        public static final Increase NONE = new Increase(false, 0, 0, 0, 0, 0, 0, 0);

        Increase plus(Increase other) {
            return new Increase(area || other.area,
                    damage + other.damage,
                    heal + other.heal,
                    additionalTarget + other.additionalTarget,
                    damageReduction + other.damageReduction,
                    duration + other.duration,
                    criticalDamage + other.criticalDamage,
                    criticalChance + other.criticalChance);
        }
    }

    public record Leech(int life, int mana) {
        public static final Leech NONE = new Leech(0, 0);

        Leech plus(Leech other) {
            return new Leech(life + other.life, mana + other.mana);
        }
    }

    /**
     * Field-wise merge. Numeric fields add; the area flag is kept once any side sets it.
     */
    public SpellBonus plus(SpellBonus other) {
        Objects.requireNonNull(other, "other");
        return new SpellBonus(decrease.plus(other.decrease), increase.plus(other.increase), leech.plus(other.leech));
    }

    public int get(SpellBoost boost) {
        return switch (Objects.requireNonNull(boost, "boost")) {
            case COOLDOWN -> decrease.cooldown();
            case MANA -> decrease.manaCost();
            case SECONDARY_GROUP_COOLDOWN -> decrease.secondaryGroupCooldown();
            case ADDITIONAL_TARGET -> increase.additionalTarget();
            case DURATION -> increase.duration();
            case CRITICAL_CHANCE -> increase.criticalChance();
            case CRITICAL_DAMAGE -> increase.criticalDamage();
            case DAMAGE -> increase.damage();
            case DAMAGE_REDUCTION -> increase.damageReduction();
            case HEAL -> increase.heal();
            case LIFE_LEECH -> leech.life();
            case MANA_LEECH -> leech.mana();
        };
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }

    public static SpellBonus of(SpellBoost boost, int value) {
        return builder().with(boost, value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<SpellBoost, Integer> values = new EnumMap<>(SpellBoost.class);
        private boolean area;

        private Builder() {
        }

        public Builder with(SpellBoost boost, int value) {
            values.merge(Objects.requireNonNull(boost, "boost"), value, Integer::sum);
            return this;
        }

        public Builder area(boolean area) {
            this.area = area;
            return this;
        }

        public SpellBonus build() {
            return new SpellBonus(
                    new Decrease(value(SpellBoost.COOLDOWN), value(SpellBoost.MANA),
                            value(SpellBoost.SECONDARY_GROUP_COOLDOWN)),
                    new Increase(area, value(SpellBoost.DAMAGE), value(SpellBoost.HEAL),
                            value(SpellBoost.ADDITIONAL_TARGET), value(SpellBoost.DAMAGE_REDUCTION),
                            value(SpellBoost.DURATION), value(SpellBoost.CRITICAL_DAMAGE),
                            value(SpellBoost.CRITICAL_CHANCE)),
                    new Leech(value(SpellBoost.LIFE_LEECH), value(SpellBoost.MANA_LEECH)));
        }

        private int value(SpellBoost boost) {
            return values.getOrDefault(boost, 0);
        }
    }
}
