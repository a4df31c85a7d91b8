package sh.harold.destiny.wheel.config;

import sh.harold.destiny.api.wheel.bonus.CombatType;
import sh.harold.destiny.api.wheel.bonus.SpellBonus;
import sh.harold.destiny.api.wheel.bonus.WheelInstant;
import sh.harold.destiny.api.wheel.bonus.WheelMajor;
import sh.harold.destiny.api.wheel.bonus.WheelStat;

import java.util.Objects;

/**
 * Reward granted once a slot holds its full cap of points.
 */
public sealed interface ConvictionPerk {

    record Stat(WheelStat stat, int value) implements ConvictionPerk {
        public Stat {
            Objects.requireNonNull(stat, "stat");
        }
    }

    record Resistance(CombatType type, int value) implements ConvictionPerk {
        public Resistance {
            Objects.requireNonNull(type, "type");
        }
    }

    record Instant(WheelInstant instant) implements ConvictionPerk {
        public Instant {
            Objects.requireNonNull(instant, "instant");
        }
    }

    record Major(WheelMajor major, int value) implements ConvictionPerk {
        public Major {
            Objects.requireNonNull(major, "major");
        }
    }

    /**
     * Raises the spell one grade, on top of any grade the player learned.
     */
    record SpellGradeUp(String spell) implements ConvictionPerk {
        public SpellGradeUp {
            Objects.requireNonNull(spell, "spell");
        }
    }

    record SpellBoost(String spell, SpellBonus bonus) implements ConvictionPerk {
        public SpellBoost {
            Objects.requireNonNull(spell, "spell");
            Objects.requireNonNull(bonus, "bonus");
        }
    }
}
