package sh.harold.destiny.wheel.config;

import sh.harold.destiny.api.wheel.bonus.SpellBonus;
import sh.harold.destiny.api.wheel.bonus.SpellGrade;
import sh.harold.destiny.api.wheel.bonus.WheelStat;
import sh.harold.destiny.api.wheel.player.Vocation;
import sh.harold.destiny.api.wheel.slot.WheelColor;
import sh.harold.destiny.api.wheel.slot.WheelSlot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static perk tables: what each allocated point (dedication) and each full slot
 * (conviction) grants per vocation, and what each spell grade adds.
 */
public final class PerkCatalog {

    private static final PerkCatalog EMPTY = builder().build();

    private final Map<Vocation, Map<WheelColor, Map<WheelStat, Integer>>> dedication;
    private final Map<Vocation, Map<WheelSlot, List<ConvictionPerk>>> conviction;
    private final Map<String, Map<SpellGrade, SpellBonus>> spellGrades;
    private final Map<String, Integer> healingLink;

    private PerkCatalog(Map<Vocation, Map<WheelColor, Map<WheelStat, Integer>>> dedication,
                        Map<Vocation, Map<WheelSlot, List<ConvictionPerk>>> conviction,
                        Map<String, Map<SpellGrade, SpellBonus>> spellGrades,
                        Map<String, Integer> healingLink) {
        this.dedication = Collections.unmodifiableMap(dedication);
        this.conviction = Collections.unmodifiableMap(conviction);
        this.spellGrades = Collections.unmodifiableMap(spellGrades);
        this.healingLink = Collections.unmodifiableMap(healingLink);
    }

    public static PerkCatalog empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Stat gained per point allocated in a colour.
     */
    public Map<WheelStat, Integer> getDedication(Vocation vocation, WheelColor color) {
        return dedication.getOrDefault(vocation, Map.of()).getOrDefault(color, Map.of());
    }

    public List<ConvictionPerk> getConviction(Vocation vocation, WheelSlot slot) {
        return conviction.getOrDefault(vocation, Map.of()).getOrDefault(slot, List.of());
    }

    /**
     * Bonus for a spell at a grade. Grades do not stack: UPGRADED replaces REGULAR.
     */
    public Optional<SpellBonus> getSpellGradeBonus(String spell, SpellGrade grade) {
        return Optional.ofNullable(spellGrades.getOrDefault(spell, Map.of()).get(grade));
    }

    public boolean hasGrades(String spell) {
        return spellGrades.containsKey(spell);
    }

    /**
     * Extra healing in percent for a spell while Healing Link is active.
     */
    public int getHealingLinkBonus(String spell) {
        return healingLink.getOrDefault(spell, 0);
    }

    public static final class Builder {
        private final Map<Vocation, Map<WheelColor, Map<WheelStat, Integer>>> dedication = new EnumMap<>(Vocation.class);
        private final Map<Vocation, Map<WheelSlot, List<ConvictionPerk>>> conviction = new EnumMap<>(Vocation.class);
        private final Map<String, Map<SpellGrade, SpellBonus>> spellGrades = new HashMap<>();
        private final Map<String, Integer> healingLink = new HashMap<>();

        private Builder() {
        }

        public Builder dedication(Vocation vocation, WheelColor color, WheelStat stat, int perPoint) {
            dedication.computeIfAbsent(Objects.requireNonNull(vocation, "vocation"), v -> new EnumMap<>(WheelColor.class))
                    .computeIfAbsent(Objects.requireNonNull(color, "color"), c -> new EnumMap<>(WheelStat.class))
                    .put(Objects.requireNonNull(stat, "stat"), perPoint);
            return this;
        }

        public Builder conviction(Vocation vocation, WheelSlot slot, ConvictionPerk perk) {
            conviction.computeIfAbsent(Objects.requireNonNull(vocation, "vocation"), v -> new EnumMap<>(WheelSlot.class))
                    .computeIfAbsent(Objects.requireNonNull(slot, "slot"), s -> new ArrayList<>())
                    .add(Objects.requireNonNull(perk, "perk"));
            return this;
        }

        public Builder spellGrade(String spell, SpellGrade grade, SpellBonus bonus) {
            if (grade == SpellGrade.NONE) {
                throw new IllegalArgumentException("Grade NONE carries no bonus");
            }
            spellGrades.computeIfAbsent(Objects.requireNonNull(spell, "spell"), s -> new EnumMap<>(SpellGrade.class))
                    .put(grade, Objects.requireNonNull(bonus, "bonus"));
            return this;
        }

        public Builder healingLink(String spell, int percent) {
            healingLink.put(Objects.requireNonNull(spell, "spell"), percent);
            return this;
        }

        public PerkCatalog build() {
            Map<Vocation, Map<WheelColor, Map<WheelStat, Integer>>> dedicationCopy = new EnumMap<>(Vocation.class);
            dedication.forEach((vocation, byColor) -> {
                Map<WheelColor, Map<WheelStat, Integer>> colors = new EnumMap<>(WheelColor.class);
                byColor.forEach((color, stats) -> colors.put(color, Collections.unmodifiableMap(new EnumMap<>(stats))));
                dedicationCopy.put(vocation, Collections.unmodifiableMap(colors));
            });
            Map<Vocation, Map<WheelSlot, List<ConvictionPerk>>> convictionCopy = new EnumMap<>(Vocation.class);
            conviction.forEach((vocation, bySlot) -> {
                Map<WheelSlot, List<ConvictionPerk>> slots = new EnumMap<>(WheelSlot.class);
                bySlot.forEach((slot, perks) -> slots.put(slot, List.copyOf(perks)));
                convictionCopy.put(vocation, Collections.unmodifiableMap(slots));
            });
            Map<String, Map<SpellGrade, SpellBonus>> gradesCopy = new HashMap<>();
            spellGrades.forEach((spell, grades) -> gradesCopy.put(spell, Collections.unmodifiableMap(new EnumMap<>(grades))));

            return new PerkCatalog(dedicationCopy, convictionCopy, gradesCopy, new HashMap<>(healingLink));
        }
    }
}
