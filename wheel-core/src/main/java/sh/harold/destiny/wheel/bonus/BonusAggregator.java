package sh.harold.destiny.wheel.bonus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.destiny.api.wheel.bonus.AvatarSkill;
import sh.harold.destiny.api.wheel.bonus.CombatType;
import sh.harold.destiny.api.wheel.bonus.SpellBonus;
import sh.harold.destiny.api.wheel.bonus.SpellBoost;
import sh.harold.destiny.api.wheel.bonus.SpellGrade;
import sh.harold.destiny.api.wheel.bonus.WheelInstant;
import sh.harold.destiny.api.wheel.bonus.WheelMajor;
import sh.harold.destiny.api.wheel.bonus.WheelOnThink;
import sh.harold.destiny.api.wheel.bonus.WheelStage;
import sh.harold.destiny.api.wheel.bonus.WheelStat;
import sh.harold.destiny.api.wheel.gem.Gem;
import sh.harold.destiny.api.wheel.gem.GemAffinity;
import sh.harold.destiny.api.wheel.player.PlayerContext;
import sh.harold.destiny.api.wheel.player.Vocation;
import sh.harold.destiny.api.wheel.slot.WheelColor;
import sh.harold.destiny.api.wheel.slot.WheelSlot;
import sh.harold.destiny.wheel.config.ConvictionPerk;
import sh.harold.destiny.wheel.config.PerkCatalog;
import sh.harold.destiny.wheel.config.WheelConfig;
import sh.harold.destiny.wheel.gem.GemVault;
import sh.harold.destiny.wheel.slot.SlotAllocator;

import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derived combat modifiers of one player, rebuilt from slots, stages, perks
 * and active gems.
 *
 * <p>Arrays are indexed by enum ordinal. A full recompute resets every derived
 * value before contributions are added, so running it twice on unchanged
 * inputs gives the same result. On-think timers and the conditional major
 * stats set by the tick loop survive a recompute.
 */
public class BonusAggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BonusAggregator.class);

    private final PlayerContext player;
    private final WheelConfig config;
    private final PerkCatalog catalog;
    private final SlotAllocator slots;
    private final GemVault gems;
    private final Clock clock;

    private final int[] stages = new int[WheelStage.values().length];
    private final long[] onThinkTimers = new long[WheelOnThink.values().length];
    private final int[] baseMajorStats = new int[WheelMajor.values().length];
    private final int[] conditionalMajorStats = new int[WheelMajor.values().length];
    private final boolean[] instants = new boolean[WheelInstant.values().length];
    private final int[] stats = new int[WheelStat.values().length];
    private final int[] resistance = new int[CombatType.values().length];
    private final Map<String, SpellBonus> spellBonuses = new HashMap<>();
    private final Map<String, SpellGrade> spellGrades = new LinkedHashMap<>();
    private final Set<String> learnedSpells = new LinkedHashSet<>();

    public BonusAggregator(PlayerContext player, WheelConfig config, PerkCatalog catalog,
                           SlotAllocator slots, GemVault gems, Clock clock) {
        this.player = Objects.requireNonNull(player, "player");
        this.config = Objects.requireNonNull(config, "config");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.slots = Objects.requireNonNull(slots, "slots");
        this.gems = Objects.requireNonNull(gems, "gems");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // Stages

    public void setStage(WheelStage stage, int value) {
        stages[stage.ordinal()] = Math.max(0, Math.min(WheelStage.MAX_STAGE, value));
    }

    public int getStage(WheelStage stage) {
        return stages[stage.ordinal()];
    }

    /**
     * @return the stage of the named perk, 0 for unknown names
     */
    public int getStage(String name) {
        return WheelStage.byName(name).map(this::getStage).orElse(0);
    }

    // Timers

    public void setOnThinkTimer(WheelOnThink timer, long value) {
        onThinkTimers[timer.ordinal()] = value;
    }

    public long getOnThinkTimer(WheelOnThink timer) {
        return onThinkTimers[timer.ordinal()];
    }

    // Major stats

    /**
     * Set the conditional part of a major stat. Perk contributions are kept separately
     * and added on read.
     */
    public void setMajorStat(WheelMajor major, int value) {
        conditionalMajorStats[major.ordinal()] = value;
    }

    public int getMajorStat(WheelMajor major) {
        return baseMajorStats[major.ordinal()] + conditionalMajorStats[major.ordinal()];
    }

    public void resetConditionalMajorStats() {
        Arrays.fill(conditionalMajorStats, 0);
    }

    /**
     * @return the major stat while the named instant or stage is active, otherwise 0
     */
    public int getMajorStatConditional(String instantName, WheelMajor major) {
        return getInstant(instantName) ? getMajorStat(major) : 0;
    }

    // Instants

    public void setInstant(WheelInstant instant, boolean active) {
        instants[instant.ordinal()] = active;
    }

    public boolean getInstant(WheelInstant instant) {
        return instants[instant.ordinal()];
    }

    /**
     * Looks the name up as an instant first, then as a stage perk, which counts
     * as active from stage 1.
     */
    public boolean getInstant(String name) {
        Optional<WheelInstant> instant = WheelInstant.byName(name);
        if (instant.isPresent()) {
            return getInstant(instant.get());
        }
        return getStage(name) > 0;
    }

    // Stats and resistances

    public void addStat(WheelStat stat, int value) {
        stats[stat.ordinal()] += value;
    }

    public int getStat(WheelStat stat) {
        return stats[stat.ordinal()];
    }

    public void addResistance(CombatType type, int value) {
        resistance[type.ordinal()] += value;
    }

    public int getResistance(CombatType type) {
        return resistance[type.ordinal()];
    }

    public void resetStats() {
        Arrays.fill(stats, 0);
    }

    public void resetResistance() {
        Arrays.fill(resistance, 0);
    }

    // Spell bonuses

    public void addSpellBonus(String spell, SpellBonus bonus) {
        Objects.requireNonNull(spell, "spell");
        Objects.requireNonNull(bonus, "bonus");
        spellBonuses.merge(spell, bonus, SpellBonus::plus);
    }

    public SpellBonus getSpellBonus(String spell) {
        return spellBonuses.getOrDefault(spell, SpellBonus.EMPTY);
    }

    /**
     * @return the field for the boost kind, 0 if the spell has no bonus
     */
    public int getSpellBonus(String spell, SpellBoost boost) {
        SpellBonus bonus = spellBonuses.get(spell);
        return bonus == null ? 0 : bonus.get(boost);
    }

    public int getSpellAdditionalTarget(String spell) {
        return getSpellBonus(spell, SpellBoost.ADDITIONAL_TARGET);
    }

    public int getSpellAdditionalDuration(String spell) {
        return getSpellBonus(spell, SpellBoost.DURATION);
    }

    public boolean getSpellAdditionalArea(String spell) {
        return getSpellBonus(spell).increase().area();
    }

    // Spell grades

    /**
     * Track a spell granted by the wheel.
     *
     * @return false if it was already tracked
     */
    public boolean addSpellToVector(String spell) {
        return learnedSpells.add(Objects.requireNonNull(spell, "spell"));
    }

    public Set<String> getLearnedSpells() {
        return Collections.unmodifiableSet(learnedSpells);
    }

    public SpellGrade upgradeSpell(String spell) {
        SpellGrade grade = getSpellUpgrade(spell).next();
        spellGrades.put(spell, grade);
        return grade;
    }

    public SpellGrade downgradeSpell(String spell) {
        SpellGrade grade = getSpellUpgrade(spell).previous();
        if (grade == SpellGrade.NONE) {
            spellGrades.remove(spell);
        } else {
            spellGrades.put(spell, grade);
        }
        return grade;
    }

    public SpellGrade getSpellUpgrade(String spell) {
        return spellGrades.getOrDefault(spell, SpellGrade.NONE);
    }

    public void resetUpgradedSpells() {
        spellGrades.clear();
        learnedSpells.clear();
    }

    public int getHealingLinkUpgrade(String spell) {
        return getInstant(WheelInstant.HEALING_LINK) ? catalog.getHealingLinkBonus(spell) : 0;
    }

    // Avatar

    /**
     * Stage of the vocation's avatar perk.
     */
    public int getAvatarStage() {
        return WheelStage.forColor(WheelColor.PURPLE, player.getVocation()).map(this::getStage).orElse(0);
    }

    public boolean isAvatarActive() {
        return getOnThinkTimer(WheelOnThink.AVATAR_SPELL) > clock.millis();
    }

    /**
     * Start the avatar window.
     *
     * @return false if the player has no avatar stage
     */
    public boolean activateAvatar(long durationMillis) {
        if (getAvatarStage() == 0) {
            return false;
        }
        setOnThinkTimer(WheelOnThink.AVATAR_SPELL, clock.millis() + durationMillis);
        return true;
    }

    /**
     * @return the skill's value for the current avatar stage, 0 while no avatar is running
     */
    public int checkAvatarSkill(AvatarSkill skill) {
        if (skill == AvatarSkill.NONE || !isAvatarActive()) {
            return 0;
        }
        return skill.getValue(getAvatarStage());
    }

    // Mitigation

    /**
     * Share of damage absorbed by the mitigation stat and the avatar, within
     * {@code 0 .. 1 - floor}.
     */
    public double calculateMitigation() {
        return clampMitigation(stats[WheelStat.MITIGATION.ordinal()] / 10000.0
                + checkAvatarSkill(AvatarSkill.DAMAGE_REDUCTION) / 100.0);
    }

    /**
     * As {@link #calculateMitigation()}, also counting the resistance to {@code type}.
     */
    public double calculateMitigation(CombatType type) {
        return clampMitigation(stats[WheelStat.MITIGATION.ordinal()] / 10000.0
                + checkAvatarSkill(AvatarSkill.DAMAGE_REDUCTION) / 100.0
                + resistance[type.ordinal()] / 10000.0);
    }

    public double getMitigationMultiplier() {
        return 1.0 - calculateMitigation();
    }

    public double getMitigationMultiplier(CombatType type) {
        return 1.0 - calculateMitigation(type);
    }

    private double clampMitigation(double value) {
        return Math.max(0.0, Math.min(1.0 - config.getMitigationFloor(), value));
    }

    // Recompute

    /**
     * Rebuild every derived value from current slots, gems and perks.
     */
    public void registerPlayerBonusData() {
        resetStats();
        resetResistance();
        Arrays.fill(stages, 0);
        Arrays.fill(baseMajorStats, 0);
        Arrays.fill(instants, false);
        spellBonuses.clear();
        resetUpgradedSpells();
        gems.resetRevelationBonus();

        Vocation vocation = player.getVocation();
        applyDedication(vocation);
        applyConviction(vocation);
        applyRevelation(vocation);
        for (Gem gem : gems.getActiveGems()) {
            GemModifierEffects.apply(gem, vocation, this);
        }
        for (Map.Entry<String, SpellGrade> entry : spellGrades.entrySet()) {
            catalog.getSpellGradeBonus(entry.getKey(), entry.getValue())
                    .ifPresent(bonus -> addSpellBonus(entry.getKey(), bonus));
        }
    }

    /**
     * Recompute after login, once slots and gems are loaded.
     */
    public void loadPlayerBonusData() {
        registerPlayerBonusData();
        LOGGER.debug("Loaded bonus data for player {}", player.getId());
    }

    /**
     * Recompute after a slot or gem change.
     */
    public void reloadPlayerData() {
        registerPlayerBonusData();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Reloaded bonus data for player {}: {}", player.getId(), describe());
        }
    }

    private void applyDedication(Vocation vocation) {
        for (WheelColor color : WheelColor.values()) {
            int points = slots.getPointsByColor(color);
            if (points == 0) {
                continue;
            }
            catalog.getDedication(vocation, color).forEach((stat, perPoint) -> addStat(stat, perPoint * points));
        }
    }

    private void applyConviction(Vocation vocation) {
        for (WheelSlot slot : WheelSlot.values()) {
            if (!slots.isSlotFull(slot)) {
                continue;
            }
            for (ConvictionPerk perk : catalog.getConviction(vocation, slot)) {
                applyConvictionPerk(perk);
            }
        }
    }

    private void applyConvictionPerk(ConvictionPerk perk) {
        if (perk instanceof ConvictionPerk.Stat stat) {
            addStat(stat.stat(), stat.value());
        } else if (perk instanceof ConvictionPerk.Resistance res) {
            addResistance(res.type(), res.value());
        } else if (perk instanceof ConvictionPerk.Instant instant) {
            setInstant(instant.instant(), true);
        } else if (perk instanceof ConvictionPerk.Major major) {
            baseMajorStats[major.major().ordinal()] += major.value();
        } else if (perk instanceof ConvictionPerk.SpellGradeUp grade) {
            addSpellToVector(grade.spell());
            upgradeSpell(grade.spell());
        } else if (perk instanceof ConvictionPerk.SpellBoost boost) {
            addSpellBonus(boost.spell(), boost.bonus());
        }
    }

    private void applyRevelation(Vocation vocation) {
        for (Gem gem : gems.getActiveGems()) {
            gems.addRevelationBonus(gem.affinity(), config.getRevelationPoints(gem.quality()));
        }
        for (GemAffinity affinity : GemAffinity.values()) {
            WheelColor color = affinity.getColor();
            int total = slots.getPointsByColor(color) + gems.getRevelationBonus(affinity);
            int stage = 0;
            for (int s = 1; s <= WheelStage.MAX_STAGE; s++) {
                if (total >= config.getStageThreshold(s)) {
                    stage = s;
                }
            }
            int reached = stage;
            WheelStage.forColor(color, vocation).ifPresent(perk -> setStage(perk, reached));
        }
    }

    /**
     * Human-readable dump of every non-zero derived value.
     */
    public String describe() {
        Map<String, Object> values = new TreeMap<>();
        for (WheelStage stage : WheelStage.values()) {
            if (stages[stage.ordinal()] != 0) {
                values.put("stage." + stage, stages[stage.ordinal()]);
            }
        }
        for (WheelStat stat : WheelStat.values()) {
            if (stats[stat.ordinal()] != 0) {
                values.put("stat." + stat, stats[stat.ordinal()]);
            }
        }
        for (CombatType type : CombatType.values()) {
            if (resistance[type.ordinal()] != 0) {
                values.put("resistance." + type, resistance[type.ordinal()]);
            }
        }
        for (WheelMajor major : WheelMajor.values()) {
            if (getMajorStat(major) != 0) {
                values.put("major." + major, getMajorStat(major));
            }
        }
        for (WheelInstant instant : WheelInstant.values()) {
            if (instants[instant.ordinal()]) {
                values.put("instant." + instant, true);
            }
        }
        spellBonuses.forEach((spell, bonus) -> values.put("spell." + spell, bonus));
        spellGrades.forEach((spell, grade) -> values.put("grade." + spell, grade));
        return values.toString();
    }
}
