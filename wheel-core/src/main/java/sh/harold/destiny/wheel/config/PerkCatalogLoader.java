package sh.harold.destiny.wheel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import sh.harold.destiny.api.wheel.bonus.CombatType;
import sh.harold.destiny.api.wheel.bonus.SpellBonus;
import sh.harold.destiny.api.wheel.bonus.SpellBoost;
import sh.harold.destiny.api.wheel.bonus.SpellGrade;
import sh.harold.destiny.api.wheel.bonus.WheelInstant;
import sh.harold.destiny.api.wheel.bonus.WheelMajor;
import sh.harold.destiny.api.wheel.bonus.WheelStat;
import sh.harold.destiny.api.wheel.player.Vocation;
import sh.harold.destiny.api.wheel.slot.WheelColor;
import sh.harold.destiny.api.wheel.slot.WheelSlot;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static sh.harold.destiny.wheel.config.YamlValues.enumValue;

/**
 * Loads {@link PerkCatalog} tables from {@code wheel-perks.yml}.
 *
 * A malformed entry is skipped with a warning; the rest of the file still loads.
 */
public class PerkCatalogLoader {

    public static final String DEFAULT_RESOURCE = "wheel-perks.yml";

    private static final Logger LOGGER = LoggerFactory.getLogger(PerkCatalogLoader.class);

    private final Yaml yaml;

    public PerkCatalogLoader() {
        this.yaml = new Yaml();
    }

    public PerkCatalog loadCatalog(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return parseCatalog(yaml.load(inputStream));
        } catch (IOException e) {
            LOGGER.warn("Failed to load perk catalog from: {}", path, e);
            return PerkCatalog.empty();
        } catch (Exception e) {
            LOGGER.warn("Failed to parse perk catalog from: {}", path, e);
            return PerkCatalog.empty();
        }
    }

    public PerkCatalog loadCatalogFromResource(String resourcePath) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                LOGGER.warn("Perk catalog resource not found: {}", resourcePath);
                return PerkCatalog.empty();
            }
            return parseCatalog(yaml.load(inputStream));
        } catch (IOException e) {
            LOGGER.warn("Failed to load perk catalog from resource: {}", resourcePath, e);
            return PerkCatalog.empty();
        } catch (Exception e) {
            LOGGER.warn("Failed to parse perk catalog", e);
            return PerkCatalog.empty();
        }
    }

    private PerkCatalog parseCatalog(Object root) {
        if (!(root instanceof Map<?, ?> yamlData)) {
            return PerkCatalog.empty();
        }
        PerkCatalog.Builder builder = PerkCatalog.builder();

        forEachEntry(yamlData.get("dedication"), (vocationKey, colors) -> {
            Vocation vocation = enumValue(Vocation.class, vocationKey);
            forEachEntry(colors, (colorKey, stats) -> {
                WheelColor color = enumValue(WheelColor.class, colorKey);
                forEachEntry(stats, (statKey, value) ->
                        builder.dedication(vocation, color, enumValue(WheelStat.class, statKey), ((Number) value).intValue()));
            });
        });

        forEachEntry(yamlData.get("conviction"), (vocationKey, slots) -> {
            Vocation vocation = enumValue(Vocation.class, vocationKey);
            forEachEntry(slots, (slotKey, perks) -> {
                WheelSlot slot = enumValue(WheelSlot.class, slotKey);
                if (perks instanceof List<?> list) {
                    for (Object perk : list) {
                        try {
                            builder.conviction(vocation, slot, parseConviction((Map<?, ?>) perk));
                        } catch (RuntimeException e) {
                            LOGGER.warn("Skipping conviction perk {} on {}: {}", perk, slot, e.getMessage());
                        }
                    }
                }
            });
        });

        forEachEntry(yamlData.get("spells"), (spell, grades) ->
                forEachEntry(grades, (gradeKey, bonus) ->
                        builder.spellGrade(String.valueOf(spell), enumValue(SpellGrade.class, gradeKey), parseSpellBonus(bonus))));

        forEachEntry(yamlData.get("healing-link"), (spell, percent) ->
                builder.healingLink(String.valueOf(spell), ((Number) percent).intValue()));

        return builder.build();
    }

    private ConvictionPerk parseConviction(Map<?, ?> perk) {
        String type = String.valueOf(perk.get("type"));
        return switch (type) {
            case "stat" -> new ConvictionPerk.Stat(enumValue(WheelStat.class, perk.get("stat")), number(perk, "value"));
            case "resistance" ->
                    new ConvictionPerk.Resistance(enumValue(CombatType.class, perk.get("combat")), number(perk, "value"));
            case "instant" -> new ConvictionPerk.Instant(enumValue(WheelInstant.class, perk.get("instant")));
            case "major" -> new ConvictionPerk.Major(enumValue(WheelMajor.class, perk.get("major")), number(perk, "value"));
            case "spell-grade" -> new ConvictionPerk.SpellGradeUp(String.valueOf(perk.get("spell")));
            case "spell-bonus" ->
                    new ConvictionPerk.SpellBoost(String.valueOf(perk.get("spell")), parseSpellBonus(perk.get("bonus")));
            default -> throw new IllegalArgumentException("Unknown conviction type: " + type);
        };
    }

    private SpellBonus parseSpellBonus(Object raw) {
        SpellBonus.Builder bonus = SpellBonus.builder();
        forEachEntry(raw, (key, value) -> {
            if ("area".equals(key)) {
                bonus.area(Boolean.TRUE.equals(value));
            } else {
                bonus.with(enumValue(SpellBoost.class, key), ((Number) value).intValue());
            }
        });
        return bonus.build();
    }

    private static int number(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException("Missing number '" + key + "'");
        }
        return number.intValue();
    }

    private static void forEachEntry(Object section, EntryConsumer consumer) {
        if (!(section instanceof Map<?, ?> map)) {
            return;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            try {
                consumer.accept(entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                LOGGER.warn("Skipping perk entry '{}': {}", entry.getKey(), e.getMessage());
            }
        }
    }

    @FunctionalInterface
    private interface EntryConsumer {
        void accept(Object key, Object value);
    }
}
