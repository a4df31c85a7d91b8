package sh.harold.destiny.wheel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import sh.harold.destiny.api.wheel.gem.GemQuality;
import sh.harold.destiny.api.wheel.slot.SlotTier;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.ObjLongConsumer;

import static sh.harold.destiny.wheel.config.YamlValues.*;

/**
 * YAML loader for {@link WheelConfig}.
 *
 * Loading never fails: a missing or broken file logs a warning and yields
 * {@link WheelConfig#defaults()}.
 */
public class WheelConfigLoader {

    public static final String DEFAULT_RESOURCE = "wheel.yml";

    private static final Logger LOGGER = LoggerFactory.getLogger(WheelConfigLoader.class);

    private final Yaml yaml;

    public WheelConfigLoader() {
        this.yaml = new Yaml();
    }

    /**
     * Loads the configuration from a YAML file.
     *
     * @param configPath The path to the configuration file
     * @return The loaded configuration, or defaults if loading fails
     */
    public WheelConfig loadConfig(Path configPath) {
        try (InputStream inputStream = Files.newInputStream(configPath)) {
            Map<String, Object> yamlData = yaml.load(inputStream);
            return parseConfig(yamlData);
        } catch (IOException e) {
            LOGGER.warn("Failed to load wheel configuration from: {}", configPath, e);
            return WheelConfig.defaults();
        } catch (Exception e) {
            LOGGER.warn("Failed to parse wheel configuration from: {}", configPath, e);
            return WheelConfig.defaults();
        }
    }

    /**
     * Loads the configuration from a classpath resource.
     *
     * @param resourcePath The resource path
     * @return The loaded configuration, or defaults if loading fails
     */
    public WheelConfig loadConfigFromResource(String resourcePath) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                LOGGER.warn("Configuration resource not found: {}", resourcePath);
                return WheelConfig.defaults();
            }
            Map<String, Object> yamlData = yaml.load(inputStream);
            return parseConfig(yamlData);
        } catch (IOException e) {
            LOGGER.warn("Failed to load wheel configuration from resource: {}", resourcePath, e);
            return WheelConfig.defaults();
        } catch (Exception e) {
            LOGGER.warn("Failed to parse wheel configuration", e);
            return WheelConfig.defaults();
        }
    }

    private WheelConfig parseConfig(Map<String, Object> yamlData) {
        if (yamlData == null) {
            return WheelConfig.defaults();
        }

        WheelConfig.Builder builder = WheelConfig.builder();

        Map<String, Object> points = getSection(yamlData, "points");
        if (points != null) {
            builder.minLevel(getInt(points, "min-level", 50));
            builder.pointsPerLevel(getInt(points, "per-level", 1));
        }

        Map<String, Object> slots = getSection(yamlData, "slots");
        // Tier labels are numbers, so SnakeYAML hands back Integer keys
        Object caps = slots != null ? slots.get("caps") : null;
        if (caps instanceof Map<?, ?> capMap) {
            for (Map.Entry<?, ?> entry : capMap.entrySet()) {
                if (entry.getValue() instanceof Number number) {
                    builder.slotCap(SlotTier.fromLabel(Integer.parseInt(String.valueOf(entry.getKey()))), number.intValue());
                }
            }
        }

        Map<String, Object> stages = getSection(yamlData, "stages");
        if (stages != null) {
            int[] thresholds = getIntList(stages, "thresholds", 3);
            if (thresholds != null) {
                builder.stageThresholds(thresholds[0], thresholds[1], thresholds[2]);
            }
        }

        Map<String, Object> gems = getSection(yamlData, "gems");
        if (gems != null) {
            builder.maxRevealedGems(getInt(gems, "max-revealed", 225));
            readPerQuality(gems, "reveal-cost", builder::revealCost);
            readPerQuality(gems, "rotate-cost", builder::rotateCost);
            readPerQuality(gems, "revelation-points", (quality, value) -> builder.revelationPoints(quality, (int) value));
        }

        Map<String, Object> persistence = getSection(yamlData, "persistence");
        if (persistence != null) {
            builder.retryCeiling(getInt(persistence, "retry-ceiling", 3));
        }

        Map<String, Object> mitigation = getSection(yamlData, "mitigation");
        if (mitigation != null) {
            builder.mitigationFloor(getDouble(mitigation, "floor", 0.10));
        }

        Map<String, Object> tick = getSection(yamlData, "tick");
        if (tick != null) {
            builder.masteryIntervalMillis(getDuration(tick.get("mastery-interval"), Duration.ofSeconds(2)).toMillis());
        }

        Map<String, Object> gift = getSection(yamlData, "gift-of-life");
        if (gift != null) {
            int[] heal = getIntList(gift, "heal-percent", 3);
            if (heal != null) {
                builder.giftOfLifeHealPercent(heal[0], heal[1], heal[2]);
            }
            Object cooldown = gift.get("cooldown");
            if (cooldown instanceof List<?> list && list.size() == 3) {
                builder.giftOfLifeCooldownSeconds(
                        (int) getDuration(list.get(0), Duration.ofHours(30)).toSeconds(),
                        (int) getDuration(list.get(1), Duration.ofHours(20)).toSeconds(),
                        (int) getDuration(list.get(2), Duration.ofHours(10)).toSeconds());
            }
            builder.giftOfLifeSpellCooldownReductionMillis(
                    getDuration(gift.get("spell-cooldown-reduction"), Duration.ofMinutes(1)).toMillis());
        }

        WheelConfig config = builder.build();
        LOGGER.debug("Loaded {}", config);
        return config;
    }

    private void readPerQuality(Map<String, Object> gems, String key, ObjLongConsumer<GemQuality> sink) {
        Map<String, Object> section = getSection(gems, key);
        if (section == null) {
            return;
        }
        for (GemQuality quality : GemQuality.values()) {
            long value = getLong(section, quality.name().toLowerCase(Locale.ROOT), -1);
            if (value >= 0) {
                sink.accept(quality, value);
            }
        }
    }
}
