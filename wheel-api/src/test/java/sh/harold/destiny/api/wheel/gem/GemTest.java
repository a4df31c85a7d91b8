package sh.harold.destiny.api.wheel.gem;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Gem Tests")
class GemTest {

    @Test
    @DisplayName("Should round-trip every affinity and quality")
    void shouldRoundTrip() {
        int n = 0;
        for (GemAffinity affinity : GemAffinity.values()) {
            for (GemQuality quality : GemQuality.values()) {
                Gem gem = new Gem(String.valueOf(n++), n % 2 == 0, affinity, quality,
                        BasicModifier.FIRE_RESISTANCE, BasicModifier.VOCATION_LIFE, SupremeModifier.DODGE);

                assertThat(Gem.fromMap(gem.uuid(), gem.toMap())).contains(gem);
            }
        }
    }

    @Test
    @DisplayName("Should accept numbers stored as doubles")
    void shouldAcceptDoubles() {
        Gem gem = new Gem("17", true, GemAffinity.RED, GemQuality.EPIC,
                BasicModifier.ICE_RESISTANCE, BasicModifier.NONE, SupremeModifier.SORCERER_HELLS_CORE_DAMAGE);
        Map<String, Object> stored = new HashMap<>();
        gem.toMap().forEach((key, value) -> stored.put(key, value instanceof Integer i ? i.doubleValue() : value));

        assertThat(Gem.fromMap("17", stored)).contains(gem);
    }

    @Test
    @DisplayName("Should reject missing, empty or malformed values")
    void shouldRejectMalformed() {
        Map<String, Object> unknownOrdinal = new HashMap<>(Gem.EMPTY.withLocked(false).toMap());
        unknownOrdinal.put(Gem.FIELD_QUALITY, 99);

        assertThat(Gem.fromMap("1", null)).isEmpty();
        assertThat(Gem.fromMap("1", Map.of())).isEmpty();
        assertThat(Gem.fromMap("1", Map.of(Gem.FIELD_LOCKED, true))).isEmpty();
        assertThat(Gem.fromMap("1", unknownOrdinal)).isEmpty();
    }

    @Test
    @DisplayName("Should identify the sentinel")
    void shouldIdentifySentinel() {
        assertThat(Gem.EMPTY.isEmpty()).isTrue();
        assertThat(Gem.EMPTY.withAffinity(GemAffinity.BLUE).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should pair affinities symmetrically")
    void shouldPairAffinities() {
        for (GemAffinity affinity : GemAffinity.values()) {
            assertThat(affinity.getPartner()).isNotEqualTo(affinity);
            assertThat(affinity.getPartner().getPartner()).isEqualTo(affinity);
        }
    }
}
