package sh.harold.destiny.wheel.gem;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.harold.destiny.api.data.Collection;
import sh.harold.destiny.api.data.impl.CollectionImpl;
import sh.harold.destiny.api.data.impl.InMemoryStorageBackend;
import sh.harold.destiny.api.wheel.gem.BasicModifier;
import sh.harold.destiny.api.wheel.gem.Gem;
import sh.harold.destiny.api.wheel.gem.GemAffinity;
import sh.harold.destiny.api.wheel.gem.GemQuality;
import sh.harold.destiny.api.wheel.gem.SupremeModifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GemStore Tests")
class GemStoreTest {

    private Collection wheel;
    private GemStore store;

    @BeforeEach
    void setUp() {
        wheel = new CollectionImpl("players/test/wheel-of-destiny", new InMemoryStorageBackend());
        store = new GemStore(wheel);
    }

    private static Gem gem(String uuid, GemAffinity affinity) {
        return new Gem(uuid, false, affinity, GemQuality.GREATER,
                BasicModifier.EARTH_RESISTANCE, BasicModifier.VOCATION_MANA, SupremeModifier.LIFE_LEECH);
    }

    @Test
    @DisplayName("Should read an absent gem as missing")
    void shouldReadAbsentAsMissing() {
        assertThat(store.load("404")).isEmpty();
    }

    @Test
    @DisplayName("Should read an empty or malformed record as missing")
    void shouldReadMalformedAsMissing() {
        Collection revealed = wheel.scoped("gems").scoped("revealed");
        revealed.set("1", Map.of());
        revealed.set("2", Map.of("locked", "yes"));

        assertThat(store.load("1")).isEmpty();
        assertThat(store.load("2")).isEmpty();
        assertThat(store.loadAll()).isEmpty();
    }

    @Test
    @DisplayName("Should store each gem under its uuid")
    void shouldStoreUnderUuid() {
        Gem gem = gem("77", GemAffinity.PURPLE);

        assertThat(store.save(gem)).isTrue();

        assertThat(store.load("77")).contains(gem);
        assertThat(wheel.scoped("gems").scoped("revealed").keys()).containsExactly("77");
    }

    @Test
    @DisplayName("Should list gems in numeric uuid order")
    void shouldListInUuidOrder() {
        store.save(gem("100", GemAffinity.RED));
        store.save(gem("9", GemAffinity.RED));
        store.save(gem("10", GemAffinity.RED));

        assertThat(store.loadAll()).extracting(Gem::uuid).containsExactly("9", "10", "100");
    }

    @Test
    @DisplayName("Should treat removing a missing gem as done")
    void shouldRemoveMissing() {
        store.save(gem("5", GemAffinity.BLUE));

        assertThat(store.remove("5")).isTrue();
        assertThat(store.remove("5")).isTrue();
        assertThat(store.load("5")).isEmpty();
    }

    @Test
    @DisplayName("Should refuse to store the sentinel")
    void shouldRefuseSentinel() {
        assertThatThrownBy(() -> store.save(Gem.EMPTY)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should keep active assignments per affinity")
    void shouldKeepActiveAssignments() {
        store.saveActive(GemAffinity.GREEN, "1");
        store.saveActive(GemAffinity.RED, "2");
        store.removeActive(GemAffinity.GREEN);

        assertThat(store.loadActive()).containsExactly(Map.entry(GemAffinity.RED, "2"));
    }
}
