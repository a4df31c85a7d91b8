package sh.harold.destiny.wheel.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.harold.destiny.api.data.Collection;
import sh.harold.destiny.api.data.impl.CollectionImpl;
import sh.harold.destiny.api.data.impl.InMemoryStorageBackend;
import sh.harold.destiny.api.data.storage.StorageException;
import sh.harold.destiny.api.wheel.player.PlayerContext;
import sh.harold.destiny.api.wheel.slot.WheelSlot;
import sh.harold.destiny.wheel.config.WheelConfig;
import sh.harold.destiny.wheel.retry.RetryOutcome;
import sh.harold.destiny.wheel.slot.SlotAllocator;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PersistenceGateway Tests")
class PersistenceGatewayTest {

    private FlakyBackend backend;
    private Collection wheel;
    private WheelConfig config;
    private PlayerContext player;

    @BeforeEach
    void setUp() {
        backend = new FlakyBackend();
        wheel = new CollectionImpl("players/test/wheel-of-destiny", backend);
        config = WheelConfig.builder().retryCeiling(3).build();
        player = mock(PlayerContext.class);
        when(player.getId()).thenReturn(UUID.randomUUID());
        when(player.getLevel()).thenReturn(2000);
    }

    private SlotAllocator allocator() {
        return new SlotAllocator(player, config, () -> 0);
    }

    @Test
    @DisplayName("Should write every slot and read them back")
    void shouldRoundTripSlots() {
        SlotAllocator source = allocator();
        source.restore(WheelSlot.GREEN_50, 50);
        source.restore(WheelSlot.GREEN_TOP_75, 12);
        PersistenceGateway gateway = new PersistenceGateway(wheel, config);

        RetryOutcome<WheelSlot> outcome = gateway.saveSlots(source);

        assertThat(outcome.isComplete()).isTrue();
        assertThat(outcome.passes()).isEqualTo(1);
        assertThat(outcome.durable()).hasSize(WheelSlot.COUNT);
        assertThat(wheel.scoped("slots").select("15").getInt("points", -1)).isEqualTo(50);

        SlotAllocator target = allocator();
        assertThat(gateway.loadSlots(target)).isEqualTo(2);
        assertThat(target.snapshot()).isEqualTo(source.snapshot());
    }

    @Test
    @DisplayName("Should retry a slot that fails transiently")
    void shouldRetryTransientFailure() {
        SlotAllocator source = allocator();
        source.restore(WheelSlot.GREEN_50, 30);
        backend.failSlot("15", 2);

        RetryOutcome<WheelSlot> outcome = new PersistenceGateway(wheel, config).saveSlots(source);

        assertThat(outcome.isComplete()).isTrue();
        assertThat(outcome.passes()).isEqualTo(3);
        assertThat(outcome.errorHistory()).containsExactly(1, 1, 0);
        assertThat(wheel.scoped("slots").select("15").getInt("points", -1)).isEqualTo(30);
    }

    @Test
    @DisplayName("Should leave a slot at its last durable value once the ceiling is hit")
    void shouldKeepLastDurableValue() {
        wheel.scoped("slots").set("15", Map.of("points", 7));
        SlotAllocator source = allocator();
        source.restore(WheelSlot.GREEN_50, 30);
        backend.failSlot("15", 10);

        RetryOutcome<WheelSlot> outcome = new PersistenceGateway(wheel, config).saveSlots(source);

        assertThat(outcome.errors()).isEqualTo(1);
        assertThat(outcome.passes()).isEqualTo(3);
        assertThat(outcome.failed()).containsExactly(WheelSlot.GREEN_50);
        assertThat(wheel.scoped("slots").select("15").getInt("points", -1)).isEqualTo(7);
    }

    @Test
    @DisplayName("Should clamp stored values to the slot cap and treat gaps as empty")
    void shouldClampOnLoad() {
        Collection slots = wheel.scoped("slots");
        slots.set("15", Map.of("points", 999));
        slots.set("16", Map.of("points", 3.0));
        SlotAllocator target = allocator();
        target.restore(WheelSlot.BLUE_50, 9);

        new PersistenceGateway(wheel, config).loadSlots(target);

        assertThat(target.getPoints(WheelSlot.GREEN_50)).isEqualTo(50);
        assertThat(target.getPoints(WheelSlot.RED_50)).isEqualTo(3);
        assertThat(target.getPoints(WheelSlot.BLUE_50)).isZero();
    }

    @Test
    @DisplayName("Should trim an allocation left over budget by a partly failed save")
    void shouldTrimOverBudgetAllocation() {
        when(player.getLevel()).thenReturn(80);
        wheel.scoped("slots").set("15", Map.of("points", 30));
        SlotAllocator session = allocator();
        session.restore(WheelSlot.RED_50, 30);
        backend.failSlot("15", 10);
        PersistenceGateway gateway = new PersistenceGateway(wheel, config);

        assertThat(session.usedPoints()).isEqualTo(session.totalPoints(true));
        assertThat(gateway.saveSlots(session).errors()).isEqualTo(1);

        SlotAllocator next = allocator();
        gateway.loadSlots(next);

        assertThat(next.totalPoints(true)).isEqualTo(30);
        assertThat(next.usedPoints()).isEqualTo(30);
        assertThat(next.unusedPoints()).isZero();
        assertThat(next.getPoints(WheelSlot.GREEN_50)).isEqualTo(30);
        assertThat(next.getPoints(WheelSlot.RED_50)).isZero();
    }

    @Test
    @DisplayName("Should trim outer slots before the slots they depend on")
    void shouldTrimOuterSlotsFirst() {
        when(player.getLevel()).thenReturn(110);
        Collection slots = wheel.scoped("slots");
        slots.set("15", Map.of("points", 50));
        slots.set("9", Map.of("points", 40));

        SlotAllocator target = allocator();
        new PersistenceGateway(wheel, config).loadSlots(target);

        assertThat(target.getPoints(WheelSlot.GREEN_50)).isEqualTo(50);
        assertThat(target.getPoints(WheelSlot.GREEN_TOP_75)).isEqualTo(10);
        assertThat(target.usedPoints()).isEqualTo(target.totalPoints(true));
    }

    @Test
    @DisplayName("Should store the gift of life cooldown")
    void shouldStoreGiftCooldown() {
        PersistenceGateway gateway = new PersistenceGateway(wheel, config);

        assertThat(gateway.loadGiftOfLifeCooldown()).isZero();
        assertThat(gateway.saveGiftOfLifeCooldown(36_000)).isTrue();
        assertThat(gateway.loadGiftOfLifeCooldown()).isEqualTo(36_000);
    }

    /**
     * Fails writes to chosen slot keys a set number of times.
     */
    private static final class FlakyBackend extends InMemoryStorageBackend {

        private final Map<String, Integer> failures = new HashMap<>();

        void failSlot(String id, int times) {
            failures.put(id, times);
        }

        @Override
        public CompletableFuture<Void> saveDocument(String collection, String id, Map<String, Object> data) {
            int left = failures.getOrDefault(id, 0);
            if (collection.endsWith("/slots") && left > 0) {
                failures.put(id, left - 1);
                return CompletableFuture.failedFuture(new StorageException("Injected failure for " + id));
            }
            return super.saveDocument(collection, id, data);
        }
    }
}
