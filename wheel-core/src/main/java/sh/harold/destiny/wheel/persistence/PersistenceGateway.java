package sh.harold.destiny.wheel.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.destiny.api.data.Collection;
import sh.harold.destiny.api.wheel.slot.WheelSlot;
import sh.harold.destiny.wheel.config.WheelConfig;
import sh.harold.destiny.wheel.retry.RetryOutcome;
import sh.harold.destiny.wheel.retry.RetryPassLoop;
import sh.harold.destiny.wheel.slot.SlotAllocator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads the slot allocation at login and writes it back at logout.
 *
 * <p>Slots live under {@code slots}, one key per slot id. Saving goes through
 * a {@link RetryPassLoop}; a slot that is still failing when the ceiling is
 * reached keeps whatever value was stored before.
 */
public class PersistenceGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(PersistenceGateway.class);

    static final String POINTS = "points";
    static final String COOLDOWN = "cooldown";

    private final Collection slots;
    private final Collection giftOfLife;
    private final RetryPassLoop<WheelSlot> saveLoop;

    /**
     * @param wheel  the player's wheel namespace
     * @param config source of the retry ceiling
     */
    public PersistenceGateway(Collection wheel, WheelConfig config) {
        Objects.requireNonNull(wheel, "wheel");
        this.slots = wheel.scoped("slots");
        this.giftOfLife = wheel.scoped("gift-of-life");
        this.saveLoop = new RetryPassLoop<>("slot save " + wheel.getName(), config.getRetryCeiling());
    }

    /**
     * Replace the allocator's points with the stored ones. Unreadable slots load as 0.
     * A stored allocation over the current budget, as left by a partly failed save,
     * is trimmed from the outermost slots inwards until it fits.
     *
     * @return number of slots holding points
     */
    public int loadSlots(SlotAllocator allocator) {
        allocator.clear();
        int loaded = 0;
        for (WheelSlot slot : WheelSlot.values()) {
            int points;
            try {
                points = slots.get(key(slot)).map(document -> document.getInt(POINTS, 0)).orElse(0);
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to read slot {} from {}", slot.getId(), slots.getName(), e);
                points = 0;
            }
            if (points > 0) {
                allocator.restore(slot, Math.min(points, allocator.maxPointsForSlot(slot)));
                loaded++;
            }
        }
        int excess = allocator.usedPoints() - allocator.totalPoints(true);
        if (excess > 0) {
            LOGGER.warn("Stored allocation in {} is {} points over budget, trimming", slots.getName(), excess);
            trim(allocator, excess);
        }
        LOGGER.info("Loaded {} wheel slots from {}", loaded, slots.getName());
        return loaded;
    }

    // Outer slots go first so every remaining slot keeps its predecessor chain
    private static void trim(SlotAllocator allocator, int excess) {
        List<WheelSlot> order = new ArrayList<>(List.of(WheelSlot.values()));
        order.sort(Comparator.comparingInt(WheelSlot::distanceToCenter).reversed()
                .thenComparing(Comparator.comparingInt(WheelSlot::getId).reversed()));
        for (WheelSlot slot : order) {
            if (excess <= 0) {
                break;
            }
            int points = allocator.getPoints(slot);
            int removed = Math.min(points, excess);
            if (removed > 0) {
                allocator.restore(slot, points - removed);
                excess -= removed;
            }
        }
    }

    /**
     * Write every slot. The returned error count is 0 once all slots are durable.
     */
    public RetryOutcome<WheelSlot> saveSlots(SlotAllocator allocator) {
        int[] values = allocator.snapshot();
        List<WheelSlot> entries = new ArrayList<>(List.of(WheelSlot.values()));
        RetryOutcome<WheelSlot> outcome = saveLoop.run(entries,
                slot -> slots.set(key(slot), Map.of(POINTS, values[slot.getId()])).exists());
        if (outcome.isComplete()) {
            LOGGER.info("Saved {} wheel slots to {} in {} passes", outcome.durable().size(), slots.getName(),
                    outcome.passes());
        } else {
            LOGGER.warn("Saving {} left {} slots at their previous value: {}", slots.getName(),
                    outcome.errors(), outcome.failed());
        }
        return outcome;
    }

    public long loadGiftOfLifeCooldown() {
        try {
            return giftOfLife.get(COOLDOWN).map(document -> document.getLong(COOLDOWN, 0L)).orElse(0L);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to read gift of life cooldown from {}", giftOfLife.getName(), e);
            return 0;
        }
    }

    public boolean saveGiftOfLifeCooldown(long seconds) {
        try {
            giftOfLife.set(COOLDOWN, Map.of(COOLDOWN, seconds));
            return true;
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to store gift of life cooldown in {}", giftOfLife.getName(), e);
            return false;
        }
    }

    private static String key(WheelSlot slot) {
        return Integer.toString(slot.getId());
    }
}
