package sh.harold.destiny.wheel.slot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.destiny.api.wheel.player.PlayerContext;
import sh.harold.destiny.api.wheel.slot.WheelColor;
import sh.harold.destiny.api.wheel.slot.WheelSlot;
import sh.harold.destiny.wheel.config.WheelConfig;
import sh.harold.destiny.wheel.retry.RetryOutcome;
import sh.harold.destiny.wheel.retry.RetryPassLoop;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntSupplier;

/**
 * Point distribution across the 36 slots.
 *
 * <p>Points are indexed by slot id, so index 0 is never used. Every accepted
 * change keeps the allocation within the player's budget and each slot within
 * its cap; rejected changes leave the allocation untouched.
 */
public class SlotAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SlotAllocator.class);

    private final PlayerContext player;
    private final WheelConfig config;
    private final IntSupplier extraPoints;
    private final RetryPassLoop<WheelSlot> batchLoop;
    private final int[] points = new int[WheelSlot.COUNT + 1];

    /**
     * @param player      the owning player
     * @param config      caps and level thresholds
     * @param extraPoints points granted on top of the level budget
     */
    public SlotAllocator(PlayerContext player, WheelConfig config, IntSupplier extraPoints) {
        this.player = Objects.requireNonNull(player, "player");
        this.config = Objects.requireNonNull(config, "config");
        this.extraPoints = Objects.requireNonNull(extraPoints, "extraPoints");
        // A slot can wait on a predecessor that comes later in the batch, once per chain step
        this.batchLoop = new RetryPassLoop<>("slot batch " + player.getId(), SlotLayout.MAX_DEPTH + 1);
    }

    public int totalPoints(boolean includeExtra) {
        int base = Math.max(0, player.getLevel() - config.getMinLevel()) * config.getPointsPerLevel();
        return includeExtra ? base + extraPoints.getAsInt() : base;
    }

    public int extraPoints() {
        return extraPoints.getAsInt();
    }

    public int usedPoints() {
        int sum = 0;
        for (int id = 1; id <= WheelSlot.COUNT; id++) {
            sum += points[id];
        }
        return sum;
    }

    /**
     * Budget left. Negative only if the budget shrank after points were placed.
     */
    public int unusedPoints() {
        return totalPoints(true) - usedPoints();
    }

    public int maxPointsForSlot(WheelSlot slot) {
        return config.getSlotCap(slot.getTier());
    }

    public int getPoints(WheelSlot slot) {
        return points[slot.getId()];
    }

    public boolean isSlotFull(WheelSlot slot) {
        int cap = maxPointsForSlot(slot);
        return cap > 0 && points[slot.getId()] >= cap;
    }

    public int getPointsByColor(WheelColor color) {
        int sum = 0;
        for (WheelSlot slot : WheelSlot.values()) {
            if (slot.getColor() == color) {
                sum += points[slot.getId()];
            }
        }
        return sum;
    }

    /**
     * @return true if one more point fits in the slot's cap and in the budget
     */
    public boolean canSelectSlotFullOrPartial(WheelSlot slot) {
        return points[slot.getId()] < maxPointsForSlot(slot) && unusedPoints() > 0;
    }

    /**
     * Whether the slot's prerequisites are met.
     *
     * @param recursive false checks only that an immediate predecessor holds points;
     *                  true also requires that predecessor's own chain to hold points
     */
    public boolean canPlayerSelectPointOnSlot(WheelSlot slot, boolean recursive) {
        if (SlotLayout.isRoot(slot)) {
            return true;
        }
        for (WheelSlot predecessor : SlotLayout.getPredecessors(slot)) {
            if (points[predecessor.getId()] > 0
                    && (!recursive || canPlayerSelectPointOnSlot(predecessor, true))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Validate and store a new value for one slot. Clearing a slot is always allowed.
     *
     * @return false, without changing anything, if the value breaks the cap,
     * the budget or the prerequisite chain
     */
    public boolean checkSavePointsBySlotType(WheelSlot slot, int newPoints) {
        Objects.requireNonNull(slot, "slot");
        if (newPoints < 0) {
            return false;
        }
        int current = points[slot.getId()];
        if (newPoints == 0) {
            points[slot.getId()] = 0;
            return true;
        }
        if (newPoints > maxPointsForSlot(slot)) {
            return false;
        }
        if (newPoints > current && usedPoints() - current + newPoints > totalPoints(true)) {
            return false;
        }
        if (!canPlayerSelectPointOnSlot(slot, true)) {
            return false;
        }
        points[slot.getId()] = newPoints;
        return true;
    }

    /**
     * Apply a full set of requested values. Each entry stands alone: an entry
     * over its cap or over the budget, or a decrease when decreases are not
     * allowed, is rejected while the rest still apply. Entries waiting on a
     * prerequisite later in the batch are retried on following passes.
     *
     * @param requested   desired points, indexed by slot id (index 0 ignored)
     * @param mayDecrease whether the player may lower slots
     */
    public SlotSaveResult applyBatch(int[] requested, boolean mayDecrease) {
        Objects.requireNonNull(requested, "requested");
        if (requested.length != WheelSlot.COUNT + 1) {
            throw new IllegalArgumentException("Expected " + (WheelSlot.COUNT + 1) + " entries, got " + requested.length);
        }

        List<WheelSlot> rejected = new ArrayList<>();
        List<WheelSlot> decreases = new ArrayList<>();
        List<WheelSlot> increases = new ArrayList<>();
        for (WheelSlot slot : WheelSlot.values()) {
            int target = requested[slot.getId()];
            int current = points[slot.getId()];
            if (target == current) {
                continue;
            }
            if (target < 0 || target > maxPointsForSlot(slot) || (target < current && !mayDecrease)) {
                LOGGER.warn("Rejected slot {} change {} -> {} for player {}", slot, current, target, player.getId());
                rejected.add(slot);
            } else if (target < current) {
                decreases.add(slot);
            } else {
                increases.add(slot);
            }
        }

        // Freed points count towards the budget of increases
        int projected = usedPoints();
        for (WheelSlot slot : decreases) {
            projected -= points[slot.getId()] - requested[slot.getId()];
        }
        int budget = totalPoints(true);
        List<WheelSlot> pending = new ArrayList<>(decreases);
        for (WheelSlot slot : increases) {
            int delta = requested[slot.getId()] - points[slot.getId()];
            if (projected + delta > budget) {
                LOGGER.warn("Rejected slot {} change to {} for player {}: over budget", slot,
                        requested[slot.getId()], player.getId());
                rejected.add(slot);
            } else {
                projected += delta;
                pending.add(slot);
            }
        }
        pending.sort((a, b) -> Integer.compare(a.getId(), b.getId()));

        RetryOutcome<WheelSlot> outcome = batchLoop.run(pending,
                slot -> checkSavePointsBySlotType(slot, requested[slot.getId()]));
        rejected.addAll(outcome.failed());
        rejected.sort((a, b) -> Integer.compare(a.getId(), b.getId()));

        LOGGER.debug("Player {} slot batch: {} applied, {} rejected, {} passes",
                player.getId(), outcome.durable().size(), rejected.size(), outcome.passes());
        return new SlotSaveResult(outcome.durable(), rejected, outcome.passes());
    }

    /**
     * Store a value without validation, used when restoring saved data.
     */
    public void restore(WheelSlot slot, int value) {
        points[slot.getId()] = Math.max(0, value);
    }

    /**
     * @return a copy indexed by slot id
     */
    public int[] snapshot() {
        return Arrays.copyOf(points, points.length);
    }

    public void clear() {
        Arrays.fill(points, 0);
    }
}
