package sh.harold.destiny.wheel.network;

import sh.harold.destiny.api.wheel.gem.Gem;
import sh.harold.destiny.api.wheel.gem.GemAffinity;
import sh.harold.destiny.api.wheel.player.PromotionScroll;
import sh.harold.destiny.api.wheel.slot.WheelSlot;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the client needs to draw a wheel, captured at one moment.
 *
 * @param slotPoints   points indexed by slot id, index 0 unused
 * @param activeGems   index into {@code revealedGems} per affinity
 */
public record WheelWindow(
        String ownerId,
        boolean canView,
        int options,
        int vocationClientId,
        int basePoints,
        int extraPoints,
        int[] slotPoints,
        Set<PromotionScroll> unlockedScrolls,
        List<Gem> revealedGems,
        Map<GemAffinity, Integer> activeGems,
        long giftOfLifeCooldown,
        long giftOfLifeTotalCooldown
) {

    public WheelWindow {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(slotPoints, "slotPoints");
        Objects.requireNonNull(unlockedScrolls, "unlockedScrolls");
        Objects.requireNonNull(revealedGems, "revealedGems");
        Objects.requireNonNull(activeGems, "activeGems");
        if (slotPoints.length != WheelSlot.COUNT + 1) {
            throw new IllegalArgumentException("Expected " + (WheelSlot.COUNT + 1) + " slot entries");
        }
        slotPoints = Arrays.copyOf(slotPoints, slotPoints.length);
    }

    /**
     * @return a copy, indexed by slot id
     */
    @Override
    public int[] slotPoints() {
        return Arrays.copyOf(slotPoints, slotPoints.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WheelWindow that)) return false;
        return canView == that.canView
                && options == that.options
                && vocationClientId == that.vocationClientId
                && basePoints == that.basePoints
                && extraPoints == that.extraPoints
                && giftOfLifeCooldown == that.giftOfLifeCooldown
                && giftOfLifeTotalCooldown == that.giftOfLifeTotalCooldown
                && ownerId.equals(that.ownerId)
                && Arrays.equals(slotPoints, that.slotPoints)
                && unlockedScrolls.equals(that.unlockedScrolls)
                && revealedGems.equals(that.revealedGems)
                && activeGems.equals(that.activeGems);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(ownerId, canView, options, vocationClientId, basePoints, extraPoints,
                unlockedScrolls, revealedGems, activeGems, giftOfLifeCooldown, giftOfLifeTotalCooldown);
        return 31 * result + Arrays.hashCode(slotPoints);
    }

    /**
     * Window for a viewer who may not see the wheel.
     */
    public static WheelWindow closed(String ownerId) {
        return new WheelWindow(ownerId, false, 0, 0, 0, 0, new int[WheelSlot.COUNT + 1],
                Set.of(), List.of(), Map.of(), 0, 0);
    }
}
