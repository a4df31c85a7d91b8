package sh.harold.destiny.wheel.scroll;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.destiny.api.data.Collection;
import sh.harold.destiny.api.wheel.player.PromotionScroll;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Promotion scrolls a player has unlocked, stored under {@code scrolls} with
 * one key per scroll.
 */
public class ScrollBook {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScrollBook.class);
    private static final String UNLOCKED = "unlocked";

    private final Collection scrolls;
    private final Set<PromotionScroll> unlocked = EnumSet.noneOf(PromotionScroll.class);

    /**
     * @param wheel the player's wheel namespace
     */
    public ScrollBook(Collection wheel) {
        this.scrolls = Objects.requireNonNull(wheel, "wheel").scoped("scrolls");
    }

    public void load() {
        unlocked.clear();
        for (PromotionScroll scroll : PromotionScroll.values()) {
            try {
                boolean stored = scrolls.get(scroll.getKey())
                        .map(document -> document.getBoolean(UNLOCKED, false))
                        .orElse(false);
                if (stored) {
                    unlocked.add(scroll);
                }
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to read scroll {} in {}", scroll.getKey(), scrolls.getName(), e);
            }
        }
    }

    /**
     * Unlock a scroll. Unlocking one twice changes nothing.
     *
     * @return false if the scroll could not be stored
     */
    public boolean unlockScroll(PromotionScroll scroll) {
        Objects.requireNonNull(scroll, "scroll");
        if (unlocked.contains(scroll)) {
            return true;
        }
        try {
            scrolls.set(scroll.getKey(), Map.of(UNLOCKED, true));
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to store scroll {} in {}", scroll.getKey(), scrolls.getName(), e);
            return false;
        }
        unlocked.add(scroll);
        LOGGER.debug("Unlocked scroll {} in {}", scroll.getKey(), scrolls.getName());
        return true;
    }

    public boolean isUnlocked(PromotionScroll scroll) {
        return unlocked.contains(scroll);
    }

    public Set<PromotionScroll> getUnlocked() {
        return Collections.unmodifiableSet(unlocked);
    }

    public int getExtraPoints() {
        int sum = 0;
        for (PromotionScroll scroll : unlocked) {
            sum += scroll.getExtraPoints();
        }
        return sum;
    }
}
