package sh.harold.destiny.wheel.gem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.destiny.api.data.Collection;
import sh.harold.destiny.api.wheel.gem.Gem;
import sh.harold.destiny.api.wheel.gem.GemAffinity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable gem records for one player. Each revealed gem is its own key under
 * {@code gems/revealed}; active assignments live under {@code gems/active},
 * keyed by affinity name.
 *
 * <p>Reads never throw: an absent or unreadable record reads as missing. Writes
 * report failure through their return value.
 */
public class GemStore {

    static final Comparator<String> UUID_ORDER =
            Comparator.<String>comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private static final Logger LOGGER = LoggerFactory.getLogger(GemStore.class);
    private static final String ACTIVE_UUID = "uuid";

    private final Collection revealed;
    private final Collection active;

    /**
     * @param wheel the player's wheel namespace
     */
    public GemStore(Collection wheel) {
        Collection gems = Objects.requireNonNull(wheel, "wheel").scoped("gems");
        this.revealed = gems.scoped("revealed");
        this.active = gems.scoped("active");
    }

    public Optional<Gem> load(String uuid) {
        try {
            return revealed.get(uuid).flatMap(document -> Gem.fromMap(uuid, document.toMap()));
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to read gem {} from {}", uuid, revealed.getName(), e);
            return Optional.empty();
        }
    }

    /**
     * @return every readable revealed gem, ordered by uuid
     */
    public List<Gem> loadAll() {
        List<Gem> gems = new ArrayList<>();
        List<String> keys;
        try {
            keys = new ArrayList<>(revealed.keys());
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to list gems in {}", revealed.getName(), e);
            return gems;
        }
        keys.sort(UUID_ORDER);
        for (String uuid : keys) {
            Optional<Gem> gem = load(uuid);
            if (gem.isPresent()) {
                gems.add(gem.get());
            } else {
                LOGGER.warn("Skipping malformed gem {} in {}", uuid, revealed.getName());
            }
        }
        return gems;
    }

    public boolean save(Gem gem) {
        if (gem.isEmpty()) {
            throw new IllegalArgumentException("Cannot store the empty gem");
        }
        try {
            revealed.set(gem.uuid(), gem.toMap());
            return true;
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to store gem {}", gem.uuid(), e);
            return false;
        }
    }

    /**
     * @return false only when the delete could not be carried out; a missing key counts as removed
     */
    public boolean remove(String uuid) {
        try {
            revealed.deleteAsync(uuid).join();
            return true;
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to delete gem {}", uuid, e);
            return false;
        }
    }

    public Map<GemAffinity, String> loadActive() {
        Map<GemAffinity, String> assignments = new EnumMap<>(GemAffinity.class);
        for (GemAffinity affinity : GemAffinity.values()) {
            try {
                active.get(affinity.name())
                        .map(document -> document.get(ACTIVE_UUID, ""))
                        .filter(uuid -> !uuid.isEmpty())
                        .ifPresent(uuid -> assignments.put(affinity, uuid));
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to read active {} gem", affinity, e);
            }
        }
        return assignments;
    }

    public boolean saveActive(GemAffinity affinity, String uuid) {
        try {
            active.set(affinity.name(), Map.of(ACTIVE_UUID, uuid));
            return true;
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to store active {} gem", affinity, e);
            return false;
        }
    }

    public boolean removeActive(GemAffinity affinity) {
        try {
            active.deleteAsync(affinity.name()).join();
            return true;
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to clear active {} gem", affinity, e);
            return false;
        }
    }
}
