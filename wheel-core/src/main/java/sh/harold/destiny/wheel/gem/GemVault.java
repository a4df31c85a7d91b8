package sh.harold.destiny.wheel.gem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.destiny.api.wheel.gem.Gem;
import sh.harold.destiny.api.wheel.gem.GemAffinity;
import sh.harold.destiny.api.wheel.gem.GemQuality;
import sh.harold.destiny.api.wheel.player.PlayerContext;
import sh.harold.destiny.wheel.config.WheelConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A player's revealed gems and the active gem per affinity.
 *
 * <p>Gems are addressed by index into the revealed list, which is kept in uuid
 * order so indexes stay stable between sessions. Every state change is written
 * to the {@link GemStore} before it is applied in memory; a failed write leaves
 * the vault as it was.
 */
public class GemVault {

    private static final Logger LOGGER = LoggerFactory.getLogger(GemVault.class);

    public static final int NO_INDEX = -1;

    private final PlayerContext player;
    private final WheelConfig config;
    private final GemStore store;
    private final GemRoller roller;
    private final GemIdGenerator ids;
    private final List<Gem> revealed = new ArrayList<>();
    private final Map<GemAffinity, String> active = new EnumMap<>(GemAffinity.class);
    private final int[] revelationBonus = new int[GemAffinity.values().length];

    public GemVault(PlayerContext player, WheelConfig config, GemStore store, GemRoller roller, GemIdGenerator ids) {
        this.player = Objects.requireNonNull(player, "player");
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.roller = Objects.requireNonNull(roller, "roller");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    /**
     * Replace the in-memory state with what storage holds. Active assignments
     * pointing at a missing gem or a gem of another affinity are dropped.
     */
    public void load() {
        revealed.clear();
        active.clear();
        revealed.addAll(store.loadAll());
        store.loadActive().forEach((affinity, uuid) -> {
            Optional<Gem> gem = findGem(uuid);
            if (gem.isPresent() && gem.get().affinity() == affinity) {
                active.put(affinity, uuid);
            } else {
                LOGGER.warn("Dropping stale active {} gem {} for player {}", affinity, uuid, player.getId());
                store.removeActive(affinity);
            }
        });
        LOGGER.debug("Loaded {} gems ({} active) for player {}", revealed.size(), active.size(), player.getId());
    }

    public List<Gem> getRevealedGems() {
        return Collections.unmodifiableList(revealed);
    }

    /**
     * @return active gems in affinity order
     */
    public List<Gem> getActiveGems() {
        List<Gem> gems = new ArrayList<>(active.size());
        for (String uuid : active.values()) {
            findGem(uuid).ifPresent(gems::add);
        }
        return gems;
    }

    public Gem getGem(int index) {
        if (index < 0 || index >= revealed.size()) {
            return Gem.EMPTY;
        }
        return revealed.get(index);
    }

    public Gem getGem(String uuid) {
        return findGem(uuid).orElse(Gem.EMPTY);
    }

    public Optional<Gem> findGem(String uuid) {
        for (Gem gem : revealed) {
            if (gem.uuid().equals(uuid)) {
                return Optional.of(gem);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the gem's index, or {@link #NO_INDEX}
     */
    public int getGemIndex(String uuid) {
        for (int i = 0; i < revealed.size(); i++) {
            if (revealed.get(i).uuid().equals(uuid)) {
                return i;
            }
        }
        return NO_INDEX;
    }

    /**
     * @return the active gem for the affinity, or {@link Gem#EMPTY}
     */
    public Gem getActiveGem(GemAffinity affinity) {
        String uuid = active.get(affinity);
        return uuid == null ? Gem.EMPTY : getGem(uuid);
    }

    public boolean isActive(Gem gem) {
        return !gem.isEmpty() && gem.uuid().equals(active.get(gem.affinity()));
    }

    public long getRevealCost(GemQuality quality) {
        return config.getRevealCost(quality);
    }

    public long getRotateCost(GemQuality quality) {
        return config.getRotateCost(quality);
    }

    public GemOperationResult revealGem(GemQuality quality) {
        Objects.requireNonNull(quality, "quality");
        if (revealed.size() >= config.getMaxRevealedGems()) {
            return reject("reveal", GemOperationResult.VAULT_FULL);
        }
        long cost = config.getRevealCost(quality);
        if (player.getMoney() < cost) {
            return reject("reveal", GemOperationResult.INSUFFICIENT_FUNDS);
        }

        Gem gem = roller.roll(ids.nextId(), quality, player.getVocation());
        if (!store.save(gem)) {
            return GemOperationResult.STORAGE_FAILURE;
        }
        if (!player.removeMoney(cost)) {
            store.remove(gem.uuid());
            return reject("reveal", GemOperationResult.INSUFFICIENT_FUNDS);
        }
        revealed.add(gem);
        revealed.sort((a, b) -> GemStore.UUID_ORDER.compare(a.uuid(), b.uuid()));
        LOGGER.debug("Player {} revealed {} gem {}", player.getId(), quality, gem.uuid());
        return GemOperationResult.SUCCESS;
    }

    public GemOperationResult destroyGem(int index) {
        Gem gem = getGem(index);
        if (gem.isEmpty()) {
            return reject("destroy", GemOperationResult.NOT_FOUND);
        }
        if (gem.locked()) {
            return reject("destroy", GemOperationResult.LOCKED);
        }
        boolean wasActive = isActive(gem);
        if (!store.remove(gem.uuid())) {
            return GemOperationResult.STORAGE_FAILURE;
        }
        revealed.remove(index);
        if (wasActive) {
            clearActive(gem.affinity());
        }
        LOGGER.debug("Player {} destroyed gem {}", player.getId(), gem.uuid());
        return GemOperationResult.SUCCESS;
    }

    /**
     * Move the gem to its partner affinity. An active assignment under the old
     * affinity is dropped.
     */
    public GemOperationResult switchGemDomain(int index) {
        Gem gem = getGem(index);
        if (gem.isEmpty()) {
            return reject("switch domain of", GemOperationResult.NOT_FOUND);
        }
        if (gem.locked()) {
            return reject("switch domain of", GemOperationResult.LOCKED);
        }
        boolean wasActive = isActive(gem);
        Gem switched = gem.withAffinity(gem.affinity().getPartner());
        if (!store.save(switched)) {
            return GemOperationResult.STORAGE_FAILURE;
        }
        revealed.set(index, switched);
        if (wasActive) {
            clearActive(gem.affinity());
        }
        return GemOperationResult.SUCCESS;
    }

    // The gem write already landed. A leftover active entry points at a missing
    // gem or one of another affinity, and load() drops it.
    private void clearActive(GemAffinity affinity) {
        active.remove(affinity);
        if (!store.removeActive(affinity)) {
            LOGGER.warn("Stale active {} gem left in storage for player {}", affinity, player.getId());
        }
    }

    public GemOperationResult toggleGemLock(int index) {
        Gem gem = getGem(index);
        if (gem.isEmpty()) {
            return reject("lock", GemOperationResult.NOT_FOUND);
        }
        Gem toggled = gem.withLocked(!gem.locked());
        if (!store.save(toggled)) {
            return GemOperationResult.STORAGE_FAILURE;
        }
        revealed.set(index, toggled);
        return GemOperationResult.SUCCESS;
    }

    /**
     * Make the gem at {@code index} the active gem for {@code affinity}.
     * Displacing another gem costs the rotate cost of the displaced gem's quality.
     */
    public GemOperationResult setActiveGem(GemAffinity affinity, int index) {
        Objects.requireNonNull(affinity, "affinity");
        Gem gem = getGem(index);
        if (gem.isEmpty()) {
            return reject("activate", GemOperationResult.NOT_FOUND);
        }
        if (gem.affinity() != affinity) {
            return reject("activate", GemOperationResult.AFFINITY_MISMATCH);
        }
        Gem occupant = getActiveGem(affinity);
        if (occupant.uuid().equals(gem.uuid())) {
            return GemOperationResult.SUCCESS;
        }
        long cost = occupant.isEmpty() ? 0 : config.getRotateCost(occupant.quality());
        if (cost > 0 && player.getMoney() < cost) {
            return reject("activate", GemOperationResult.INSUFFICIENT_FUNDS);
        }
        if (!store.saveActive(affinity, gem.uuid())) {
            return GemOperationResult.STORAGE_FAILURE;
        }
        if (cost > 0 && !player.removeMoney(cost)) {
            restoreActive(affinity, occupant);
            return reject("activate", GemOperationResult.INSUFFICIENT_FUNDS);
        }
        active.put(affinity, gem.uuid());
        return GemOperationResult.SUCCESS;
    }

    public GemOperationResult removeActiveGem(GemAffinity affinity) {
        Objects.requireNonNull(affinity, "affinity");
        if (!active.containsKey(affinity)) {
            return GemOperationResult.NOT_FOUND;
        }
        if (!store.removeActive(affinity)) {
            return GemOperationResult.STORAGE_FAILURE;
        }
        active.remove(affinity);
        return GemOperationResult.SUCCESS;
    }

    public void addRevelationBonus(GemAffinity affinity, int points) {
        revelationBonus[affinity.ordinal()] += points;
    }

    public int getRevelationBonus(GemAffinity affinity) {
        return revelationBonus[affinity.ordinal()];
    }

    public void resetRevelationBonus() {
        Arrays.fill(revelationBonus, 0);
    }

    private void restoreActive(GemAffinity affinity, Gem occupant) {
        if (occupant.isEmpty()) {
            store.removeActive(affinity);
        } else {
            store.saveActive(affinity, occupant.uuid());
        }
    }

    private GemOperationResult reject(String action, GemOperationResult result) {
        LOGGER.warn("Player {} could not {} gem: {}", player.getId(), action, result);
        return result;
    }
}
