package sh.harold.destiny.wheel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.destiny.api.data.Collection;
import sh.harold.destiny.api.data.DataAPI;
import sh.harold.destiny.api.wheel.gem.Gem;
import sh.harold.destiny.api.wheel.gem.GemAffinity;
import sh.harold.destiny.api.wheel.gem.GemQuality;
import sh.harold.destiny.api.wheel.network.WheelMessageReader;
import sh.harold.destiny.api.wheel.network.WheelMessageWriter;
import sh.harold.destiny.api.wheel.player.PlayerContext;
import sh.harold.destiny.api.wheel.player.PromotionScroll;
import sh.harold.destiny.api.wheel.player.Vocation;
import sh.harold.destiny.api.wheel.slot.WheelSlot;
import sh.harold.destiny.wheel.bonus.BonusAggregator;
import sh.harold.destiny.wheel.config.PerkCatalog;
import sh.harold.destiny.wheel.config.WheelConfig;
import sh.harold.destiny.wheel.gem.GemIdGenerator;
import sh.harold.destiny.wheel.gem.GemOperationResult;
import sh.harold.destiny.wheel.gem.GemRoller;
import sh.harold.destiny.wheel.gem.GemStore;
import sh.harold.destiny.wheel.gem.GemVault;
import sh.harold.destiny.wheel.network.WheelCodec;
import sh.harold.destiny.wheel.network.WheelWindow;
import sh.harold.destiny.wheel.persistence.PersistenceGateway;
import sh.harold.destiny.wheel.retry.RetryOutcome;
import sh.harold.destiny.wheel.scroll.ScrollBook;
import sh.harold.destiny.wheel.slot.SlotAllocator;
import sh.harold.destiny.wheel.slot.SlotSaveResult;
import sh.harold.destiny.wheel.tick.DamageHooks;
import sh.harold.destiny.wheel.tick.TickProcessor;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.UUID;

/**
 * The wheel of one player. Wires the slot allocator, gem vault, bonus
 * aggregator, tick processor and persistence to a single {@link PlayerContext}
 * for the lifetime of the session.
 *
 * <p>Not thread-safe. The owner of the player runs every call, and
 * {@link #onLogin()} completes before the first {@link #onThink(boolean)}.
 */
public class PlayerWheel {

    public static final String NAMESPACE = "wheel-of-destiny";

    public static final int OPTIONS_VIEW_ONLY = 0;
    public static final int OPTIONS_CHANGE_ALL = 1;
    public static final int OPTIONS_INCREASE_ONLY = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(PlayerWheel.class);

    private final PlayerContext player;
    private final WheelConfig config;
    private final ScrollBook scrolls;
    private final SlotAllocator slots;
    private final GemVault gems;
    private final BonusAggregator bonus;
    private final TickProcessor tick;
    private final DamageHooks damageHooks;
    private final PersistenceGateway persistence;

    PlayerWheel(PlayerContext player, Collection wheel, WheelConfig config, PerkCatalog catalog,
                Clock clock, Random random) {
        this.player = Objects.requireNonNull(player, "player");
        this.config = Objects.requireNonNull(config, "config");
        this.scrolls = new ScrollBook(wheel);
        this.slots = new SlotAllocator(player, config, () -> scrolls.getExtraPoints() + player.getExtraWheelPoints());
        this.gems = new GemVault(player, config, new GemStore(wheel), new GemRoller(random), new GemIdGenerator(clock));
        this.bonus = new BonusAggregator(player, config, catalog, slots, gems, clock);
        this.tick = new TickProcessor(player, config, bonus, clock);
        this.damageHooks = new DamageHooks(player, bonus);
        this.persistence = new PersistenceGateway(wheel, config);
    }

    /**
     * Bind a wheel to a player, storing under {@code players/<id>/wheel-of-destiny}.
     */
    public static PlayerWheel create(PlayerContext player, DataAPI dataAPI, WheelConfig config, PerkCatalog catalog) {
        return create(player, dataAPI, config, catalog, Clock.systemUTC(), new Random());
    }

    public static PlayerWheel create(PlayerContext player, DataAPI dataAPI, WheelConfig config, PerkCatalog catalog,
                                     Clock clock, Random random) {
        Objects.requireNonNull(dataAPI, "dataAPI");
        Collection wheel = dataAPI.player(player.getId()).scoped(NAMESPACE);
        return new PlayerWheel(player, wheel, config, catalog, clock, random);
    }

    // Session

    public void onLogin() {
        scrolls.load();
        persistence.loadSlots(slots);
        gems.load();
        tick.setGiftOfCooldown(persistence.loadGiftOfLifeCooldown());
        bonus.loadPlayerBonusData();
        tick.onThink(true);
        LOGGER.info("Wheel loaded for player {}: {} of {} points used", player.getId(),
                slots.usedPoints(), slots.totalPoints(true));
    }

    /**
     * Flush the allocation and the gift of life cooldown. Gems are already durable.
     *
     * @return the slot save outcome, with a non-zero error count if some slots kept their old value
     */
    public RetryOutcome<WheelSlot> onLogout() {
        RetryOutcome<WheelSlot> outcome = persistence.saveSlots(slots);
        persistence.saveGiftOfLifeCooldown(tick.getGiftOfCooldown());
        return outcome;
    }

    public boolean onThink(boolean force) {
        return tick.onThink(force);
    }

    // Window

    public boolean canOpenWheel() {
        return player.getVocation() != Vocation.NONE
                && player.getLevel() > config.getMinLevel()
                && player.isPremium()
                && player.isPromoted();
    }

    /**
     * @param ownerId the player whose wheel is being opened
     * @return {@link #OPTIONS_VIEW_ONLY} for another player's wheel, {@link #OPTIONS_CHANGE_ALL}
     * in a temple, otherwise {@link #OPTIONS_INCREASE_ONLY}
     */
    public int getOptions(UUID ownerId) {
        if (!player.getId().equals(ownerId)) {
            return OPTIONS_VIEW_ONLY;
        }
        return player.isInTemple() ? OPTIONS_CHANGE_ALL : OPTIONS_INCREASE_ONLY;
    }

    public WheelWindow getWindow(UUID ownerId) {
        String owner = ownerId.toString();
        if (!canOpenWheel()) {
            return WheelWindow.closed(owner);
        }
        List<Gem> revealed = gems.getRevealedGems();
        Map<GemAffinity, Integer> active = new EnumMap<>(GemAffinity.class);
        for (GemAffinity affinity : GemAffinity.values()) {
            Gem gem = gems.getActiveGem(affinity);
            if (!gem.isEmpty()) {
                active.put(affinity, gems.getGemIndex(gem.uuid()));
            }
        }
        return new WheelWindow(owner, true, getOptions(ownerId), player.getVocation().getClientId(),
                slots.totalPoints(false), slots.extraPoints(), slots.snapshot(), scrolls.getUnlocked(),
                revealed, active, tick.getGiftOfCooldown(), tick.getGiftOfLifeTotalCooldown());
    }

    public void sendOpenWheelWindow(WheelMessageWriter writer, UUID ownerId) {
        WheelCodec.writeWindow(writer, getWindow(ownerId));
    }

    /**
     * Read and apply a slot save request from the client.
     *
     * @return the per-slot outcome; everything is rejected if the player may not change the wheel
     */
    public SlotSaveResult saveSlotPointsRequest(WheelMessageReader reader) {
        int[] requested = WheelCodec.readSlotRequest(reader);
        if (!canOpenWheel()) {
            LOGGER.warn("Player {} sent a wheel save without access", player.getId());
            return SlotSaveResult.rejectedAll(requested, slots.snapshot());
        }
        boolean mayDecrease = getOptions(player.getId()) == OPTIONS_CHANGE_ALL;
        SlotSaveResult result = slots.applyBatch(requested, mayDecrease);
        if (!result.applied().isEmpty()) {
            bonus.reloadPlayerData();
        }
        return result;
    }

    // Gems

    public GemOperationResult revealGem(GemQuality quality) {
        return gems.revealGem(quality);
    }

    public GemOperationResult destroyGem(int index) {
        return reloadOnSuccess(gems.destroyGem(index));
    }

    public GemOperationResult switchGemDomain(int index) {
        return reloadOnSuccess(gems.switchGemDomain(index));
    }

    public GemOperationResult toggleGemLock(int index) {
        return gems.toggleGemLock(index);
    }

    public GemOperationResult setActiveGem(GemAffinity affinity, int index) {
        return reloadOnSuccess(gems.setActiveGem(affinity, index));
    }

    public GemOperationResult removeActiveGem(GemAffinity affinity) {
        return reloadOnSuccess(gems.removeActiveGem(affinity));
    }

    // Scrolls

    public boolean unlockScroll(PromotionScroll scroll) {
        boolean wasUnlocked = scrolls.isUnlocked(scroll);
        boolean stored = scrolls.unlockScroll(scroll);
        if (stored && !wasUnlocked) {
            bonus.reloadPlayerData();
        }
        return stored;
    }

    private GemOperationResult reloadOnSuccess(GemOperationResult result) {
        if (result.isSuccess()) {
            bonus.reloadPlayerData();
        }
        return result;
    }

    public PlayerContext getPlayer() {
        return player;
    }

    public SlotAllocator getSlots() {
        return slots;
    }

    public GemVault getGems() {
        return gems;
    }

    public BonusAggregator getBonus() {
        return bonus;
    }

    public TickProcessor getTick() {
        return tick;
    }

    public DamageHooks getDamageHooks() {
        return damageHooks;
    }

    public ScrollBook getScrolls() {
        return scrolls;
    }
}
