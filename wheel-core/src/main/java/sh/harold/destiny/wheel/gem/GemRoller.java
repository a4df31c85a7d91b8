package sh.harold.destiny.wheel.gem;

import sh.harold.destiny.api.wheel.gem.BasicModifier;
import sh.harold.destiny.api.wheel.gem.Gem;
import sh.harold.destiny.api.wheel.gem.GemAffinity;
import sh.harold.destiny.api.wheel.gem.GemQuality;
import sh.harold.destiny.api.wheel.gem.SupremeModifier;
import sh.harold.destiny.api.wheel.player.Vocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Rolls the random parts of a freshly revealed gem.
 */
public class GemRoller {

    private static final BasicModifier[] BASIC = rollableBasic();

    private final Random random;

    public GemRoller(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public Gem roll(String uuid, GemQuality quality, Vocation vocation) {
        GemAffinity affinity = GemAffinity.values()[random.nextInt(GemAffinity.values().length)];
        BasicModifier first = BASIC[random.nextInt(BASIC.length)];
        BasicModifier second = BasicModifier.NONE;
        if (quality.getBasicModifiers() >= 2) {
            // The second roll skips the first modifier so the two differ
            int index = random.nextInt(BASIC.length - 1);
            second = BASIC[index >= first.ordinal() - 1 ? index + 1 : index];
        }
        SupremeModifier supreme = SupremeModifier.NONE;
        if (quality.hasSupremeModifier()) {
            List<SupremeModifier> options = new ArrayList<>();
            for (SupremeModifier modifier : SupremeModifier.values()) {
                if (modifier.isAvailableTo(vocation)) {
                    options.add(modifier);
                }
            }
            supreme = options.get(random.nextInt(options.size()));
        }
        return new Gem(uuid, false, affinity, quality, first, second, supreme);
    }

    private static BasicModifier[] rollableBasic() {
        BasicModifier[] all = BasicModifier.values();
        BasicModifier[] result = new BasicModifier[all.length - 1];
        System.arraycopy(all, 1, result, 0, result.length);
        return result;
    }
}
