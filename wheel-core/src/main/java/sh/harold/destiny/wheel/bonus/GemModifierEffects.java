package sh.harold.destiny.wheel.bonus;

import sh.harold.destiny.api.wheel.bonus.SpellBonus;
import sh.harold.destiny.api.wheel.gem.BasicModifier;
import sh.harold.destiny.api.wheel.gem.Gem;
import sh.harold.destiny.api.wheel.gem.SupremeModifier;
import sh.harold.destiny.api.wheel.player.Vocation;

/**
 * Turns an active gem's modifiers into aggregator contributions.
 */
final class GemModifierEffects {

    private GemModifierEffects() {
    }

    static void apply(Gem gem, Vocation vocation, BonusAggregator aggregator) {
        applyBasic(gem.basicModifier1(), aggregator);
        applyBasic(gem.basicModifier2(), aggregator);
        applySupreme(gem.supremeModifier(), vocation, aggregator);
    }

    private static void applyBasic(BasicModifier modifier, BonusAggregator aggregator) {
        if (modifier.getResistance() != null) {
            aggregator.addResistance(modifier.getResistance(), modifier.getValue());
        } else if (modifier.getStat() != null) {
            aggregator.addStat(modifier.getStat(), modifier.getValue());
        }
    }

    private static void applySupreme(SupremeModifier modifier, Vocation vocation, BonusAggregator aggregator) {
        // Spell modifiers of another vocation stay inert
        if (!modifier.isAvailableTo(vocation)) {
            return;
        }
        if (modifier.isSpellModifier()) {
            aggregator.addSpellBonus(modifier.getSpell(), SpellBonus.of(modifier.getBoost(), modifier.getValue()));
        } else if (modifier.getStat() != null) {
            aggregator.addStat(modifier.getStat(), modifier.getValue());
        }
    }
}
