package sh.harold.destiny.api.wheel.bonus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SpellBonus Tests")
class SpellBonusTest {

    private static final SpellBonus FIRST = SpellBonus.builder()
            .with(SpellBoost.COOLDOWN, 2000)
            .with(SpellBoost.DAMAGE, 8)
            .with(SpellBoost.LIFE_LEECH, 100)
            .build();
    private static final SpellBonus SECOND = SpellBonus.builder()
            .with(SpellBoost.DAMAGE, 5)
            .with(SpellBoost.ADDITIONAL_TARGET, 1)
            .area(true)
            .build();
    private static final SpellBonus THIRD = SpellBonus.of(SpellBoost.MANA, 20);

    @Test
    @DisplayName("Should merge field by field")
    void shouldMergeFieldByField() {
        SpellBonus merged = FIRST.plus(SECOND);

        assertThat(merged.get(SpellBoost.COOLDOWN)).isEqualTo(2000);
        assertThat(merged.get(SpellBoost.DAMAGE)).isEqualTo(13);
        assertThat(merged.get(SpellBoost.ADDITIONAL_TARGET)).isEqualTo(1);
        assertThat(merged.get(SpellBoost.LIFE_LEECH)).isEqualTo(100);
        assertThat(merged.increase().area()).isTrue();
    }

    @Test
    @DisplayName("Should be associative and commutative")
    void shouldBeAssociativeAndCommutative() {
        assertThat(FIRST.plus(SECOND).plus(THIRD)).isEqualTo(FIRST.plus(SECOND.plus(THIRD)));
        assertThat(FIRST.plus(SECOND)).isEqualTo(SECOND.plus(FIRST));
        assertThat(FIRST.plus(SpellBonus.EMPTY)).isEqualTo(FIRST);
    }

    @Test
    @DisplayName("Should keep the area flag once set")
    void shouldKeepAreaFlag() {
        assertThat(SECOND.plus(FIRST).increase().area()).isTrue();
        assertThat(FIRST.plus(THIRD).increase().area()).isFalse();
    }

    @Test
    @DisplayName("Should expose every boost kind")
    void shouldExposeEveryBoost() {
        for (SpellBoost boost : SpellBoost.values()) {
            assertThat(SpellBonus.of(boost, 7).get(boost)).isEqualTo(7);
        }
        assertThat(SpellBonus.EMPTY.isEmpty()).isTrue();
    }
}
