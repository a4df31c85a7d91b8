package sh.harold.destiny.api.wheel.bonus;

/**
 * Upgrade level of a learned spell.
 */
public enum SpellGrade {
    NONE,
    REGULAR,
    UPGRADED;

    public SpellGrade next() {
        return this == NONE ? REGULAR : UPGRADED;
    }

    public SpellGrade previous() {
        return this == UPGRADED ? REGULAR : NONE;
    }
}
