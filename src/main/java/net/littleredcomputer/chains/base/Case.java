// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

/**
 * The ways two relations can share an endpoint. With r1 = (A, B) and r2 = (C, D):
 * <pre>
 *   ZERO:  no shared endpoint
 *   ONE:   r1.target == r2.source   (A r1 B; B r2 C)
 *   TWO:   r1.target == r2.target   (A r1 B; C r2 B)
 *   THREE: r1.source == r2.source   (B r1 A; B r2 C)
 *   FOUR:  r1.source == r2.target   (B r1 A; C r2 B)
 * </pre>
 * Swapping the two relations (and renaming variables) turns ONE into FOUR and back;
 * the others map to themselves.
 */
public enum Case {
    ZERO,
    ONE,
    TWO,
    THREE,
    FOUR;

    /**
     * @return the case describing the same link once the two relations are swapped
     */
    public Case equivalent() {
        switch (this) {
            case ONE: return FOUR;
            case FOUR: return ONE;
            case ZERO:
            case TWO:
            case THREE:
                return this;
            default:
                throw new IllegalArgumentException("unsupported case: " + this);
        }
    }

    /**
     * Parses either the constant name ("TWO") or its ordinal ("2").
     */
    public static Case parse(String s) {
        String t = s.trim();
        if (!t.isEmpty() && Character.isDigit(t.charAt(0))) {
            int i = Integer.parseInt(t);
            if (i < 0 || i >= values().length) throw new IllegalArgumentException("unknown case: " + s);
            return values()[i];
        }
        return valueOf(t.toUpperCase());
    }
}
