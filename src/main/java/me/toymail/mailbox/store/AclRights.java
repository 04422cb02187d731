package me.toymail.mailbox.store;

import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable bit mask of {@link AclRight}s granted on a mailbox.
 */
public final class AclRights {
    public static final AclRights NONE = new AclRights(0);
    public static final AclRights ALL = new AclRights((1 << AclRight.values().length) - 1);

    private final int bits;

    private AclRights(int bits) {
        this.bits = bits;
    }

    public static AclRights of(AclRight... rights) {
        int bits = 0;
        for (AclRight r : rights) {
            bits |= r.bit();
        }
        return new AclRights(bits);
    }

    public static AclRights fromBits(int bits) {
        if ((bits & ~ALL.bits) != 0) {
            throw new IllegalArgumentException("Unknown ACL bits: 0x" + Integer.toHexString(bits & ~ALL.bits));
        }
        return new AclRights(bits);
    }

    public boolean has(AclRight right) {
        return (bits & right.bit()) != 0;
    }

    public AclRights grant(AclRight... rights) {
        return new AclRights(bits | of(rights).bits);
    }

    public AclRights revoke(AclRight... rights) {
        return new AclRights(bits & ~of(rights).bits);
    }

    public AclRights and(AclRights other) {
        return new AclRights(bits & other.bits);
    }

    public AclRights or(AclRights other) {
        return new AclRights(bits | other.bits);
    }

    public AclRights not() {
        return new AclRights(~bits & ALL.bits);
    }

    public int bits() {
        return bits;
    }

    public Set<AclRight> toSet() {
        Set<AclRight> set = EnumSet.noneOf(AclRight.class);
        for (AclRight r : AclRight.values()) {
            if (has(r)) {
                set.add(r);
            }
        }
        return set;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AclRights && ((AclRights) o).bits == bits;
    }

    @Override
    public int hashCode() {
        return bits;
    }

    @Override
    public String toString() {
        return "AclRights" + toSet();
    }
}
