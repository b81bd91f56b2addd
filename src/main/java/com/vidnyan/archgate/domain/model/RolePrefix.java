package com.vidnyan.archgate.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of recognized role prefixes.
 */
public enum RolePrefix {
    IDA("ida", Role.INTENT),
    PRX("prx", Role.INTERPRETATION),
    POI("poi", Role.PRODUCTION),
    CFG("cfg", Role.RESOURCE),
    DB("db", Role.RESOURCE),
    STM("stm", Role.DATA_PLANE),
    SVC("svc", Role.CAPABILITY),
    MDW("mdw", Role.CAPABILITY),
    HAL("hal", Role.PLATFORM),
    BSP("bsp", Role.PLATFORM);

    /** Layout-only prefix used for folder grouping; never a role. */
    public static final String RESERVED_LAYOUT_PREFIX = "inf";

    private final String token;
    private final Role role;

    RolePrefix(String token, Role role) {
        this.token = token;
        this.role = role;
    }

    public String token() {
        return token;
    }

    public Role role() {
        return role;
    }

    /**
     * Find the prefix of a file stem, e.g. {@code prx_motor -> PRX}.
     */
    public static Optional<RolePrefix> ofStem(String stem) {
        String lower = stem.toLowerCase(Locale.ROOT);
        for (RolePrefix prefix : values()) {
            if (lower.startsWith(prefix.token + "_") && lower.length() > prefix.token.length() + 1) {
                return Optional.of(prefix);
            }
        }
        return Optional.empty();
    }

    public static boolean isReserved(String stem) {
        return stem.toLowerCase(Locale.ROOT).startsWith(RESERVED_LAYOUT_PREFIX + "_");
    }
}
