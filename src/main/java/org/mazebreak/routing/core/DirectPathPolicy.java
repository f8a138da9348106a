package org.mazebreak.routing.core;

/**
 * Whether a floor-only route between the corners may win over a breach route.
 */
public enum DirectPathPolicy {
    /** Every answer routes through exactly one converted wall tile. */
    REQUIRE_BREACH,
    /** The floor-only route competes with breach routes; ties go to the floor-only route. */
    ALLOW_DIRECT
}
