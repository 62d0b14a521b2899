package org.pragmatica.table.grid;

/**
 * Grid configuration options.
 */
public record GridConfig(
    CollisionPolicy collisionPolicy
) {
    public static final GridConfig DEFAULT = new GridConfig(
        CollisionPolicy.CORNERS
    );

    public GridConfig withCollisionPolicy(CollisionPolicy policy) {
        return new GridConfig(policy);
    }
}
