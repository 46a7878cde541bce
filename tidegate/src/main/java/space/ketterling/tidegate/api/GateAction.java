package space.ketterling.tidegate.api;

import space.ketterling.tidegate.model.CrossingEvent.Direction;

/**
 * Physical gate movement for a crossing. The gate is lowered when the tide
 * rises past the threshold and raised again once it falls back.
 */
enum GateAction {
    LOWER("lower"),
    RAISE("raise");

    private final String label;

    GateAction(String label) {
        this.label = label;
    }

    static GateAction of(Direction d) {
        return d == Direction.UP ? LOWER : RAISE;
    }

    String label() {
        return label;
    }
}
