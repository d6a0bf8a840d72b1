package com.tickline.engine;

import com.tickline.core.model.PositionSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Open positions of one run, keyed by symbol and iterated in symbol order.
 * A symbol has at most one position; a position exists only while its
 * quantity is non-zero.
 */
public class PositionLedger {

    private final Map<String, Position> positions = new TreeMap<>();

    /**
     * Record an opening fill: creates the position or averages into the existing one.
     * The caller guarantees the fill has the same direction as any existing position.
     *
     * @return the position after the fill
     */
    Position applyOpeningFill(String symbol, double signedShares, double fillPrice, long timestamp) {
        if (signedShares == 0 || !(fillPrice > 0)) {
            throw new IllegalArgumentException("Invalid opening fill for " + symbol
                + ": shares=" + signedShares + ", price=" + fillPrice);
        }
        Position position = positions.get(symbol);
        if (position == null) {
            position = new Position(symbol, signedShares, fillPrice, timestamp);
            positions.put(symbol, position);
        } else {
            if (Math.signum(position.getQuantity()) != Math.signum(signedShares)) {
                throw new IllegalStateException("Opposite-direction fill on " + symbol + " must be preceded by a close");
            }
            position.add(signedShares, fillPrice);
        }
        return position;
    }

    /**
     * Remove a position entirely.
     */
    Position remove(String symbol) {
        return positions.remove(symbol);
    }

    void markToMarket(String symbol, double price) {
        Position position = positions.get(symbol);
        if (position != null) {
            position.markToMarket(price);
        }
    }

    public Optional<Position> get(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public boolean hasPosition(String symbol) {
        return positions.containsKey(symbol);
    }

    public boolean isLong(String symbol) {
        Position position = positions.get(symbol);
        return position != null && position.isLong();
    }

    public boolean isShort(String symbol) {
        Position position = positions.get(symbol);
        return position != null && position.isShort();
    }

    /**
     * Open positions in symbol order.
     */
    public List<Position> getOpenPositions() {
        return new ArrayList<>(positions.values());
    }

    public int size() {
        return positions.size();
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    /**
     * Immutable copies of all open positions, in symbol order.
     */
    public Map<String, PositionSnapshot> snapshot() {
        Map<String, PositionSnapshot> copy = new LinkedHashMap<>();
        for (Position p : positions.values()) {
            copy.put(p.getSymbol(), p.snapshot());
        }
        return Collections.unmodifiableMap(copy);
    }
}
