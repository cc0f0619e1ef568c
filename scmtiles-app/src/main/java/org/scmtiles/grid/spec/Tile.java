package org.scmtiles.grid.spec;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered set of grid cells that is dispatched to one worker.
 */
public class Tile
        implements Serializable {

    private final int id;
    private final List<Cell> cells;

    public Tile(final int id,
                final List<Cell> cells) {
        if (id < 0) {
            throw new IllegalArgumentException("tile id must not be negative");
        }
        this.id = id;
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public int getId() {
        return id;
    }

    public List<Cell> getCells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    @Override
    public String toString() {
        final String range = cells.isEmpty() ? "empty" :
                             cells.get(0) + " to " + cells.get(cells.size() - 1);
        return "tile " + id + " (" + cells.size() + " cells, " + range + ")";
    }
}
