package org.lsst.cti.region;

/**
 * The (rows, columns) dimensions of a 2D array.
 */
public class Shape2D {

    private final int rows;
    private final int columns;

    public Shape2D(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("Invalid shape: (" + rows + ", " + columns + ")");
        }
        this.rows = rows;
        this.columns = columns;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int getSize() {
        return rows * columns;
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 41 * hash + this.rows;
        hash = 41 * hash + this.columns;
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Shape2D other = (Shape2D) obj;
        return this.rows == other.rows && this.columns == other.columns;
    }

    @Override
    public String toString() {
        return "(" + rows + ", " + columns + ")";
    }
}
