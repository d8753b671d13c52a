package FSARegex.Synthesis;

/**
 * Arena of (n+1) x n x n partial expressions. Cell (k, i, j) holds the paths from state i to
 * state j whose interior states all have index below k.
 */
public class RegexMatrix {
    private final int size;
    private final String[] cells;

    public RegexMatrix(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Negative matrix size: " + size);
        }
        this.size = size;
        this.cells = new String[(size + 1) * size * size];
    }

    public int size() {
        return size;
    }

    public String get(int k, int i, int j) {
        return cells[index(k, i, j)];
    }

    public void set(int k, int i, int j, String expr) {
        final int idx = index(k, i, j);
        if (cells[idx] != null) {
            throw new IllegalStateException("Cell (" + k + "," + i + "," + j + ") already written");
        }
        cells[idx] = expr;
    }

    private int index(int k, int i, int j) {
        if (k < 0 || k > size || i < 0 || i >= size || j < 0 || j >= size) {
            throw new IndexOutOfBoundsException("(" + k + "," + i + "," + j + ") outside " + size);
        }
        return (k * size + i) * size + j;
    }
}
