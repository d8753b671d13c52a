package FSARegex.Synthesis;

import FSARegex.Model.FSA;
import FSARegex.Model.Transition;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Kleene's construction: state elimination over a matrix of partial expressions.
 * The result is not simplified in any way.
 */
public class RegexSynthesizer {
    public static boolean DEBUG = false;

    /**
     * @param fsa - FSA that passed validation
     * @return regular expression over the FSA's alphabet, "eps" and "{}"
     */
    public static String synthesize(FSA fsa) {
        final long before = System.currentTimeMillis();
        final List<String> states = fsa.states();
        final int n = states.size();
        final Object2IntMap<String> stateIndex = indexStates(states);

        final RegexMatrix matrix = new RegexMatrix(n);
        fillBase(matrix, fsa.transitions(), stateIndex);
        for (int k = 1; k <= n; k++) {
            final int via = k - 1;
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    matrix.set(k, i, j, Regex.eliminate(
                        matrix.get(k - 1, i, via),
                        matrix.get(k - 1, via, via),
                        matrix.get(k - 1, via, j),
                        matrix.get(k - 1, i, j)));
                }
            }
        }

        final String regex = acceptingUnion(fsa, matrix, stateIndex);
        if (DEBUG) {
            final long after = System.currentTimeMillis();
            System.out.println("DEBUG: Matrix " + (n + 1) + "x" + n + "x" + n
                + ", regex length " + regex.length() + ", " + ((after - before) / 1000f) + "s");
        }
        return regex;
    }

    // Later duplicates overwrite earlier ones; a validated FSA has none.
    private static Object2IntMap<String> indexStates(List<String> states) {
        final Object2IntMap<String> stateIndex = new Object2IntOpenHashMap<>(states.size());
        for (int i = 0; i < states.size(); i++) {
            stateIndex.put(states.get(i), i);
        }
        return stateIndex;
    }

    /**
     * R[0][i][j]: direct symbols from i to j, plus eps on the diagonal, or {} when empty.
     */
    private static void fillBase(RegexMatrix matrix, List<Transition> transitions, Object2IntMap<String> stateIndex) {
        final int n = matrix.size();
        final StringBuilder[][] direct = new StringBuilder[n][n];
        for (Transition t : transitions) {
            final int i = stateIndex.getInt(t.source());
            final int j = stateIndex.getInt(t.target());
            if (direct[i][j] == null) {
                direct[i][j] = new StringBuilder(t.symbol());
            } else {
                direct[i][j].append(Regex.UNION).append(t.symbol());
            }
        }

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                final StringBuilder cell = direct[i][j];
                if (i == j) {
                    matrix.set(0, i, j, cell == null ? Regex.EPSILON : cell + Regex.UNION + Regex.EPSILON);
                } else {
                    matrix.set(0, i, j, cell == null ? Regex.EMPTY_SET : cell.toString());
                }
            }
        }
    }

    private static String acceptingUnion(FSA fsa, RegexMatrix matrix, Object2IntMap<String> stateIndex) {
        final int n = matrix.size();
        final int init = stateIndex.getInt(fsa.initial());
        final Set<String> accepting = new HashSet<>(fsa.accepting());

        final StringBuilder sb = new StringBuilder();
        for (String state : fsa.states()) {
            if (accepting.contains(state)) {
                if (sb.length() > 0) {
                    sb.append(Regex.UNION);
                }
                sb.append(Regex.group(matrix.get(n, init, stateIndex.getInt(state))));
            }
        }
        return sb.length() == 0 ? Regex.EMPTY_SET : sb.toString();
    }
}
