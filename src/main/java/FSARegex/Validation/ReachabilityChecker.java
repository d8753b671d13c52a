package FSARegex.Validation;

import FSARegex.Model.FSA;
import FSARegex.Model.Transition;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayFIFOQueue;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Forward reachability from the initial state. Symbols are ignored.
 */
public class ReachabilityChecker {

    /**
     * Breadth-first traversal from the initial state.
     * @param fsa - statically valid FSA
     * @return visited states, in visiting order
     */
    public static Set<String> reachableStates(FSA fsa) {
        final Map<String, List<String>> successors = new Object2ObjectOpenHashMap<>();
        for (Transition t : fsa.transitions()) {
            successors.computeIfAbsent(t.source(), s -> new ObjectArrayList<>()).add(t.target());
        }

        final Set<String> visited = new ObjectLinkedOpenHashSet<>();
        final ObjectArrayFIFOQueue<String> queue = new ObjectArrayFIFOQueue<>();
        visited.add(fsa.initial());
        queue.enqueue(fsa.initial());
        while (!queue.isEmpty()) {
            final String current = queue.dequeue();
            for (String succ : successors.getOrDefault(current, List.of())) {
                if (visited.add(succ)) {
                    queue.enqueue(succ);
                }
            }
        }
        return visited;
    }

    /**
     * The FSA is disjoint if fewer states are visited than declared.
     * A non-adjacent duplicate in the state list therefore also counts as disjoint.
     */
    public static boolean isDisjoint(FSA fsa) {
        return reachableStates(fsa).size() != fsa.states().size();
    }
}
