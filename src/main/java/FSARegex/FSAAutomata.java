package FSARegex;

import FSARegex.Model.FSA;
import FSARegex.Model.Transition;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.serialization.ba.BAWriter;

import java.io.IOException;
import java.io.OutputStream;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Conversion of a validated FSA into an AutomataLib automaton.
 */
public class FSAAutomata {

    /**
     * One NFA state per distinct declared state, in declaration order.
     * The input alphabet is the declared alphabet without duplicates.
     * @param fsa - validated FSA
     * @return equivalent NFA
     */
    public static CompactNFA<String> toNFA(FSA fsa) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(new LinkedHashSet<>(fsa.alphabet()));
        final Set<String> states = new LinkedHashSet<>(fsa.states());
        final Set<String> accepting = new HashSet<>(fsa.accepting());
        final CompactNFA<String> nfa = new CompactNFA<>(alphabet, states.size());

        final Object2IntMap<String> ids = new Object2IntOpenHashMap<>(states.size());
        for (String state : states) {
            ids.put(state, (int) nfa.addState(accepting.contains(state)));
        }
        nfa.setInitial(ids.getInt(fsa.initial()), true);
        for (Transition t : fsa.transitions()) {
            nfa.addTransition(ids.getInt(t.source()), t.symbol(), ids.getInt(t.target()));
        }
        return nfa;
    }

    public static boolean accepts(FSA fsa, List<String> word) {
        return toNFA(fsa).accepts(word);
    }

    public static void writeBA(OutputStream os, FSA fsa) throws IOException {
        final CompactNFA<String> nfa = toNFA(fsa);
        new BAWriter<String>().writeModel(os, nfa, nfa.getInputAlphabet());
    }
}
