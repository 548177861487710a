package net.crnkit.util.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable, validated form of a Grammar from which Parser-s can be
 * derived.
 * Compilation computes which terminals each production can start with and
 * which productions can match the empty string, and rejects grammars that
 * cannot be parsed with a single token of lookahead (overlapping
 * alternatives, several empty alternatives, left recursion).
 * A CompiledGrammar may be shared among threads; the Parser-s created from
 * it may not.
 */
public class CompiledGrammar {

    private final Grammar source;
    private final Map<String, Grammar.Terminal> terminals;
    private final Map<String, Set<String>> firsts;
    private final Set<String> nullables;
    private final Map<Grammar.Production, Set<String>> productionFirsts;

    protected CompiledGrammar(Grammar source) throws InvalidGrammarException {
        this.source = source;
        this.terminals = Collections.unmodifiableMap(source.getTerminals());
        this.firsts = new HashMap<String, Set<String>>();
        this.nullables = new HashSet<String>();
        this.productionFirsts =
            new IdentityHashMap<Grammar.Production, Set<String>>();
        computeFirsts();
        checkAlternatives();
        checkLeftRecursion();
    }

    public Grammar getSource() {
        return source;
    }

    public Grammar.Nonterminal getStartSymbol() {
        return source.getStartSymbol();
    }

    public List<Grammar.Production> getProductions(String name) {
        return source.getProductions(name);
    }

    public Map<String, Grammar.Terminal> getTerminals() {
        return terminals;
    }

    public Grammar.Terminal getTerminal(String name) {
        return terminals.get(name);
    }

    /**
     * The names of the terminals sym can start with.
     */
    public Set<String> getFirst(Grammar.Symbol sym) {
        if (sym instanceof Grammar.Terminal) {
            return Collections.singleton(((Grammar.Terminal) sym).getName());
        } else if (sym instanceof Grammar.Nonterminal) {
            Set<String> ret = firsts.get(
                ((Grammar.Nonterminal) sym).getReference());
            return (ret == null) ? Collections.<String>emptySet() :
                                   Collections.unmodifiableSet(ret);
        } else {
            throw new IllegalArgumentException("Unrecognized symbol " + sym);
        }
    }
    public Set<String> getFirst(Grammar.Production prod) {
        Set<String> ret = productionFirsts.get(prod);
        return (ret == null) ? Collections.<String>emptySet() :
                               Collections.unmodifiableSet(ret);
    }

    /**
     * Whether sym may match without consuming any token, either because it
     * is optional or because it derives the empty string.
     */
    public boolean isSkippable(Grammar.Symbol sym) {
        if ((sym.getFlags() & Grammar.Symbol.SYM_OPTIONAL) != 0)
            return true;
        if (sym instanceof Grammar.Nonterminal)
            return nullables.contains(
                ((Grammar.Nonterminal) sym).getReference());
        return false;
    }
    public boolean isNullable(Grammar.Production prod) {
        for (Grammar.Symbol s : prod.getSymbols()) {
            if (! isSkippable(s)) return false;
        }
        return true;
    }

    private void computeFirsts() {
        for (String name : source.getProductionNames()) {
            firsts.put(name, new LinkedHashSet<String>());
            for (Grammar.Production p : source.getProductions(name)) {
                productionFirsts.put(p, new LinkedHashSet<String>());
            }
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String name : source.getProductionNames()) {
                Set<String> ntFirst = firsts.get(name);
                for (Grammar.Production p : source.getProductions(name)) {
                    Set<String> pFirst = productionFirsts.get(p);
                    for (Grammar.Symbol s : p.getSymbols()) {
                        if (pFirst.addAll(getFirst(s))) changed = true;
                        if (! isSkippable(s)) break;
                    }
                    if (ntFirst.addAll(pFirst)) changed = true;
                    if (! nullables.contains(name) && isNullable(p)) {
                        nullables.add(name);
                        changed = true;
                    }
                }
            }
        }
    }

    private void checkAlternatives() throws InvalidGrammarException {
        for (String name : source.getProductionNames()) {
            List<Grammar.Production> alts = source.getProductions(name);
            Grammar.Production empty = null;
            for (int i = 0; i < alts.size(); i++) {
                Grammar.Production a = alts.get(i);
                if (isNullable(a)) {
                    if (empty != null)
                        throw new InvalidGrammarException("Productions " +
                            empty + " and " + a + " may both match " +
                            "nothing");
                    empty = a;
                }
                for (int j = i + 1; j < alts.size(); j++) {
                    Grammar.Production b = alts.get(j);
                    Set<String> common = new LinkedHashSet<String>(
                        getFirst(a));
                    common.retainAll(getFirst(b));
                    if (! common.isEmpty())
                        throw new InvalidGrammarException("Productions " +
                            a + " and " + b + " may both start with " +
                            common);
                }
            }
        }
    }

    private void checkLeftRecursion(String name, Set<String> stack,
            Set<String> seen) throws InvalidGrammarException {
        if (seen.contains(name)) return;
        if (stack.contains(name))
            throw new InvalidGrammarException("Production " + name +
                                              " is left-recursive");
        stack.add(name);
        for (Grammar.Production p : source.getProductions(name)) {
            for (Grammar.Symbol s : p.getSymbols()) {
                if (s instanceof Grammar.Nonterminal)
                    checkLeftRecursion(
                        ((Grammar.Nonterminal) s).getReference(), stack,
                        seen);
                if (! isSkippable(s)) break;
            }
        }
        stack.remove(name);
        seen.add(name);
    }
    private void checkLeftRecursion() throws InvalidGrammarException {
        Set<String> seen = new HashSet<String>();
        for (String name : source.getProductionNames()) {
            checkLeftRecursion(name, new HashSet<String>(), seen);
        }
    }

    public Parser createParser(TokenSource input, boolean keepAll) {
        return new Parser(this, input, keepAll);
    }
    public Parser createParser(TokenSource input) {
        return createParser(input, false);
    }

    /**
     * Validate and compile the given grammar.
     * The grammar is copied by reference; it must not be modified
     * afterwards.
     */
    public static CompiledGrammar compile(Grammar g)
            throws InvalidGrammarException {
        g.validate();
        return new CompiledGrammar(g);
    }

}
