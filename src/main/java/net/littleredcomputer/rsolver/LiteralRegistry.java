package net.littleredcomputer.rsolver;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The distinct literal names of a formula, in order of first occurrence. The
 * position of a name in this list is the literal's index everywhere else: in
 * resolved tokens, in {@link Assignment}s, and as the branching order of the
 * search.
 */
public final class LiteralRegistry {
    private final ImmutableList<String> names;
    private final ImmutableMap<String, Integer> nameIndex;  // inverse of above mapping

    private LiteralRegistry(Iterable<String> names) {
        Map<String, Integer> m = new LinkedHashMap<>();
        for (String name : names) m.putIfAbsent(name, m.size());
        this.nameIndex = ImmutableMap.copyOf(m);
        this.names = ImmutableList.copyOf(m.keySet());
    }

    public static LiteralRegistry of(List<Token> tokens) {
        return new LiteralRegistry(() -> tokens.stream().filter(Token::isLiteral).map(Token::name).iterator());
    }

    public int size() { return names.size(); }

    public boolean isEmpty() { return names.isEmpty(); }

    public ImmutableList<String> names() { return names; }

    public String name(int index) { return names.get(index); }

    /** @return the index of the named literal, or -1 if the formula doesn't mention it */
    public int indexOf(String name) {
        Integer ix = nameIndex.get(name);
        return ix == null ? Token.UNRESOLVED : ix;
    }

    /**
     * Bind each literal token to its index in this registry. Tokens of other
     * types are passed through unchanged.
     *
     * @param tokens the token stream this registry was built from
     * @return a new token list in which every literal is resolved
     */
    public ImmutableList<Token> resolve(List<Token> tokens) {
        ImmutableList.Builder<Token> b = ImmutableList.builderWithExpectedSize(tokens.size());
        for (Token t : tokens) {
            if (!t.isLiteral()) {
                b.add(t);
                continue;
            }
            int ix = indexOf(t.name());
            if (ix == Token.UNRESOLVED) throw new IllegalArgumentException("literal not in registry: " + t.name());
            b.add(t.withIndex(ix));
        }
        return b.build();
    }

    @Override
    public String toString() { return String.join(" ", names); }
}
